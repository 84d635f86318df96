package chessmaster.core.records;

/**
 * Outcome of one automated-opponent search.
 *
 * @param bestMove move to play, or {@code null} when the side has no legal move
 * @param scoreCp  material score of the chosen line in centipawns, from the searching side's
 *                 point of view (positive = good for that side)
 * @param nodes    number of leaf positions evaluated
 * @param timeMs   wall-clock time consumed by the search
 */
public record SearchResult(Move bestMove, int scoreCp, long nodes, long timeMs) {

    public boolean hasMove() {
        return bestMove != null;
    }
}
