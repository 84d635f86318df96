package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.constants.CoreConstants;
import chessmaster.core.contracts.Evaluator;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.Search;
import chessmaster.core.records.Move;
import chessmaster.core.records.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fixed two-ply minimax over material, no pruning, no move ordering.
 *
 * <p>Scores are handled from the searching side's point of view: the evaluator's white-minus-black
 * number is multiplied by the side's sign. The reply ply takes the minimum of that (the opponent's
 * best), the root ply keeps the first move with the strictly highest value, so earlier-generated
 * moves win exact ties. A reply-less position (mate or stalemate for the opponent) is scored by
 * material alone.
 */
public final class SearchImpl implements Search {

    private static final Logger log = LoggerFactory.getLogger(SearchImpl.class);

    /* immutable engine parts */
    private final LegalityFilter legality;
    private final Evaluator      evaluator;

    public SearchImpl(LegalityFilter legality, Evaluator evaluator) {
        this.legality  = Objects.requireNonNull(legality, "legality");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public SearchResult search(Board board, Color side) {
        long t0 = System.nanoTime();
        long nodes = 0;

        Move best = null;
        int bestScore = -CoreConstants.SCORE_INF;
        int sign = side.sign();

        for (Move m : legality.legalMoves(board, side)) {
            Board afterOurs = legality.applyOnCopy(board, m);
            List<Move> replies = legality.legalMoves(afterOurs, side.opposite());

            int worst;
            if (replies.isEmpty()) {
                worst = sign * evaluator.evaluate(afterOurs);
                nodes++;
            } else {
                worst = CoreConstants.SCORE_INF;
                for (Move r : replies) {
                    int s = sign * evaluator.evaluate(legality.applyOnCopy(afterOurs, r));
                    nodes++;
                    if (s < worst) worst = s;
                }
            }

            if (best == null || worst > bestScore) {
                bestScore = worst;
                best = m;
            }
        }

        long ms = (System.nanoTime() - t0) / 1_000_000;
        if (best == null) {
            log.debug("{} has no legal move", side);
            return new SearchResult(null, 0, nodes, ms);
        }
        log.debug("{} plays {} (score {} cp, {} nodes, {} ms)", side, best, bestScore, nodes, ms);
        return new SearchResult(best, bestScore, nodes, ms);
    }
}
