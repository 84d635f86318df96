package chessmaster.core.contracts;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.records.GamePhase;

/**
 * Classifies a position for the side about to move.
 */
public interface GameStateEvaluator {

    /**
     * @return {@link GamePhase#IN_PROGRESS} while {@code toMove} has a legal move, otherwise
     *     checkmate of {@code toMove} or stalemate depending on whether its king is attacked
     */
    GamePhase evaluate(Board board, Color toMove);
}
