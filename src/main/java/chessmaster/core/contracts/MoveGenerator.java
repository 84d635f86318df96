package chessmaster.core.contracts;

import chessmaster.core.board.Board;
import chessmaster.core.board.Square;
import chessmaster.core.records.Move;

import java.util.List;

/**
 * Per-piece movement rules. Nothing here looks at whether the mover's own king ends up in check.
 */
public interface MoveGenerator {

    /**
     * Destinations the piece on {@code from} may reach by its movement pattern and blocking rules.
     * Squares held by the mover's own pieces are never included. Empty {@code from} yields an
     * empty list. The order is fixed for a given board.
     */
    List<Square> pseudoLegalMoves(Board board, Square from);

    /**
     * Geometric test for a single move of the piece on {@code move.from()}.
     *
     * @param attackProbe when {@code true} the destination may hold a piece of either colour; the
     *     question is only whether the piece reaches the square
     */
    boolean isPseudoLegal(Board board, Move move, boolean attackProbe);
}
