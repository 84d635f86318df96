package chessmaster.core.contracts;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.records.Move;

import java.util.List;

/**
 * Separates legal moves from pseudo-legal ones by simulating each move on a board copy.
 */
public interface LegalityFilter {

    /**
     * @return {@code true} iff a {@code mover} piece stands on {@code move.from()}, the move is
     *     pseudo-legal on {@code board}, and it does not leave {@code mover}'s king attacked
     */
    boolean isLegal(Board board, Move move, Color mover);

    /**
     * @return {@code true} if some opposing piece attacks {@code color}'s king, and also when
     *     {@code color} has no king on the board
     */
    boolean isKingAttacked(Board board, Color color);

    /** Plays {@code move} on a fresh copy of {@code board}, promoting pawns on the last rank. */
    Board applyOnCopy(Board board, Move move);

    /** All legal moves of {@code color}, origin squares a1 → h8, then generator order. */
    List<Move> legalMoves(Board board, Color color);
}
