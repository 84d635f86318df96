package chessmaster.core.contracts;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.records.SearchResult;

public interface Search {

    /**
     * Picks a move for {@code side} on {@code board}. The board is not modified. Repeated calls on
     * the same position return the same move.
     *
     * @return result whose {@code bestMove} is {@code null} when {@code side} has no legal move
     */
    SearchResult search(Board board, Color side);
}
