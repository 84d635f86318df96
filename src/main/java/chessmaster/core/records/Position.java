package chessmaster.core.records;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;

import java.util.Objects;

/**
 * A board plus the side to move, as read from or written to FEN.
 *
 * @param board          piece placement; owned by whoever built the record
 * @param sideToMove     colour to move
 * @param fullmoveNumber FEN move counter, starting at 1
 */
public record Position(Board board, Color sideToMove, int fullmoveNumber) {

    public Position {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(sideToMove, "sideToMove");
        if (fullmoveNumber < 1) {
            throw new IllegalArgumentException("fullmoveNumber must be >= 1, got " + fullmoveNumber);
        }
    }
}
