package chessmaster.core.records;

import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;

/**
 * One applied move, with everything needed to take it back.
 *
 * @param move     the move as played
 * @param captured the piece that stood on {@code move.to()}, or {@code null}
 * @param mover    the side that made the move
 */
public record HistoryEntry(Move move, Piece captured, Color mover) {

    public boolean isCapture() {
        return captured != null;
    }
}
