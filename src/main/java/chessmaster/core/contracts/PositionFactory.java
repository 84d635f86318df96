package chessmaster.core.contracts;

import chessmaster.core.records.Position;

public interface PositionFactory {

    /** Standard initial set-up, white to move. */
    Position startPosition();

    /**
     * Reads piece placement, side to move and (optionally) the move number from a FEN string.
     * Castling and en-passant fields are accepted but have no effect.
     *
     * @throws IllegalArgumentException if the placement or side field is malformed
     */
    Position fromFen(String fen);

    String toFen(Position position);
}
