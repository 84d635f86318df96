package chessmaster.core.records;

import chessmaster.core.board.Square;

import java.util.Objects;

/**
 * A move as an ordered pair of squares. Captures and promotions are not part of the move; they
 * follow from the board the move is applied to.
 *
 * @param from origin square
 * @param to   destination square
 */
public record Move(Square from, Square to) {

    public Move {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    /**
     * Parses long algebraic notation ({@code "e2e4"}). A fifth promotion letter is accepted and
     * ignored because pawns always promote to a queen.
     */
    public static Move parse(String uci) {
        if (uci == null || (uci.length() != 4 && uci.length() != 5)) {
            throw new IllegalArgumentException("Bad move: " + uci);
        }
        return new Move(Square.parse(uci.substring(0, 2)), Square.parse(uci.substring(2, 4)));
    }

    /** Render as long algebraic notation, e.g. “e2e4”. */
    public String toUci() {
        return from.toString() + to;
    }

    @Override
    public String toString() {
        return toUci();
    }
}
