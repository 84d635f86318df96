package chessmaster.core.board;

import java.util.Objects;

/**
 * Immutable identity of a chess piece: its kind and its colour, nothing else.
 *
 * <p>Pieces are not tracked across moves; the board cell they occupy is their only location.
 */
public record Piece(Type type, Color color) {

    /** The six piece kinds of orthodox chess. */
    public enum Type {
        PAWN('p'),
        KNIGHT('n'),
        BISHOP('b'),
        ROOK('r'),
        QUEEN('q'),
        KING('k');

        private final char letter;

        Type(char letter) {
            this.letter = letter;
        }

        /** Lower-case FEN letter. */
        public char letter() {
            return letter;
        }

        public static Type fromLetter(char c) {
            char lc = Character.toLowerCase(c);
            for (Type t : values()) {
                if (t.letter == lc) return t;
            }
            throw new IllegalArgumentException("Unknown piece letter: " + c);
        }
    }

    /** The two sides. White moves towards rank 8, black towards rank 1. */
    public enum Color {
        WHITE,
        BLACK;

        public Color opposite() {
            return this == WHITE ? BLACK : WHITE;
        }

        /** Rank delta of a single pawn step. */
        public int pawnDirection() {
            return this == WHITE ? 1 : -1;
        }

        /** Rank the pawns start on; the only rank a double step is allowed from. */
        public int pawnHomeRank() {
            return this == WHITE ? 1 : 6;
        }

        /** Rank on which a pawn of this colour turns into a queen. */
        public int promotionRank() {
            return this == WHITE ? 7 : 0;
        }

        /** +1 for white, -1 for black; the sign of this side's material in a score. */
        public int sign() {
            return this == WHITE ? 1 : -1;
        }
    }

    public Piece {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(color, "color must not be null");
    }

    public static Piece of(Color color, Type type) {
        return new Piece(type, color);
    }

    /** FEN letter: upper case for white, lower case for black. */
    public static Piece fromSymbol(char c) {
        Type type = Type.fromLetter(c);
        return new Piece(type, Character.isUpperCase(c) ? Color.WHITE : Color.BLACK);
    }

    public char symbol() {
        return color == Color.WHITE ? Character.toUpperCase(type.letter()) : type.letter();
    }

    public Piece withType(Type newType) {
        return new Piece(newType, color);
    }

    public boolean is(Type t) {
        return type == t;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol());
    }
}
