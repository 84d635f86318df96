package chessmaster.core.board;

/**
 * A cell of the 8×8 board. {@code file} 0–7 maps to a–h, {@code rank} 0–7 maps to 1–8, so
 * A1 = (0,0) and H8 = (7,7).
 */
public record Square(int file, int rank) {

    public static final int SIZE = 8;

    public Square {
        if (!isInside(file, rank)) {
            throw new IllegalArgumentException("Square off the board: (" + file + ", " + rank + ")");
        }
    }

    public static boolean isInside(int file, int rank) {
        return file >= 0 && file < SIZE && rank >= 0 && rank < SIZE;
    }

    /** 0 – 63 index of a square (A1 = 0, H8 = 63). */
    public static Square ofIndex(int index) {
        if (index < 0 || index >= SIZE * SIZE) {
            throw new IllegalArgumentException("Square index out of range: " + index);
        }
        return new Square(index & 7, index >>> 3);
    }

    /** Parses algebraic coordinates such as {@code "e2"}. */
    public static Square parse(String s) {
        if (s == null || s.length() != 2) {
            throw new IllegalArgumentException("Bad square: " + s);
        }
        int file = Character.toLowerCase(s.charAt(0)) - 'a';
        int rank = s.charAt(1) - '1';
        if (!isInside(file, rank)) {
            throw new IllegalArgumentException("Bad square: " + s);
        }
        return new Square(file, rank);
    }

    public int index() {
        return rank * SIZE + file;
    }

    /**
     * @return the square {@code (file + df, rank + dr)}, or {@code null} when that falls off the
     *     board.
     */
    public Square offset(int df, int dr) {
        int f = file + df;
        int r = rank + dr;
        return isInside(f, r) ? new Square(f, r) : null;
    }

    @Override
    public String toString() {
        return "" + (char) ('a' + file) + (char) ('1' + rank);
    }
}
