package chessmaster.core.board;

import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable 8×8 grid of optional pieces, indexed 0 = a1 .. 63 = h8.
 *
 * <p>The board knows nothing about whose turn it is or how it got here; that belongs to the game
 * that owns it. Pieces are immutable values, so {@link #copy()} is a full value copy.
 */
public final class Board {

    private final Piece[] cells;

    public Board() {
        this.cells = new Piece[Square.SIZE * Square.SIZE];
    }

    private Board(Piece[] cells) {
        this.cells = cells;
    }

    /* ────── access ────── */

    /** @return the piece on {@code sq}, or {@code null} when empty. */
    public Piece get(Square sq) {
        return cells[sq.index()];
    }

    public Piece get(int file, int rank) {
        return Square.isInside(file, rank) ? cells[rank * Square.SIZE + file] : null;
    }

    public boolean isEmpty(Square sq) {
        return cells[sq.index()] == null;
    }

    /** Puts {@code piece} on {@code sq}; {@code null} clears the square. */
    public void set(Square sq, Piece piece) {
        cells[sq.index()] = piece;
    }

    public void clear(Square sq) {
        cells[sq.index()] = null;
    }

    public void clearAll() {
        Arrays.fill(cells, null);
    }

    /* ────── queries ────── */

    /** @return the square holding {@code color}'s king, or {@code null} if it has none. */
    public Square findKing(Color color) {
        for (int i = 0; i < cells.length; i++) {
            Piece p = cells[i];
            if (p != null && p.type() == Type.KING && p.color() == color) return Square.ofIndex(i);
        }
        return null;
    }

    /** Squares occupied by {@code color}, rank 8 down to rank 1, files a to h within a rank. */
    public List<Square> occupiedBy(Color color) {
        List<Square> out = new ArrayList<>(16);
        for (int rank = Square.SIZE - 1; rank >= 0; rank--) {
            for (int file = 0; file < Square.SIZE; file++) {
                Piece p = cells[rank * Square.SIZE + file];
                if (p != null && p.color() == color) out.add(new Square(file, rank));
            }
        }
        return out;
    }

    public int count(Color color, Type type) {
        int n = 0;
        for (Piece p : cells) {
            if (p != null && p.color() == color && p.type() == type) n++;
        }
        return n;
    }

    /* ────── copying ────── */

    /** Deep value copy; never aliases this board. */
    public Board copy() {
        return new Board(cells.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board)) return false;
        return Arrays.equals(cells, ((Board) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    /** Text diagram, rank 8 on top, {@code .} for empty squares. */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(160);
        for (int rank = Square.SIZE - 1; rank >= 0; rank--) {
            sb.append(rank + 1).append(' ');
            for (int file = 0; file < Square.SIZE; file++) {
                Piece p = cells[rank * Square.SIZE + file];
                sb.append(p == null ? '.' : p.symbol());
                if (file < Square.SIZE - 1) sb.append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g h");
        return sb.toString();
    }
}
