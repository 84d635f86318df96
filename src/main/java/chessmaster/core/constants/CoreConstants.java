package chessmaster.core.constants;

import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;

/**
 * Central place for engine-wide compile-time constants.
 */
public final class CoreConstants {

    private CoreConstants() {}

    /* ────────────── Positions ────────────── */
    public static final String START_FEN = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w - - 0 1";

    /* ────────────── Search ────────────── */
    /** Plies looked at by the automated opponent: its own move and the reply. */
    public static final int SEARCH_DEPTH = 2;
    public static final int SCORE_INF = Integer.MAX_VALUE;

    /** The automated opponent always plays the side that moves second. */
    public static final Color AUTOMATED_SIDE = Color.BLACK;

    /* ─────────────── Material values (centipawns) ─────────────── */
    public static final int PAWN_VALUE = 100;
    public static final int KNIGHT_VALUE = 320;
    public static final int BISHOP_VALUE = 330;
    public static final int ROOK_VALUE = 500;
    public static final int QUEEN_VALUE = 900;
    public static final int KING_VALUE = 20000;

    public static int pieceValue(Type type) {
        return switch (type) {
            case PAWN -> PAWN_VALUE;
            case KNIGHT -> KNIGHT_VALUE;
            case BISHOP -> BISHOP_VALUE;
            case ROOK -> ROOK_VALUE;
            case QUEEN -> QUEEN_VALUE;
            case KING -> KING_VALUE;
        };
    }

    /* ─────────────── Direction tables {df, dr} ─────────────── */
    // order is generation order, and so the search's tie-break order
    public static final int[][] KNIGHT_JUMPS = {
            {1, -2}, {2, -1}, {-1, -2}, {-2, -1}, {1, 2}, {2, 1}, {-1, 2}, {-2, 1}
    };
    public static final int[][] ROOK_DIRS = {{1, 0}, {-1, 0}, {0, -1}, {0, 1}};
    public static final int[][] BISHOP_DIRS = {{1, -1}, {1, 1}, {-1, -1}, {-1, 1}};
    public static final int[][] QUEEN_DIRS = {
            {1, 0}, {-1, 0}, {0, -1}, {0, 1}, {1, -1}, {1, 1}, {-1, -1}, {-1, 1}
    };
    public static final int[][] KING_STEPS = {
            {-1, 1}, {-1, 0}, {-1, -1}, {0, 1}, {0, -1}, {1, 1}, {1, 0}, {1, -1}
    };
}
