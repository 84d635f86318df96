package chessmaster.core.records;

import chessmaster.core.board.Piece.Color;

import java.util.Objects;

/**
 * Life-cycle of a game: running, or ended by checkmate (with the loser) or stalemate.
 *
 * @param status the phase
 * @param loser  side that got mated; {@code null} unless {@code status == CHECKMATE}
 */
public record GamePhase(Status status, Color loser) {

    public enum Status {
        IN_PROGRESS,
        CHECKMATE,
        STALEMATE
    }

    public static final GamePhase IN_PROGRESS = new GamePhase(Status.IN_PROGRESS, null);
    public static final GamePhase STALEMATE = new GamePhase(Status.STALEMATE, null);

    public GamePhase {
        Objects.requireNonNull(status, "status");
        if ((status == Status.CHECKMATE) != (loser != null)) {
            throw new IllegalArgumentException("loser must be set for, and only for, checkmate");
        }
    }

    public static GamePhase checkmate(Color loser) {
        return new GamePhase(Status.CHECKMATE, Objects.requireNonNull(loser, "loser"));
    }

    public boolean isEnded() {
        return status != Status.IN_PROGRESS;
    }

    /** Human readable status line. */
    public String describe() {
        return switch (status) {
            case IN_PROGRESS -> "Game in progress";
            case CHECKMATE -> capitalize(loser.name()) + " is checkmated";
            case STALEMATE -> "Stalemate";
        };
    }

    private static String capitalize(String s) {
        return s.charAt(0) + s.substring(1).toLowerCase();
    }
}
