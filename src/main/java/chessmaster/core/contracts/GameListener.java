package chessmaster.core.contracts;

import chessmaster.core.records.GamePhase;
import chessmaster.core.records.HistoryEntry;

/**
 * Call-back sink for game changes.
 *
 * <p>A front end implements this to repaint after every mutation. All calls happen on the thread
 * that mutated the game, after the mutation is complete.
 */
public interface GameListener {

    /** A move (human or automated) was applied; {@code phase} is the resulting game phase. */
    default void onMoveApplied(HistoryEntry entry, GamePhase phase) {}

    /** {@code entry} was taken back. */
    default void onUndo(HistoryEntry entry) {}

    /** The board was reset to the initial position or to a loaded one. */
    default void onNewGame() {}
}
