package chessmaster.core.impl;

import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.records.HistoryEntry;
import chessmaster.core.records.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Move history and captured-piece lists of a single game. Both only grow by {@link #record} and
 * only shrink by {@link #pop}, so they always stay in step.
 */
public final class HistoryManager {

    private final List<HistoryEntry> entries = new ArrayList<>();
    private final Map<Color, List<Type>> captured = new EnumMap<>(Color.class);

    public HistoryManager() {
        for (Color c : Color.values()) captured.put(c, new ArrayList<>());
    }

    /** Pushes an entry and, for a capture, appends the taken type to the mover's list. */
    public HistoryEntry record(Move move, Piece capturedPiece, Color mover) {
        HistoryEntry e = new HistoryEntry(move, capturedPiece, mover);
        entries.add(e);
        if (capturedPiece != null) captured.get(mover).add(capturedPiece.type());
        return e;
    }

    /**
     * Removes the latest entry and, if it was a capture, the latest type from the mover's list.
     *
     * @return the removed entry, or {@code null} if the history is empty
     */
    public HistoryEntry pop() {
        if (entries.isEmpty()) return null;
        HistoryEntry e = entries.remove(entries.size() - 1);
        if (e.isCapture()) {
            List<Type> list = captured.get(e.mover());
            if (!list.isEmpty()) list.remove(list.size() - 1);
        }
        return e;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<HistoryEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Type> captured(Color by) {
        return List.copyOf(captured.get(by));
    }

    /**
     * Clears history and captured lists. Called at the start of a new game.
     */
    public void clear() {
        entries.clear();
        for (List<Type> list : captured.values()) list.clear();
    }
}
