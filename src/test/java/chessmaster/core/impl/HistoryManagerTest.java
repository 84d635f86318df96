package chessmaster.core.impl;

import static org.junit.jupiter.api.Assertions.*;

import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.records.HistoryEntry;
import chessmaster.core.records.Move;
import org.junit.jupiter.api.Test;

import java.util.List;

class HistoryManagerTest {

    private final HistoryManager history = new HistoryManager();

    @Test
    void captureListsFollowEntries() {
        history.record(Move.parse("e2e4"), null, Color.WHITE);
        history.record(Move.parse("d7d5"), null, Color.BLACK);
        history.record(Move.parse("e4d5"), Piece.of(Color.BLACK, Type.PAWN), Color.WHITE);
        history.record(Move.parse("d8d5"), Piece.of(Color.WHITE, Type.PAWN), Color.BLACK);

        assertEquals(4, history.size());
        assertEquals(List.of(Type.PAWN), history.captured(Color.WHITE));
        assertEquals(List.of(Type.PAWN), history.captured(Color.BLACK));

        HistoryEntry last = history.pop();
        assertEquals(Move.parse("d8d5"), last.move());
        assertTrue(history.captured(Color.BLACK).isEmpty());
        assertEquals(List.of(Type.PAWN), history.captured(Color.WHITE));

        history.pop();
        assertTrue(history.captured(Color.WHITE).isEmpty());
        assertEquals(2, history.size());
    }

    @Test
    void popOnEmptyReturnsNull() {
        assertNull(history.pop());
        assertTrue(history.isEmpty());
    }

    @Test
    void viewsAreDetached() {
        history.record(Move.parse("e2e4"), null, Color.WHITE);
        List<HistoryEntry> entries = history.entries();
        assertThrows(UnsupportedOperationException.class, () -> entries.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> history.captured(Color.WHITE).add(Type.PAWN));

        history.clear();
        assertEquals(1, entries.size());
        assertTrue(history.isEmpty());
    }
}
