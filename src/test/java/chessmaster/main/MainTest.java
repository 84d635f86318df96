package chessmaster.main;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.impl.LegalityFilterImpl;
import chessmaster.core.impl.MoveGeneratorImpl;
import chessmaster.core.impl.PositionFactoryImpl;
import chessmaster.core.records.Position;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

class MainTest {

    @Test
    void perftCountsLeaves() {
        LegalityFilter lf = new LegalityFilterImpl(new MoveGeneratorImpl());
        Position p = new PositionFactoryImpl().startPosition();
        assertEquals(1, Main.perft(lf, p.board(), p.sideToMove(), 0));
        assertEquals(20, Main.perft(lf, p.board(), p.sideToMove(), 1));
        assertEquals(400, Main.perft(lf, p.board(), p.sideToMove(), 2));
    }

    @Test
    void perftCommandPrintsNodeCount() {
        PrintStream saved = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        try {
            Main.main(new String[] {"perft", "2", "8/8/8/8/8/8/8/K6k", "w", "-", "-", "0", "1"});
        } finally {
            System.setOut(saved);
        }
        // a1 king: a2 b1 b2; each answered by three h1 king moves
        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("Nodes searched: 9"));
    }
}
