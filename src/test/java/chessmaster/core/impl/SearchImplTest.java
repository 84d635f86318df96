package chessmaster.core.impl;

import static org.junit.jupiter.api.Assertions.*;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.contracts.Search;
import chessmaster.core.records.Move;
import chessmaster.core.records.Position;
import chessmaster.core.records.SearchResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SearchImplTest {

    private static final PositionFactory POS = new PositionFactoryImpl();
    private static final LegalityFilter LF = new LegalityFilterImpl(new MoveGeneratorImpl());
    private final Search search = new SearchImpl(LF, new EvaluatorImpl());

    private SearchResult searchFen(String fen) {
        Position p = POS.fromFen(fen);
        return search.search(p.board(), p.sideToMove());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = ';', value = {
            "k7/8/8/8/3Q4/7K/8/3r4 b - - 0 1 ; d1d4",
            "k7/8/8/3q4/8/7K/8/3R4 w - - 0 1 ; d1d5"
    })
    void takesHangingQueen(String fen, String expected) {
        SearchResult r = searchFen(fen);
        assertEquals(Move.parse(expected), r.bestMove());
        assertEquals(500, r.scoreCp());
    }

    @Test
    void avoidsDefendedPawn() {
        // Qxd4 loses the queen to exd4
        SearchResult r = searchFen("3q3k/8/8/8/3P4/4P3/8/7K b - - 0 1");
        assertNotEquals(Move.parse("d8d4"), r.bestMove());
        assertEquals(700, r.scoreCp());
    }

    @Test
    void firstGeneratedMoveWinsTies() {
        // no capture is possible within two plies, so all twenty moves score 0
        SearchResult r = searchFen(POS.toFen(POS.startPosition()));
        assertEquals(Move.parse("a2a3"), r.bestMove());
        assertEquals(0, r.scoreCp());
    }

    @Test
    void answersKingsPawnWithQueensideKnight() {
        // b8 is the first black piece scanned with a move; a7a6 would hang the pawn to Bxa6
        SearchResult r = searchFen("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b - - 0 1");
        assertEquals(Move.parse("b8c6"), r.bestMove());
        assertEquals(0, r.scoreCp());
    }

    @Test
    void mateEarnsNoBonus() {
        // Ra8 mates, but it scores the same material as every other quiet move
        Position p = POS.fromFen("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1");
        Board afterMate = LF.applyOnCopy(p.board(), Move.parse("a1a8"));
        assertTrue(LF.legalMoves(afterMate, Color.BLACK).isEmpty());

        SearchResult r = search.search(p.board(), Color.WHITE);
        assertEquals(Move.parse("a1b1"), r.bestMove());
        assertEquals(500 - 300, r.scoreCp());
    }

    @Test
    void prefersMaterialOverMate() {
        // Ra8 mates at -20; exd4 wins the knight for +300
        Position p = POS.fromFen("6k1/5ppp/8/8/3n4/4P3/8/R5K1 w - - 0 1");
        Board afterMate = LF.applyOnCopy(p.board(), Move.parse("a1a8"));
        assertTrue(LF.legalMoves(afterMate, Color.BLACK).isEmpty());
        assertTrue(LF.isKingAttacked(afterMate, Color.BLACK));

        SearchResult r = search.search(p.board(), Color.WHITE);
        assertEquals(Move.parse("e3d4"), r.bestMove());
        assertEquals(600 - 300, r.scoreCp());
    }

    @Test
    void stalematingReplyIsScoredByMaterial() {
        // Qf7 stalemates black; material is 900 for white either way
        Position p = POS.fromFen("7k/8/6K1/8/8/8/8/5Q2 w - - 0 1");
        Board afterStalemate = LF.applyOnCopy(p.board(), Move.parse("f1f7"));
        assertTrue(LF.legalMoves(afterStalemate, Color.BLACK).isEmpty());
        assertFalse(LF.isKingAttacked(afterStalemate, Color.BLACK));

        assertEquals(900, search.search(p.board(), Color.WHITE).scoreCp());
    }

    @Test
    void noLegalMoveGivesEmptyResult() {
        SearchResult r = searchFen("7k/5Q2/6K1/8/8/8/8/8 b - - 0 1");
        assertFalse(r.hasMove());
        assertNull(r.bestMove());
    }

    @Test
    void isDeterministicAndLeavesBoardAlone() {
        Position p = POS.fromFen("r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R w - - 0 3");
        Board before = p.board().copy();

        SearchResult a = search.search(p.board(), Color.WHITE);
        SearchResult b = search.search(p.board(), Color.WHITE);

        assertEquals(a.bestMove(), b.bestMove());
        assertEquals(a.scoreCp(), b.scoreCp());
        assertEquals(a.nodes(), b.nodes());
        assertEquals(before, p.board());
    }

    @Test
    void countsEveryReplyAsANode() {
        // 20 moves for white, 20 replies each
        Position p = POS.startPosition();
        assertEquals(400, search.search(p.board(), Color.WHITE).nodes());
    }
}
