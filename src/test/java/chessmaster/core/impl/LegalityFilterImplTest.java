package chessmaster.core.impl;

import static org.junit.jupiter.api.Assertions.*;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.board.Square;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.records.Move;
import chessmaster.core.records.Position;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

class LegalityFilterImplTest {

    private static final PositionFactory POS = new PositionFactoryImpl();
    private static final LegalityFilter  LEGAL = new LegalityFilterImpl(new MoveGeneratorImpl());

    private static Board board(String fen) {
        return POS.fromFen(fen).board();
    }

    @Test
    void pinnedPieceMayOnlyMoveAlongThePin() {
        Board b = board("4k3/4r3/8/8/8/8/4R3/4K3 w - - 0 1");
        assertFalse(LEGAL.isLegal(b, Move.parse("e2d2"), Color.WHITE));
        assertTrue(LEGAL.isLegal(b, Move.parse("e2e5"), Color.WHITE));
        assertTrue(LEGAL.isLegal(b, Move.parse("e2e7"), Color.WHITE));
    }

    @Test
    void kingMayNotStepIntoAttack() {
        Board b = board("4k3/8/8/8/8/8/r7/4K3 w - - 0 1");
        assertFalse(LEGAL.isLegal(b, Move.parse("e1e2"), Color.WHITE));
        assertTrue(LEGAL.isLegal(b, Move.parse("e1f1"), Color.WHITE));
    }

    @Test
    void checkMustBeAnswered() {
        Board b = board("4k3/8/8/8/8/8/3P4/r3K2R w - - 0 1");
        assertTrue(LEGAL.isKingAttacked(b, Color.WHITE));
        Set<String> legal = LEGAL.legalMoves(b, Color.WHITE).stream()
                .map(Move::toUci).collect(Collectors.toSet());
        // d1 is attacked by the rook; e2 and f2 are free; f1 is attacked
        assertEquals(Set.of("e1e2", "e1f2"), legal);
    }

    @Test
    void wrongColourOrEmptySquareIsIllegal() {
        Board b = POS.startPosition().board();
        assertFalse(LEGAL.isLegal(b, Move.parse("e7e5"), Color.WHITE));
        assertFalse(LEGAL.isLegal(b, Move.parse("e4e5"), Color.WHITE));
        assertFalse(LEGAL.isLegal(b, Move.parse("e2e5"), Color.WHITE));
        assertTrue(LEGAL.isLegal(b, Move.parse("e2e4"), Color.WHITE));
    }

    @Test
    void missingKingCountsAsAttacked() {
        Board b = board("8/8/8/8/8/8/4P3/8 w - - 0 1");
        assertTrue(LEGAL.isKingAttacked(b, Color.WHITE));
        assertTrue(LEGAL.isKingAttacked(b, Color.BLACK));
        // every move leaves the (absent) king attacked
        assertTrue(LEGAL.legalMoves(b, Color.WHITE).isEmpty());
    }

    @Test
    void pawnAttacksOnlyDiagonally() {
        assertTrue(LEGAL.isKingAttacked(board("8/8/8/3k4/4P3/8/8/K7 b - - 0 1"), Color.BLACK));
        assertFalse(LEGAL.isKingAttacked(board("8/8/8/3k4/3P4/8/8/K7 b - - 0 1"), Color.BLACK));
        // black pawns attack downwards
        assertTrue(LEGAL.isKingAttacked(board("7k/8/8/8/3p4/4K3/8/8 w - - 0 1"), Color.WHITE));
        assertFalse(LEGAL.isKingAttacked(board("7k/8/8/8/4p3/4K3/8/8 w - - 0 1"), Color.WHITE));
    }

    @Test
    void kingsAttackEachOther() {
        assertTrue(LEGAL.isKingAttacked(board("8/8/8/4k3/4K3/8/8/8 w - - 0 1"), Color.WHITE));
    }

    @Test
    void applyOnCopyPromotesAndLeavesOriginalAlone() {
        Board b = board("4k3/1P6/8/8/8/8/8/4K3 w - - 0 1");
        Board after = LEGAL.applyOnCopy(b, Move.parse("b7b8"));

        assertEquals(Piece.of(Color.WHITE, Type.QUEEN), after.get(Square.parse("b8")));
        assertNull(after.get(Square.parse("b7")));
        assertEquals(Piece.of(Color.WHITE, Type.PAWN), b.get(Square.parse("b7")));
        // the new queen gives check along the back rank
        assertTrue(LEGAL.isKingAttacked(after, Color.BLACK));
    }

    @Test
    void legalMovesFollowSquareOrder() {
        List<Move> moves = LEGAL.legalMoves(POS.startPosition().board(), Color.WHITE);
        assertEquals(20, moves.size());
        // second rank first, then the knights
        assertEquals(Move.parse("a2a3"), moves.get(0));
        assertEquals(Move.parse("a2a4"), moves.get(1));
        assertEquals(Move.parse("h2h4"), moves.get(15));
        assertEquals(Move.parse("b1c3"), moves.get(16));
        assertEquals(Move.parse("b1a3"), moves.get(17));
        assertEquals(Move.parse("g1h3"), moves.get(18));
        assertEquals(Move.parse("g1f3"), moves.get(19));
    }

    @Test
    void legalMovesNeverLeaveOwnKingAttacked() {
        for (long seed = 1; seed <= 6; seed++) {
            Random rng = new Random(seed);
            Position p = POS.startPosition();
            Board b = p.board();
            Color side = p.sideToMove();

            for (int ply = 0; ply < 60; ply++) {
                List<Move> moves = LEGAL.legalMoves(b, side);
                if (moves.isEmpty()) break;
                for (Move m : moves) {
                    Board after = LEGAL.applyOnCopy(b, m);
                    assertFalse(LEGAL.isKingAttacked(after, side),
                            "seed " + seed + " ply " + ply + " move " + m + " leaves king attacked");
                    assertTrue(LEGAL.isLegal(b, m, side));
                }
                b = LEGAL.applyOnCopy(b, moves.get(rng.nextInt(moves.size())));
                side = side.opposite();
            }
        }
    }
}
