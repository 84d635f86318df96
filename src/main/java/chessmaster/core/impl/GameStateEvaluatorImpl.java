package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.contracts.GameStateEvaluator;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.records.GamePhase;

import java.util.Objects;

/**
 * Checkmate / stalemate detection. Repetition, the fifty-move rule and insufficient material are
 * not considered.
 */
public final class GameStateEvaluatorImpl implements GameStateEvaluator {

    private final LegalityFilter legality;

    public GameStateEvaluatorImpl(LegalityFilter legality) {
        this.legality = Objects.requireNonNull(legality, "legality");
    }

    @Override
    public GamePhase evaluate(Board board, Color toMove) {
        if (!legality.legalMoves(board, toMove).isEmpty()) return GamePhase.IN_PROGRESS;
        return legality.isKingAttacked(board, toMove)
                ? GamePhase.checkmate(toMove)
                : GamePhase.STALEMATE;
    }
}
