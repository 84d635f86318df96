package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.constants.CoreConstants;
import chessmaster.core.contracts.Evaluator;

/**
 * Material-only evaluator: sum(pieceValue × pieceCount) for each side and return the difference
 * (White − Black) in centipawns. No tempo, king safety, mobility… nothing. Kings carry their full
 * 20000 so a missing king dominates every other term.
 */
public final class EvaluatorImpl implements Evaluator {

    @Override
    public int evaluate(Board board) {
        int white = 0, black = 0;

        for (Type type : Type.values()) {
            int value = CoreConstants.pieceValue(type);
            white += value * board.count(Color.WHITE, type);
            black += value * board.count(Color.BLACK, type);
        }

        return white - black; // >0 = White ahead, <0 = Black ahead
    }
}
