package chessmaster.core.contracts;

import chessmaster.core.board.Board;

public interface Evaluator {
    int evaluate(Board board);  // centipawns, white minus black
}
