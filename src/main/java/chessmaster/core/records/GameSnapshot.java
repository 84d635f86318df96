package chessmaster.core.records;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;

import java.util.List;

/**
 * Everything a front end polls after a mutating call, frozen at one instant. Two snapshots are
 * equal exactly when board, turn, captured lists and phase are equal.
 *
 * @param board           copy of the board
 * @param turn            side to move
 * @param capturedByWhite piece types white has taken, oldest first
 * @param capturedByBlack piece types black has taken, oldest first
 * @param phase           game phase
 */
public record GameSnapshot(
        Board board,
        Color turn,
        List<Type> capturedByWhite,
        List<Type> capturedByBlack,
        GamePhase phase
) {
    public GameSnapshot {
        board = board.copy();
        capturedByWhite = List.copyOf(capturedByWhite);
        capturedByBlack = List.copyOf(capturedByBlack);
    }
}
