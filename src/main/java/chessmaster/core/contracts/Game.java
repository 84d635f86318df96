package chessmaster.core.contracts;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.board.Square;
import chessmaster.core.records.GamePhase;
import chessmaster.core.records.GameSnapshot;
import chessmaster.core.records.HistoryEntry;
import chessmaster.core.records.Move;
import chessmaster.core.records.Position;

import java.util.List;

/**
 * The game as seen by a front end: submit moves, take them back, read the state.
 *
 * <p>Implementations own their board, history, captured lists and turn. Nothing outside the
 * implementation mutates them; every query returns a copy or an immutable view.
 */
public interface Game {

    /* ────── mutations ────── */

    /** Standard set-up, white to move, empty history and captured lists, game in progress. */
    void newGame();

    /** Replaces the current game with {@code position}; history and captured lists are cleared. */
    void loadPosition(Position position);

    /**
     * Plays {@code move} for the side to move if it is legal.
     *
     * @return {@code false}, with no state change, if the move is illegal or the game is over
     */
    boolean attemptMove(Move move);

    default boolean attemptMove(Square from, Square to) {
        return attemptMove(new Move(from, to));
    }

    /** Coordinates off the board are rejected like any other illegal move. */
    default boolean attemptMove(int fromFile, int fromRank, int toFile, int toRank) {
        if (!Square.isInside(fromFile, fromRank) || !Square.isInside(toFile, toRank)) return false;
        return attemptMove(new Move(new Square(fromFile, fromRank), new Square(toFile, toRank)));
    }

    /** Takes back the last move; does nothing when there is none. */
    void undo();

    /** Lets the engine play black. Enabling it on black's turn schedules a reply. */
    void setAutomatedOpponent(boolean enabled);

    boolean isAutomatedOpponent();

    void addListener(GameListener listener);

    /* ────── queries ────── */

    Color currentTurn();

    GamePhase phase();

    /** @return the piece on {@code square}, or {@code null} */
    Piece pieceAt(Square square);

    /** Piece types captured by {@code color}, oldest first. */
    List<Type> captured(Color color);

    /** Copy of the live board. */
    Board board();

    List<HistoryEntry> history();

    List<Move> legalMoves();

    /** Legal destinations of the piece on {@code from}; empty unless it belongs to the side to move. */
    List<Square> legalDestinations(Square from);

    boolean isInCheck();

    Position position();

    GameSnapshot snapshot();
}
