package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.board.Square;
import chessmaster.core.constants.CoreConstants;
import chessmaster.core.contracts.Game;
import chessmaster.core.contracts.GameListener;
import chessmaster.core.contracts.GameStateEvaluator;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.MoveGenerator;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.contracts.Search;
import chessmaster.core.records.GamePhase;
import chessmaster.core.records.GameSnapshot;
import chessmaster.core.records.HistoryEntry;
import chessmaster.core.records.Move;
import chessmaster.core.records.Position;
import chessmaster.core.records.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * The single owner of a game's board, turn, phase and history.
 *
 * <p>Not thread-safe: all calls must come from one thread, or be serialised by the caller. The
 * automated opponent's reply is handed to {@code replyExecutor} instead of being played inline, so
 * a front end can repaint between the human move and the reply. {@code Runnable::run} plays it
 * immediately.
 */
public final class GameImpl implements Game {

    private static final Logger log = LoggerFactory.getLogger(GameImpl.class);

    /* ── engine parts ─────────────────────────────────────────── */
    private final MoveGenerator      generator;
    private final LegalityFilter     legality;
    private final GameStateEvaluator stateEvaluator;
    private final Search             search;
    private final PositionFactory    positions;
    private final Executor           replyExecutor;

    /* ── game state ───────────────────────────────────────────── */
    private final Board          board = new Board();
    private final HistoryManager history = new HistoryManager();
    private Color     turn  = Color.WHITE;
    private GamePhase phase = GamePhase.IN_PROGRESS;
    private int       startFullmove = 1;
    private boolean   automatedOpponent;

    private final List<GameListener> listeners = new CopyOnWriteArrayList<>();

    public GameImpl(MoveGenerator generator,
                    LegalityFilter legality,
                    GameStateEvaluator stateEvaluator,
                    Search search,
                    PositionFactory positions,
                    Executor replyExecutor) {
        this.generator      = Objects.requireNonNull(generator, "generator");
        this.legality       = Objects.requireNonNull(legality, "legality");
        this.stateEvaluator = Objects.requireNonNull(stateEvaluator, "stateEvaluator");
        this.search         = Objects.requireNonNull(search, "search");
        this.positions      = Objects.requireNonNull(positions, "positions");
        this.replyExecutor  = Objects.requireNonNull(replyExecutor, "replyExecutor");
        newGame();
    }

    /** Wires the default implementations together. */
    public static GameImpl create(Executor replyExecutor) {
        MoveGenerator mg = new MoveGeneratorImpl();
        LegalityFilter lf = new LegalityFilterImpl(mg);
        return new GameImpl(mg, lf,
                new GameStateEvaluatorImpl(lf),
                new SearchImpl(lf, new EvaluatorImpl()),
                new PositionFactoryImpl(),
                replyExecutor);
    }

    /* ── set-up ───────────────────────────────────────────────── */

    @Override
    public void newGame() {
        reset(positions.startPosition());
        log.info("New game");
        listeners.forEach(GameListener::onNewGame);
    }

    @Override
    public void loadPosition(Position position) {
        Objects.requireNonNull(position, "position");
        reset(position);
        log.info("Position loaded: {}", positions.toFen(position()));
        listeners.forEach(GameListener::onNewGame);
        scheduleReplyIfDue();
    }

    private void reset(Position position) {
        board.clearAll();
        for (int i = 0; i < Square.SIZE * Square.SIZE; i++) {
            Square sq = Square.ofIndex(i);
            board.set(sq, position.board().get(sq));
        }
        history.clear();
        turn = position.sideToMove();
        startFullmove = position.fullmoveNumber();
        phase = GamePhase.IN_PROGRESS;
    }

    /* ── moves ────────────────────────────────────────────────── */

    @Override
    public boolean attemptMove(Move move) {
        Objects.requireNonNull(move, "move");
        if (phase.isEnded() || !legality.isLegal(board, move, turn)) {
            log.debug("Rejected {} for {}", move, turn);
            return false;
        }
        applyMove(move);
        scheduleReplyIfDue();
        return true;
    }

    /** Caller has already checked {@code move} with the legality filter. */
    private void applyMove(Move move) {
        Color mover = turn;
        Piece moving = board.get(move.from());
        Piece captured = board.get(move.to());

        HistoryEntry entry = history.record(move, captured, mover);

        board.clear(move.from());
        if (moving.is(Type.PAWN) && move.to().rank() == mover.promotionRank()) {
            moving = moving.withType(Type.QUEEN);
        }
        board.set(move.to(), moving);

        turn = mover.opposite();
        phase = stateEvaluator.evaluate(board, turn);

        log.debug("{} {}{}", mover, move, captured != null ? " x" + captured : "");
        if (phase.isEnded()) log.info("Game over after {}: {}", move, phase.describe());
        listeners.forEach(l -> l.onMoveApplied(entry, phase));
    }

    @Override
    public void undo() {
        HistoryEntry last = history.pop();
        if (last == null) return;

        Move m = last.move();
        board.set(m.from(), board.get(m.to())); // a promoted queen stays a queen
        board.set(m.to(), last.captured());

        turn = last.mover();
        phase = GamePhase.IN_PROGRESS;

        log.debug("Undo {} by {}", m, last.mover());
        listeners.forEach(l -> l.onUndo(last));
    }

    /* ── automated opponent ───────────────────────────────────── */

    @Override
    public void setAutomatedOpponent(boolean enabled) {
        if (automatedOpponent == enabled) return;
        automatedOpponent = enabled;
        log.info("Automated opponent {}", enabled ? "on" : "off");
        scheduleReplyIfDue();
    }

    @Override
    public boolean isAutomatedOpponent() {
        return automatedOpponent;
    }

    private boolean replyDue() {
        return automatedOpponent && turn == CoreConstants.AUTOMATED_SIDE && !phase.isEnded();
    }

    private void scheduleReplyIfDue() {
        if (replyDue()) replyExecutor.execute(this::playAutomatedMove);
    }

    /** Runs the search and plays its move, unless the game moved on since the reply was queued. */
    void playAutomatedMove() {
        if (!replyDue()) return;
        SearchResult r = search.search(board, turn);
        if (r.hasMove()) applyMove(r.bestMove());
    }

    @Override
    public void addListener(GameListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /* ── queries ──────────────────────────────────────────────── */

    @Override public Color currentTurn() { return turn; }

    @Override public GamePhase phase() { return phase; }

    @Override public Piece pieceAt(Square square) { return board.get(square); }

    @Override public List<Type> captured(Color color) { return history.captured(color); }

    @Override public Board board() { return board.copy(); }

    @Override public List<HistoryEntry> history() { return history.entries(); }

    @Override
    public List<Move> legalMoves() {
        return legality.legalMoves(board, turn);
    }

    @Override
    public List<Square> legalDestinations(Square from) {
        Piece p = board.get(from);
        if (p == null || p.color() != turn) return List.of();
        List<Square> out = new ArrayList<>();
        for (Square to : generator.pseudoLegalMoves(board, from)) {
            if (legality.isLegal(board, new Move(from, to), turn)) out.add(to);
        }
        return out;
    }

    @Override
    public boolean isInCheck() {
        return legality.isKingAttacked(board, turn);
    }

    @Override
    public Position position() {
        // the FEN move number advances after every black move
        int blackMoves = 0;
        for (HistoryEntry e : history.entries()) {
            if (e.mover() == Color.BLACK) blackMoves++;
        }
        return new Position(board.copy(), turn, startFullmove + blackMoves);
    }

    @Override
    public GameSnapshot snapshot() {
        return new GameSnapshot(board, turn,
                history.captured(Color.WHITE), history.captured(Color.BLACK), phase);
    }
}
