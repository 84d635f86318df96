package chessmaster.core.impl;

import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.board.Square;
import chessmaster.core.contracts.ConsoleHandler;
import chessmaster.core.contracts.Game;
import chessmaster.core.contracts.GameListener;
import chessmaster.core.contracts.GameOptions;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.contracts.Search;
import chessmaster.core.records.GamePhase;
import chessmaster.core.records.HistoryEntry;
import chessmaster.core.records.Move;
import chessmaster.core.records.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Scanner;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Line-oriented text front end.
 *
 * <p>Everything runs on the calling thread. Automated replies are queued by the game in a
 * {@link ReplyQueue}; the handler drains that queue after it has answered each command, so the
 * human move is always printed before the reply is searched.</p>
 */
public final class ConsoleHandlerImpl implements ConsoleHandler {

    private static final Logger log = LoggerFactory.getLogger(ConsoleHandlerImpl.class);

    private static final Pattern UCI_MOVE = Pattern.compile("[a-h][1-8][a-h][1-8][qrbn]?");

    /* ── engine singletons ─────────────────────────────────────── */
    private final Game            game;
    private final ReplyQueue      replies;
    private final PositionFactory pf;
    private final Search          search;
    private final GameOptions     opts;

    /* ── i/o ──────────────────────────────────────────────────── */
    private final InputStream in;
    private final PrintStream out;

    /** set by the listener whenever the board changed during the current command */
    private boolean dirty;

    public ConsoleHandlerImpl(Game game,
                              ReplyQueue replies,
                              PositionFactory pf,
                              Search search,
                              GameOptions opts,
                              InputStream in,
                              PrintStream out) {
        this.game    = game;
        this.replies = replies;
        this.pf      = pf;
        this.search  = search;
        this.opts    = opts;
        this.in      = in;
        this.out     = out;

        game.addListener(new GameListener() {
            @Override public void onMoveApplied(HistoryEntry e, GamePhase phase) {
                out.println(name(e.mover()) + " plays " + e.move()
                        + (e.isCapture() ? " capturing " + e.captured().type().name().toLowerCase() : ""));
                if (phase.isEnded()) out.println(phase.describe());
                dirty = true;
            }
            @Override public void onUndo(HistoryEntry e) {
                out.println("Took back " + e.move());
                dirty = true;
            }
            @Override public void onNewGame() { dirty = true; }
        });
    }

    /* ── main loop ─────────────────────────────────────────────── */
    @Override public void runLoop() {
        try (Scanner sc = new Scanner(in)) {
            while (sc.hasNextLine()) {
                String line = sc.nextLine().trim();
                if (!line.isEmpty() && handle(line)) break;   // “quit” → exit
            }
        }
    }

    /**
     * Executes one command line, then plays any queued automated reply.
     *
     * @return {@code true} if the command asks to quit
     */
    boolean handle(String cmd) {
        dirty = false;
        boolean quit;
        try {
            quit = dispatch(cmd);
            showBoardIfChanged();
        } catch (IllegalArgumentException e) {
            out.println("info string " + e.getMessage());
            quit = false;
        } finally {
            // a reply queued before a failing token still gets played
            if (replies.drain() > 0) showBoardIfChanged();
        }
        return quit;
    }

    /* ── router ───────────────────────────────────────────────── */
    private boolean dispatch(String cmd) {
        String[] t = cmd.split("\\s+");

        if (UCI_MOVE.matcher(t[0]).matches()) {
            cmdMove(t[0]);
            return false;
        }
        return switch (t[0]) {
            case "new"       -> { game.newGame();      yield false; }
            case "move"      -> { cmdMove(arg(t, 1));  yield false; }
            case "undo"      -> { game.undo();         yield false; }
            case "ai"        -> { cmdAi(arg(t, 1));    yield false; }
            case "position"  -> { cmdPosition(t);      yield false; }
            case "board"     -> { printBoard();        yield false; }
            case "fen"       -> { out.println(pf.toFen(game.position())); yield false; }
            case "moves"     -> { cmdMoves(t);         yield false; }
            case "status"    -> { cmdStatus();         yield false; }
            case "captured"  -> { cmdCaptured();       yield false; }
            case "go"        -> { cmdGo();             yield false; }
            case "setoption" -> { opts.setOption(cmd); yield false; }
            case "options"   -> { opts.printOptions(); yield false; }
            case "help"      -> { printHelp();         yield false; }
            case "quit"      -> true;
            default          -> { // unknown
                log.warn("Unknown command: {}", cmd);
                out.println("info string Unknown command: " + cmd);
                yield false;
            }
        };
    }

    /* ── commands ─────────────────────────────────────────────── */

    private void cmdMove(String uci) {
        if (!game.attemptMove(Move.parse(uci))) out.println("Invalid move");
    }

    private void cmdAi(String flag) {
        boolean on = switch (flag) {
            case "on" -> true;
            case "off" -> false;
            default -> throw new IllegalArgumentException("ai expects on or off, got " + flag);
        };
        opts.setOption("setoption name " + GameOptionsImpl.AUTOMATED_OPPONENT + " value " + on);
        out.println("Automated opponent " + flag);
    }

    private void cmdPosition(String[] t) {
        int i = 1;
        if ("startpos".equals(arg(t, i))) {                   // startpos
            game.loadPosition(pf.startPosition());
            i++;
        } else if ("fen".equals(t[i])) {                      // FEN …
            StringBuilder fen = new StringBuilder();
            while (++i < t.length && !"moves".equals(t[i]))
                fen.append(t[i]).append(' ');
            game.loadPosition(pf.fromFen(fen.toString().trim()));
        } else {
            throw new IllegalArgumentException("position expects startpos or fen, got " + t[i]);
        }

        /* optional move list */
        if (i < t.length && "moves".equals(t[i])) {
            for (int k = i + 1; k < t.length; k++) {
                if (!game.attemptMove(Move.parse(t[k]))) {
                    out.println("Invalid move " + t[k]);
                    return;
                }
            }
        }
    }

    private void cmdMoves(String[] t) {
        List<String> list;
        if (t.length > 1) {
            Square from = Square.parse(t[1]);
            list = game.legalDestinations(from).stream()
                    .map(to -> new Move(from, to).toUci())
                    .collect(Collectors.toList());
        } else {
            list = game.legalMoves().stream().map(Move::toUci).collect(Collectors.toList());
        }
        out.println(list.isEmpty() ? "(none)" : String.join(" ", list));
    }

    private void cmdStatus() {
        out.println(name(game.currentTurn()) + " to move");
        out.println(game.phase().describe() + (game.isInCheck() && !game.phase().isEnded() ? " (check)" : ""));
    }

    private void cmdCaptured() {
        for (Color c : Color.values()) {
            List<Type> taken = game.captured(c);
            out.println(name(c) + " captured: " + (taken.isEmpty() ? "-"
                    : taken.stream().map(tp -> tp.name().toLowerCase()).collect(Collectors.joining(" "))));
        }
    }

    private void cmdGo() {
        SearchResult r = search.search(game.board(), game.currentTurn());
        if (!r.hasMove()) {
            out.println("bestmove (none)");
            return;
        }
        out.printf("info score cp %d nodes %d time %d%n", r.scoreCp(), r.nodes(), r.timeMs());
        out.println("bestmove " + r.bestMove());
    }

    /* ── helpers ─────────────────────────────────────────────── */

    private void showBoardIfChanged() {
        if (dirty && opts.isEnabled(GameOptionsImpl.SHOW_BOARD)) printBoard();
        dirty = false;
    }

    private void printBoard() {
        out.println(game.board());
    }

    private void printHelp() {
        out.println(String.join("\n", Arrays.asList(
                "new | <move> | move <move> | undo | ai on|off",
                "position startpos|fen <fen> [moves <move>...]",
                "board | fen | moves [square] | status | captured | go",
                "setoption name <name> value <value> | options | quit")));
    }

    private static String arg(String[] t, int i) {
        if (i >= t.length) throw new IllegalArgumentException("Missing argument for " + t[0]);
        return t[i];
    }

    private static String name(Color c) {
        return c == Color.WHITE ? "White" : "Black";
    }
}
