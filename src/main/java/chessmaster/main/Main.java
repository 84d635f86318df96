package chessmaster.main;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.contracts.Evaluator;
import chessmaster.core.contracts.GameStateEvaluator;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.MoveGenerator;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.contracts.Search;
import chessmaster.core.impl.*;
import chessmaster.core.records.Move;
import chessmaster.core.records.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Wire everything together and run the console loop.
 *
 * <pre>
 *   Main                     interactive console
 *   Main --ai                console with the automated opponent playing black
 *   Main perft &lt;depth&gt; [fen]  count leaf nodes of the legal move tree
 * </pre>
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length > 0 && "perft".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? Integer.parseInt(args[1]) : 3;
            String fen = (args.length > 2) ? String.join(" ", Arrays.copyOfRange(args, 2, args.length)) : null;
            runPerftBench(depth, fen);
            return;
        }
        boolean ai = Arrays.asList(args).contains("--ai");

        System.out.println("Chess Master");

        PositionFactory pf = new PositionFactoryImpl();
        MoveGenerator mg = new MoveGeneratorImpl();
        LegalityFilter lf = new LegalityFilterImpl(mg);
        GameStateEvaluator gse = new GameStateEvaluatorImpl(lf);
        Evaluator eval = new EvaluatorImpl();
        Search search = new SearchImpl(lf, eval);

        // automated replies wait here until the console has printed the human move
        ReplyQueue replies = new ReplyQueue();
        GameImpl game = new GameImpl(mg, lf, gse, search, pf, replies);

        GameOptionsImpl opts = new GameOptionsImpl(System.out);
        opts.attachGame(game);
        if (ai) opts.setOption("setoption name " + GameOptionsImpl.AUTOMATED_OPPONENT + " value true");

        ConsoleHandlerImpl console = new ConsoleHandlerImpl(game, replies, pf, search, opts, System.in, System.out);
        log.info("Console started (automated opponent {})", ai ? "on" : "off");
        System.out.println(game.board());
        console.runLoop();
    }

    private static void runPerftBench(int depth, String fen) {
        PositionFactory pf = new PositionFactoryImpl();
        LegalityFilter lf = new LegalityFilterImpl(new MoveGeneratorImpl());
        Position root = fen == null ? pf.startPosition() : pf.fromFen(fen);

        long t0 = System.nanoTime();
        long nodes = perft(lf, root.board(), root.sideToMove(), depth);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        long nps = ms > 0 ? (1000L * nodes) / ms : 0;
        System.out.printf("Nodes searched: %d%n", nodes);
        System.out.printf("Time (ms): %d%n", ms);
        System.out.printf("nps: %d%n", nps);
    }

    /** Leaf count of the legal move tree below {@code board}. */
    public static long perft(LegalityFilter lf, Board board, Color toMove, int depth) {
        if (depth == 0) return 1;

        List<Move> moves = lf.legalMoves(board, toMove);
        if (depth == 1) return moves.size();

        long nodes = 0;
        for (Move m : moves) {
            nodes += perft(lf, lf.applyOnCopy(board, m), toMove.opposite(), depth - 1);
        }
        return nodes;
    }
}
