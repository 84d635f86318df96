package chessmaster.core.impl;

import static chessmaster.core.constants.CoreConstants.*;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Square;
import chessmaster.core.contracts.MoveGenerator;
import chessmaster.core.records.Move;

import java.util.ArrayList;
import java.util.List;

public final class MoveGeneratorImpl implements MoveGenerator {

  @Override
  public List<Square> pseudoLegalMoves(Board board, Square from) {
    Piece p = board.get(from);
    if (p == null) return List.of();

    List<Square> out = new ArrayList<>(28);
    switch (p.type()) {
      case PAWN -> addPawnMoves(board, from, p.color(), out);
      case KNIGHT -> addStepMoves(board, from, p.color(), KNIGHT_JUMPS, out);
      case BISHOP -> addSliderMoves(board, from, p.color(), BISHOP_DIRS, out);
      case ROOK -> addSliderMoves(board, from, p.color(), ROOK_DIRS, out);
      case QUEEN -> addSliderMoves(board, from, p.color(), QUEEN_DIRS, out);
      case KING -> addStepMoves(board, from, p.color(), KING_STEPS, out);
    }
    return out;
  }

  /* -------- pawns: pushes first, then the two diagonal captures --- */
  private static void addPawnMoves(Board board, Square from, Color us, List<Square> out) {
    int dir = us.pawnDirection();

    Square one = from.offset(0, dir);
    if (one != null && board.isEmpty(one)) {
      out.add(one);
      if (from.rank() == us.pawnHomeRank()) {
        Square two = from.offset(0, 2 * dir);
        if (two != null && board.isEmpty(two)) out.add(two);
      }
    }

    for (int df = -1; df <= 1; df += 2) {
      Square diag = from.offset(df, dir);
      if (diag == null) continue;
      Piece target = board.get(diag);
      if (target != null && target.color() != us) out.add(diag);
    }
  }

  /* -------- knights & kings: fixed offsets ------------------------ */
  private static void addStepMoves(Board board, Square from, Color us, int[][] steps, List<Square> out) {
    for (int[] d : steps) {
      Square to = from.offset(d[0], d[1]);
      if (to == null) continue;
      Piece target = board.get(to);
      if (target == null || target.color() != us) out.add(to);
    }
  }

  /* -------- sliders: walk each ray until blocked ----------------- */
  private static void addSliderMoves(Board board, Square from, Color us, int[][] dirs, List<Square> out) {
    for (int[] d : dirs) {
      Square to = from.offset(d[0], d[1]);
      while (to != null) {
        Piece target = board.get(to);
        if (target == null) {
          out.add(to);
        } else {
          if (target.color() != us) out.add(to); // capture ends the ray
          break;
        }
        to = to.offset(d[0], d[1]);
      }
    }
  }

  /* ───────────────── single-move geometric test ───────────────── */

  @Override
  public boolean isPseudoLegal(Board board, Move move, boolean attackProbe) {
    Piece piece = board.get(move.from());
    if (piece == null || move.from().equals(move.to())) return false;

    Piece target = board.get(move.to());
    if (!attackProbe && target != null && target.color() == piece.color()) return false;

    int df = move.to().file() - move.from().file();
    int dr = move.to().rank() - move.from().rank();
    int adf = Math.abs(df), adr = Math.abs(dr);

    return switch (piece.type()) {
      case PAWN -> pawnReaches(board, move, piece.color(), target, df, dr);
      case KNIGHT -> (adf == 1 && adr == 2) || (adf == 2 && adr == 1);
      case BISHOP -> adf == adr && pathClear(board, move.from(), move.to());
      case ROOK -> (df == 0 || dr == 0) && pathClear(board, move.from(), move.to());
      case QUEEN -> (df == 0 || dr == 0 || adf == adr) && pathClear(board, move.from(), move.to());
      case KING -> Math.max(adf, adr) == 1;
    };
  }

  private static boolean pawnReaches(Board board, Move move, Color us, Piece target, int df, int dr) {
    int dir = us.pawnDirection();
    if (df == 0) {
      if (target != null) return false;
      if (dr == dir) return true;
      return dr == 2 * dir
          && move.from().rank() == us.pawnHomeRank()
          && board.get(move.from().file(), move.from().rank() + dir) == null;
    }
    // diagonal steps only ever capture
    return Math.abs(df) == 1 && dr == dir && target != null && target.color() != us;
  }

  /** {@code true} if every square strictly between {@code from} and {@code to} is empty. */
  private static boolean pathClear(Board board, Square from, Square to) {
    int sf = Integer.signum(to.file() - from.file());
    int sr = Integer.signum(to.rank() - from.rank());
    int f = from.file() + sf, r = from.rank() + sr;
    while (f != to.file() || r != to.rank()) {
      if (board.get(f, r) != null) return false;
      f += sf;
      r += sr;
    }
    return true;
  }
}
