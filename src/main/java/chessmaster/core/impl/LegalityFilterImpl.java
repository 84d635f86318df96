package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Piece.Type;
import chessmaster.core.board.Square;
import chessmaster.core.contracts.LegalityFilter;
import chessmaster.core.contracts.MoveGenerator;
import chessmaster.core.records.Move;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Copy-make legality: every candidate is played on a fresh board copy and rejected if the mover's
 * king is attacked afterwards. No incremental make/unmake.
 */
public final class LegalityFilterImpl implements LegalityFilter {

  private final MoveGenerator generator;

  public LegalityFilterImpl(MoveGenerator generator) {
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  @Override
  public boolean isLegal(Board board, Move move, Color mover) {
    Piece piece = board.get(move.from());
    if (piece == null || piece.color() != mover) return false;
    if (!generator.pseudoLegalMoves(board, move.from()).contains(move.to())) return false;
    return !isKingAttacked(applyOnCopy(board, move), mover);
  }

  @Override
  public boolean isKingAttacked(Board board, Color color) {
    Square king = board.findKing(color);
    if (king == null) return true; // no king: treat as already lost

    for (Square sq : board.occupiedBy(color.opposite())) {
      if (generator.isPseudoLegal(board, new Move(sq, king), /*attackProbe=*/true)) return true;
    }
    return false;
  }

  @Override
  public Board applyOnCopy(Board board, Move move) {
    Board copy = board.copy();
    Piece piece = copy.get(move.from());
    copy.clear(move.from());
    if (piece != null && piece.is(Type.PAWN) && move.to().rank() == piece.color().promotionRank()) {
      piece = piece.withType(Type.QUEEN);
    }
    copy.set(move.to(), piece);
    return copy;
  }

  @Override
  public List<Move> legalMoves(Board board, Color color) {
    List<Move> out = new ArrayList<>(48);
    for (Square from : board.occupiedBy(color)) {
      for (Square to : generator.pseudoLegalMoves(board, from)) {
        Move m = new Move(from, to);
        if (!isKingAttacked(applyOnCopy(board, m), color)) out.add(m);
      }
    }
    return out;
  }
}
