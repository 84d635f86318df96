package chessmaster.core.impl;

import chessmaster.core.board.Board;
import chessmaster.core.board.Piece;
import chessmaster.core.board.Piece.Color;
import chessmaster.core.board.Square;
import chessmaster.core.constants.CoreConstants;
import chessmaster.core.contracts.PositionFactory;
import chessmaster.core.records.Position;

import java.util.Objects;

/**
 * FEN reader / writer. Only the placement, side-to-move and full-move fields carry meaning here;
 * castling and en-passant fields are read past and always written as {@code -}.
 */
public final class PositionFactoryImpl implements PositionFactory {

  @Override
  public Position startPosition() {
    return fromFen(CoreConstants.START_FEN);
  }

  @Override
  public Position fromFen(String fen) {
    Objects.requireNonNull(fen, "FEN must not be null");
    String[] parts = fen.trim().split("\\s+");
    if (parts.length < 2) {
      throw new IllegalArgumentException("FEN needs at least placement and side to move: " + fen);
    }

    // 1. Board layout
    Board board = parseBoard(parts[0]);

    // 2. Side to move
    Color side = switch (parts[1]) {
      case "w" -> Color.WHITE;
      case "b" -> Color.BLACK;
      default -> throw new IllegalArgumentException("Invalid active colour: " + parts[1]);
    };

    // 3./4. castling and en passant are not supported; 5. halfmove clock is not tracked

    // 6. Fullmove number
    int fm = 1;
    if (parts.length > 5) {
      try {
        fm = Math.max(1, Integer.parseInt(parts[5]));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid full-move number: " + parts[5], e);
      }
    }
    return new Position(board, side, fm);
  }

  private static Board parseBoard(String placement) {
    Board board = new Board();
    String[] ranks = placement.split("/", -1);
    if (ranks.length != Square.SIZE) {
      throw new IllegalArgumentException("FEN placement must have 8 ranks – got " + ranks.length);
    }
    for (int i = 0; i < Square.SIZE; i++) {
      int rank = 7 - i, file = 0;
      for (char c : ranks[i].toCharArray()) {
        if (c >= '1' && c <= '8') {
          file += c - '0';
          continue;
        }
        if (file >= Square.SIZE) {
          throw new IllegalArgumentException("Rank " + (rank + 1) + " overflows: " + ranks[i]);
        }
        board.set(new Square(file++, rank), Piece.fromSymbol(c));
      }
      if (file != Square.SIZE) {
        throw new IllegalArgumentException("Rank " + (rank + 1) + " does not cover 8 files: " + ranks[i]);
      }
    }
    return board;
  }

  @Override
  public String toFen(Position position) {
    Board board = position.board();
    StringBuilder sb = new StringBuilder(64);
    for (int rank = 7; rank >= 0; --rank) {
      int empty = 0;
      for (int file = 0; file < 8; ++file) {
        Piece pc = board.get(file, rank);
        if (pc == null) {
          empty++;
          continue;
        }
        if (empty != 0) {
          sb.append(empty);
          empty = 0;
        }
        sb.append(pc.symbol());
      }
      if (empty != 0) sb.append(empty);
      if (rank != 0) sb.append('/');
    }
    sb.append(position.sideToMove() == Color.WHITE ? " w " : " b ");
    sb.append("- - 0 ").append(position.fullmoveNumber());
    return sb.toString();
  }
}
