package hdlower.tree;

import hdlower.core.Loc;
import java.math.BigInteger;
import java.util.stream.Stream;

/** Sized numeric literal. */
public record ExprInt(boolean signed, int width, BigInteger value, Loc loc) implements Expr {
  public ExprInt {
    if (width <= 0)
      throw new IllegalArgumentException("width must be positive");
  }
  public ExprInt(boolean signed, int width, long value) { this(signed, width, BigInteger.valueOf(value), Loc.UNKNOWN); }

  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
