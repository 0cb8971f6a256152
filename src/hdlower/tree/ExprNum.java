package hdlower.tree;

import hdlower.core.Loc;
import java.math.BigInteger;
import java.util.stream.Stream;

/** Unsized numeric literal. */
public record ExprNum(boolean signed, BigInteger value, Loc loc) implements Expr {
  public ExprNum(long value) { this(value < 0, BigInteger.valueOf(value), Loc.UNKNOWN); }

  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
