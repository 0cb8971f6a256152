package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Selection of a struct field, an instance port or a port/stack method. */
public record ExprSelect(Expr expr, String selector, Loc loc) implements Expr {
  @Override
  public Stream<Tree> children() {
    return Stream.of(expr);
  }
}
