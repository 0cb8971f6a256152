package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Unary operator: one of {@code + - ~ !} or a reduction {@code & | ^}. */
public record ExprUnary(String op, Expr expr, Loc loc) implements Expr {
  @Override
  public Stream<Tree> children() {
    return Stream.of(expr);
  }
}
