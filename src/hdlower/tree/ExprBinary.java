package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

public record ExprBinary(Expr lhs, String op, Expr rhs, Loc loc) implements Expr {
  @Override
  public Stream<Tree> children() {
    return Stream.of(lhs, rhs);
  }
}
