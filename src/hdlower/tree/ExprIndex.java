package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

public record ExprIndex(Expr expr, Expr index, Loc loc) implements Expr {
  @Override
  public Stream<Tree> children() {
    return Stream.of(expr, index);
  }
}
