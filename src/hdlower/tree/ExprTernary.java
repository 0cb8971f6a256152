package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

public record ExprTernary(Expr cond, Expr thenExpr, Expr elseExpr, Loc loc) implements Expr {
  @Override
  public Stream<Tree> children() {
    return Stream.of(cond, thenExpr, elseExpr);
  }
}
