package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Expression evaluated for its side effect, e.g. a port method call. */
public record StmtExpr(Expr expr, Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.of(expr);
  }
}
