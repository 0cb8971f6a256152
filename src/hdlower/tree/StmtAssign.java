package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

public record StmtAssign(Expr lhs, Expr rhs, Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.of(lhs, rhs);
  }
}
