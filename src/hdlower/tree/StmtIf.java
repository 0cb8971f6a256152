package hdlower.tree;

import hdlower.core.Loc;
import java.util.Optional;
import java.util.stream.Stream;

public record StmtIf(Expr cond, Stmt thenStmt, Optional<Stmt> elseStmt, Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.concat(Stream.of(cond, thenStmt), elseStmt.stream());
  }
}
