package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Holds the state machine in the current cycle for as long as {@code cond} is non-zero. */
public record StmtStall(Expr cond, Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.of(cond);
  }
}
