package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Receive the pipeline variables from the previous pipeline stage. */
public record StmtRead(Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
