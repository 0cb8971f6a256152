package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Clock cycle boundary. */
public record StmtFence(Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
