package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/** Send the pipeline variables to the next pipeline stage. */
public record StmtWrite(Loc loc) implements Stmt {
  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
