package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/** Loop repeating its body until left by control transfer. */
public record StmtLoop(List<Stmt> body, Loc loc) implements Stmt {
  public StmtLoop { body = List.copyOf(body); }

  @Override
  public Stream<Tree> children() {
    return body.stream().map(Tree.class::cast);
  }
}
