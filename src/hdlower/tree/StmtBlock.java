package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

public record StmtBlock(List<Stmt> body, Loc loc) implements Stmt {
  public StmtBlock { body = List.copyOf(body); }

  @Override
  public Stream<Tree> children() {
    return body.stream().map(Tree.class::cast);
  }
}
