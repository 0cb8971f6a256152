package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/** One arm of a {@link StmtCase}: taken if the case value equals any of the conditions. */
public record CaseClause(List<Expr> conditions, Stmt body, Loc loc) implements Tree {
  public CaseClause {
    conditions = List.copyOf(conditions);
    if (conditions.isEmpty())
      throw new IllegalArgumentException("A case clause needs at least one condition");
  }

  @Override
  public Stream<Tree> children() {
    return Stream.concat(conditions.stream(), Stream.of(body));
  }
}
