package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public record StmtCase(Expr value, List<CaseClause> clauses, Optional<Stmt> defaultStmt, Loc loc) implements Stmt {
  public StmtCase { clauses = List.copyOf(clauses); }

  @Override
  public Stream<Tree> children() {
    return Stream.of(Stream.<Tree>of(value), clauses.stream().map(Tree.class::cast), defaultStmt.stream().map(Tree.class::cast))
        .flatMap(stream -> stream);
  }
}
