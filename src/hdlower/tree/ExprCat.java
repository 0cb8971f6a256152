package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/** Bit concatenation, most significant part first. */
public record ExprCat(List<Expr> parts, Loc loc) implements Expr {
  public ExprCat {
    parts = List.copyOf(parts);
    if (parts.isEmpty())
      throw new IllegalArgumentException("Empty concatenation");
  }

  @Override
  public Stream<Tree> children() {
    return parts.stream().map(Tree.class::cast);
  }
}
