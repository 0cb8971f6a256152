package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/** Point-to-point wiring; one source may drive several sinks. */
public record Connect(Expr lhs, List<Expr> rhs, Loc loc) implements Tree {
  public Connect {
    rhs = List.copyOf(rhs);
    if (rhs.isEmpty())
      throw new IllegalArgumentException("A connection needs at least one sink");
  }
  public Connect(Expr lhs, Expr rhs, Loc loc) { this(lhs, List.of(rhs), loc); }

  @Override
  public Stream<Tree> children() {
    return Stream.concat(Stream.of(lhs), rhs.stream());
  }
}
