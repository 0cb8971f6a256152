package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

public record ExprCall(Expr expr, List<Expr> args, Loc loc) implements Expr {
  public ExprCall { args = List.copyOf(args); }

  @Override
  public Stream<Tree> children() {
    return Stream.concat(Stream.of(expr), args.stream());
  }
}
