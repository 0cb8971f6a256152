package hdlower.tree;

import hdlower.core.Loc;
import hdlower.core.Symbols.Symbol;
import java.util.stream.Stream;

public record ExprRef(Symbol symbol, Loc loc) implements Expr {
  public ExprRef(Symbol symbol) { this(symbol, Loc.UNKNOWN); }

  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
