package hdlower.tree;

import hdlower.core.Loc;
import hdlower.core.Symbols.TermSymbol;
import java.util.Optional;
import java.util.stream.Stream;

/** Declaration of a port, const, variable, pipeline variable or stack. */
public record Decl(TermSymbol symbol, Optional<Expr> init, Loc loc) implements Tree {
  public Decl(TermSymbol symbol) { this(symbol, Optional.empty(), symbol.getLoc()); }
  public Decl(TermSymbol symbol, Expr init) { this(symbol, Optional.of(init), symbol.getLoc()); }

  @Override
  public Stream<Tree> children() {
    return init.stream().map(Tree.class::cast);
  }
}
