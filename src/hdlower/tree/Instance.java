package hdlower.tree;

import hdlower.core.Loc;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import java.util.stream.Stream;

/** Instantiation of entity {@code entitySymbol}, named by {@code symbol}. */
public record Instance(TermSymbol symbol, TypeSymbol entitySymbol, Loc loc) implements Tree {
  @Override
  public Stream<Tree> children() {
    return Stream.empty();
  }
}
