package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.core.Symbols.Symbol;
import hdlower.tree.Expr;
import hdlower.tree.ExprRef;
import hdlower.tree.Tree;
import java.util.HashMap;
import java.util.Map;

/** Replaces references to the given symbols with the given expressions. Other references are kept. */
public class ExprSubstitution extends TreeTransformer {
  private final Map<? extends Symbol, ? extends Expr> replacements;

  public ExprSubstitution(CompilerContext cc, Map<? extends Symbol, ? extends Expr> replacements) {
    super(cc);
    this.replacements = replacements;
  }

  /** Substitutes references to the keys of {@code symbols} with references to the mapped symbols. */
  public static ExprSubstitution renaming(CompilerContext cc, Map<? extends Symbol, ? extends Symbol> symbols) {
    var refs = new HashMap<Symbol, Expr>();
    symbols.forEach((from, to) -> refs.put(from, new ExprRef(to)));
    return new ExprSubstitution(cc, refs);
  }

  @Override
  protected boolean skip(Tree tree) {
    return replacements.isEmpty();
  }

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof ExprRef) {
      Expr replacement = replacements.get(((ExprRef)tree).symbol());
      if (replacement != null) {
        if (replacement instanceof ExprRef)
          return new ExprRef(((ExprRef)replacement).symbol(), tree.loc());
        return replacement;
      }
    }
    return tree;
  }
}
