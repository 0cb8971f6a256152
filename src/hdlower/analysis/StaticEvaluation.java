package hdlower.analysis;

import hdlower.core.Symbols.TermSymbol;
import hdlower.tree.CaseClause;
import hdlower.tree.Expr;
import hdlower.tree.ExprBinary;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprIndex;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.Stmt;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtCase;
import hdlower.tree.StmtIf;
import hdlower.tree.StmtLoop;
import hdlower.tree.StmtRead;
import hdlower.util.Bits;
import java.math.BigInteger;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Forward analysis computing, for every statement of an entity body, the symbol values known when control reaches it.
 * The result may miss constants but never reports a wrong one.
 * <p>
 * Statements are keyed by identity: two structurally equal statements at different places are different program points.
 */
public class StaticEvaluation {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final ConstantEvaluator evaluator;
  private final Map<Stmt, Bindings> before = new IdentityHashMap<>();

  private StaticEvaluation(ConstantEvaluator evaluator) { this.evaluator = evaluator; }

  /** Analyses one entity body, starting with no known values. */
  public static StaticEvaluation of(List<Stmt> body, ConstantEvaluator evaluator) {
    StaticEvaluation result = new StaticEvaluation(evaluator);
    result.analyse(body, Bindings.empty());
    logger.trace("Static evaluation annotated {} statements", result.before.size());
    return result;
  }

  /** The bindings valid on entry to {@code stmt}; empty for statements that were not part of the analysed body. */
  public Bindings before(Stmt stmt) { return before.getOrDefault(stmt, Bindings.empty()); }

  private Bindings analyse(List<Stmt> stmts, Bindings in) {
    Bindings state = in;
    for (Stmt stmt : stmts)
      state = analyse(stmt, state);
    return state;
  }

  private Bindings analyse(Stmt stmt, Bindings in) {
    before.merge(stmt, in, Bindings::merge);
    if (stmt instanceof StmtBlock)
      return analyse(((StmtBlock)stmt).body(), in);
    if (stmt instanceof StmtAssign)
      return assign((StmtAssign)stmt, in);
    if (stmt instanceof StmtIf) {
      StmtIf stmtIf = (StmtIf)stmt;
      Optional<Boolean> cond = evaluator.truth(stmtIf.cond(), in);
      Bindings thenOut = analyse(stmtIf.thenStmt(), refine(stmtIf.cond(), in));
      Bindings elseOut = stmtIf.elseStmt().isPresent() ? analyse(stmtIf.elseStmt().get(), in) : in;
      if (cond.isPresent())
        return cond.get() ? thenOut : elseOut;
      return thenOut.merge(elseOut);
    }
    if (stmt instanceof StmtCase) {
      StmtCase stmtCase = (StmtCase)stmt;
      Bindings out = null;
      for (CaseClause clause : stmtCase.clauses()) {
        Bindings clauseOut = analyse(clause.body(), in);
        out = out == null ? clauseOut : out.merge(clauseOut);
      }
      Bindings defaultOut = stmtCase.defaultStmt().isPresent() ? analyse(stmtCase.defaultStmt().get(), in) : in;
      return out == null ? defaultOut : out.merge(defaultOut);
    }
    if (stmt instanceof StmtLoop) {
      StmtLoop loop = (StmtLoop)stmt;
      Set<TermSymbol> assigned = new LinkedHashSet<>();
      loop.body().forEach(bodyStmt -> bodyStmt.preOrder()
                                          .filter(StmtAssign.class::isInstance)
                                          .forEach(assign -> collectTargets(((StmtAssign)assign).lhs(), assigned)));
      Bindings entry = in.withoutAll(assigned);
      analyse(loop.body(), entry);
      return entry;
    }
    if (stmt instanceof StmtRead)
      return Bindings.empty();
    return in;
  }

  private Bindings assign(StmtAssign assign, Bindings in) {
    if (assign.lhs() instanceof ExprRef && ((ExprRef)assign.lhs()).symbol() instanceof TermSymbol) {
      TermSymbol target = (TermSymbol)((ExprRef)assign.lhs()).symbol();
      Optional<BigInteger> value = evaluator.value(assign.rhs(), in);
      if (value.isPresent() && assign.lhs().tpe().isPacked())
        return in.with(target, Bits.truncate(value.get(), assign.lhs().tpe().width(), assign.lhs().tpe().isSigned()));
      return in.without(target);
    }
    Set<TermSymbol> targets = new LinkedHashSet<>();
    collectTargets(assign.lhs(), targets);
    return in.withoutAll(targets);
  }

  /** Bindings on entry to the then branch of {@code if (cond)}. */
  private Bindings refine(Expr cond, Bindings in) {
    if (!(cond instanceof ExprBinary) || !((ExprBinary)cond).op().equals("=="))
      return in;
    ExprBinary eq = (ExprBinary)cond;
    Bindings refined = refineWith(eq, eq.lhs(), eq.rhs(), in);
    return refined != in ? refined : refineWith(eq, eq.rhs(), eq.lhs(), in);
  }

  private Bindings refineWith(ExprBinary eq, Expr ref, Expr other, Bindings in) {
    if (!(ref instanceof ExprRef) || !(((ExprRef)ref).symbol() instanceof TermSymbol) || !ref.tpe().isPacked())
      return in;
    TermSymbol symbol = (TermSymbol)((ExprRef)ref).symbol();
    if (in.get(symbol).isPresent())
      return in;
    Optional<BigInteger> value = evaluator.value(other, in);
    if (value.isEmpty())
      return in;
    Bindings refined = in.with(symbol, Bits.truncate(value.get(), ref.tpe().width(), ref.tpe().isSigned()));
    // The value must make the comparison hold, which fails e.g. for constants wider than the symbol
    return evaluator.truth(eq, refined).orElse(false) ? refined : in;
  }

  /** Collects the symbols an l-value writes to. */
  private static void collectTargets(Expr lhs, Set<TermSymbol> targets) {
    if (lhs instanceof ExprRef) {
      if (((ExprRef)lhs).symbol() instanceof TermSymbol)
        targets.add((TermSymbol)((ExprRef)lhs).symbol());
    } else if (lhs instanceof ExprCat) {
      ((ExprCat)lhs).parts().forEach(part -> collectTargets(part, targets));
    } else if (lhs instanceof ExprIndex) {
      collectTargets(((ExprIndex)lhs).expr(), targets);
    } else if (lhs instanceof ExprSelect) {
      collectTargets(((ExprSelect)lhs).expr(), targets);
    }
  }
}
