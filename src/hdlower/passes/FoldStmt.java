package hdlower.passes;

import hdlower.analysis.Bindings;
import hdlower.analysis.ConstantEvaluator;
import hdlower.analysis.StaticEvaluation;
import hdlower.core.CompilerContext;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.Instance;
import hdlower.tree.Stmt;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtIf;
import hdlower.tree.StmtStall;
import hdlower.tree.Tree;
import hdlower.util.ScopeStack;
import java.util.List;
import java.util.Optional;

/**
 * Replaces statements whose condition is statically known:
 * an {@code if} by its taken branch and a never-holding {@code stall} by nothing.
 * A stall that always holds is reported.
 */
public class FoldStmt extends TreeTransformer {
  private final ConstantEvaluator evaluator;
  private final ScopeStack<StaticEvaluation> evaluations = new ScopeStack<>();
  /** Bindings on entry to the statements currently being walked, innermost on top. */
  private final ScopeStack<Bindings> stmtBindings = new ScopeStack<>();

  public FoldStmt(CompilerContext cc) {
    super(cc);
    this.evaluator = new ConstantEvaluator(cc.attributes());
  }

  @Override
  protected boolean skip(Tree tree) {
    return tree instanceof Expr || tree instanceof Connect || tree instanceof Instance || tree instanceof Decl;
  }

  @Override
  protected void enter(Tree tree) {
    if (tree instanceof Entity)
      evaluations.push(StaticEvaluation.of(((Entity)tree).statements(), evaluator));
    else if (tree instanceof Stmt)
      stmtBindings.push(evaluations.isEmpty() ? Bindings.empty() : evaluations.top().before((Stmt)tree));
  }

  @Override
  protected void leave(Tree original) {
    if (original instanceof Entity)
      evaluations.pop();
    else if (original instanceof Stmt)
      stmtBindings.pop();
  }

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof StmtIf) {
      StmtIf stmtIf = (StmtIf)tree;
      Optional<Boolean> cond = evaluator.truth(stmtIf.cond(), stmtBindings.top());
      if (cond.isEmpty())
        return stmtIf;
      logger.trace("Folding 'if' at {} with condition always {}", stmtIf.loc(), cond.get());
      if (cond.get())
        return stmtIf.thenStmt();
      return stmtIf.elseStmt().orElseGet(() -> new StmtBlock(List.of(), stmtIf.loc()));
    }
    if (tree instanceof StmtStall) {
      StmtStall stall = (StmtStall)tree;
      Optional<Boolean> cond = evaluator.truth(stall.cond(), stmtBindings.top());
      if (cond.isEmpty())
        return stall;
      if (cond.get()) {
        cc.error(stall, "Stall condition is always true");
        return stall;
      }
      return new StmtBlock(List.of(), stall.loc());
    }
    return tree;
  }

  @Override
  protected void finalCheck(Tree result) {
    if (!evaluations.isEmpty() || !stmtBindings.isEmpty())
      throw cc.ice(result, "FoldStmt scope stacks not empty at the end of the pass");
  }
}
