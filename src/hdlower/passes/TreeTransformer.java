package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.tree.CaseClause;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprBinary;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprIndex;
import hdlower.tree.ExprSelect;
import hdlower.tree.ExprTernary;
import hdlower.tree.ExprUnary;
import hdlower.tree.Instance;
import hdlower.tree.Root;
import hdlower.tree.Stmt;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtCase;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtIf;
import hdlower.tree.StmtLoop;
import hdlower.tree.StmtStall;
import hdlower.tree.Thicket;
import hdlower.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Post-order tree rewriter. Subclasses override the hooks they need:
 * <ul>
 * <li>{@link #skip(Tree)}: the node and its subtree pass through untouched, no other hook is called for them</li>
 * <li>{@link #enter(Tree)}: called before the children are visited</li>
 * <li>{@link #transform(Tree)}: called with the node after its children have been rewritten; returns the replacement</li>
 * <li>{@link #leave(Tree)}: called with the original node after {@link #transform(Tree)}, also if an exception is thrown
 *     on the way; the place to pop scope state pushed in {@link #enter(Tree)}</li>
 * </ul>
 * A node may be replaced by a {@link Thicket}, which is spliced into the enclosing list.
 * Lists and optionals whose elements all came back unchanged are returned as the original object,
 * so "nothing changed" can be checked by reference comparison.
 * <p>
 * A transformer instance carries the state of one traversal and is meant to be applied once.
 */
public abstract class TreeTransformer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  protected final CompilerContext cc;

  protected TreeTransformer(CompilerContext cc) { this.cc = cc; }

  protected boolean skip(Tree tree) { return false; }
  protected void enter(Tree tree) {}
  protected Tree transform(Tree tree) { return tree; }
  protected void leave(Tree original) {}

  /** Invariant check run on every result if {@code applyTransformChecks} is set. Overrides should call super. */
  protected void defaultCheck(Tree original, Tree result) {
    if (!(original instanceof Thicket)) {
      result.preOrder()
          .filter(Thicket.class::isInstance)
          .findFirst()
          .ifPresent(thicket -> { throw cc.ice(thicket, "Thicket remains in tree after " + getClass().getSimpleName()); });
    }
    if (original instanceof Root && !(result instanceof Root))
      throw cc.ice(result, "Root replaced by " + result.getClass().getSimpleName());
  }

  /** Pass specific invariant check, run after {@link #defaultCheck(Tree, Tree)}. */
  protected void finalCheck(Tree result) {}

  public final Tree apply(Tree tree) {
    Tree result = walk(tree);
    if (cc.getConfig().applyTransformChecks) {
      defaultCheck(tree, result);
      finalCheck(result);
    }
    return result;
  }

  public final Root apply(Root root) {
    Tree result = apply((Tree)root);
    if (!(result instanceof Root))
      throw cc.ice(root, getClass().getSimpleName() + " did not produce a Root");
    return (Root)result;
  }

  public final Expr apply(Expr expr) {
    Tree result = apply((Tree)expr);
    if (!(result instanceof Expr))
      throw cc.ice(expr, getClass().getSimpleName() + " rewrote an expression into " + result.getClass().getSimpleName());
    return (Expr)result;
  }

  ///////////////////////////////////////////////////////////////////////////
  // Traversal
  ///////////////////////////////////////////////////////////////////////////

  protected final Tree walk(Tree tree) {
    if (skip(tree))
      return tree;
    enter(tree);
    try {
      return transform(walkChildren(tree));
    } finally {
      leave(tree);
    }
  }

  /** Walks the list, splicing in Thickets. Returns {@code list} itself if no element changed. */
  protected final <T extends Tree> List<T> walkList(List<T> list, Class<T> elementClass) {
    List<T> result = null;
    for (int i = 0; i < list.size(); ++i) {
      T elem = list.get(i);
      Tree walked = walk(elem);
      if (walked == elem && result == null)
        continue;
      if (result == null)
        result = new ArrayList<>(list.subList(0, i));
      if (walked instanceof Thicket && !elementClass.isInstance(walked)) {
        for (Tree item : flatten((Thicket)walked))
          result.add(cast(item, elementClass));
      } else {
        result.add(cast(walked, elementClass));
      }
    }
    return result == null ? list : result;
  }

  protected final <T extends Tree> T walkSingle(T tree, Class<T> treeClass) {
    Tree walked = walk(tree);
    if (walked == tree)
      return tree;
    if (walked instanceof Thicket && treeClass == Stmt.class) {
      // A statement expanded in a single statement position becomes a block.
      List<Stmt> body = new ArrayList<>();
      for (Tree item : flatten((Thicket)walked))
        body.add(cast(item, Stmt.class));
      return treeClass.cast(new StmtBlock(body, walked.loc()));
    }
    return cast(walked, treeClass);
  }

  protected final <T extends Tree> Optional<T> walkOptional(Optional<T> tree, Class<T> treeClass) {
    if (tree.isEmpty())
      return tree;
    T walked = walkSingle(tree.get(), treeClass);
    return walked == tree.get() ? tree : Optional.of(walked);
  }

  private static List<Tree> flatten(Thicket thicket) {
    List<Tree> items = new ArrayList<>();
    for (Tree item : thicket.trees()) {
      if (item instanceof Thicket)
        items.addAll(flatten((Thicket)item));
      else
        items.add(item);
    }
    return items;
  }

  private <T extends Tree> T cast(Tree tree, Class<T> treeClass) {
    if (!treeClass.isInstance(tree))
      throw cc.ice(tree, String.format("%s produced a %s where a %s is required", getClass().getSimpleName(),
                                       tree.getClass().getSimpleName(), treeClass.getSimpleName()));
    return treeClass.cast(tree);
  }

  private Tree walkChildren(Tree tree) {
    if (tree instanceof Root) {
      Root root = (Root)tree;
      List<Entity> entities = walkList(root.entities(), Entity.class);
      return entities == root.entities() ? root : new Root(entities, root.loc());
    }
    if (tree instanceof Entity) {
      Entity entity = (Entity)tree;
      List<Decl> declarations = walkList(entity.declarations(), Decl.class);
      List<Instance> instances = walkList(entity.instances(), Instance.class);
      List<Connect> connects = walkList(entity.connects(), Connect.class);
      List<Stmt> statements = walkList(entity.statements(), Stmt.class);
      List<Entity> entities = walkList(entity.entities(), Entity.class);
      if (declarations == entity.declarations() && instances == entity.instances() && connects == entity.connects() &&
          statements == entity.statements() && entities == entity.entities())
        return entity;
      return new Entity(entity.symbol(), declarations, instances, connects, statements, entities, entity.loc());
    }
    if (tree instanceof Decl) {
      Decl decl = (Decl)tree;
      Optional<Expr> init = walkOptional(decl.init(), Expr.class);
      return init == decl.init() ? decl : new Decl(decl.symbol(), init, decl.loc());
    }
    if (tree instanceof Connect) {
      Connect connect = (Connect)tree;
      Expr lhs = walkSingle(connect.lhs(), Expr.class);
      List<Expr> rhs = walkList(connect.rhs(), Expr.class);
      return lhs == connect.lhs() && rhs == connect.rhs() ? connect : new Connect(lhs, rhs, connect.loc());
    }
    if (tree instanceof Thicket) {
      Thicket thicket = (Thicket)tree;
      List<Tree> trees = walkList(thicket.trees(), Tree.class);
      return trees == thicket.trees() ? thicket : new Thicket(trees, thicket.loc());
    }
    if (tree instanceof Stmt)
      return walkStmtChildren((Stmt)tree);
    if (tree instanceof CaseClause) {
      CaseClause clause = (CaseClause)tree;
      List<Expr> conditions = walkList(clause.conditions(), Expr.class);
      Stmt body = walkSingle(clause.body(), Stmt.class);
      return conditions == clause.conditions() && body == clause.body() ? clause : new CaseClause(conditions, body, clause.loc());
    }
    if (tree instanceof Expr)
      return walkExprChildren((Expr)tree);
    // Instance and leaves
    return tree;
  }

  private Tree walkStmtChildren(Stmt stmt) {
    if (stmt instanceof StmtBlock) {
      StmtBlock block = (StmtBlock)stmt;
      List<Stmt> body = walkList(block.body(), Stmt.class);
      return body == block.body() ? block : new StmtBlock(body, block.loc());
    }
    if (stmt instanceof StmtIf) {
      StmtIf stmtIf = (StmtIf)stmt;
      Expr cond = walkSingle(stmtIf.cond(), Expr.class);
      Stmt thenStmt = walkSingle(stmtIf.thenStmt(), Stmt.class);
      Optional<Stmt> elseStmt = walkOptional(stmtIf.elseStmt(), Stmt.class);
      if (cond == stmtIf.cond() && thenStmt == stmtIf.thenStmt() && elseStmt == stmtIf.elseStmt())
        return stmtIf;
      return new StmtIf(cond, thenStmt, elseStmt, stmtIf.loc());
    }
    if (stmt instanceof StmtCase) {
      StmtCase stmtCase = (StmtCase)stmt;
      Expr value = walkSingle(stmtCase.value(), Expr.class);
      List<CaseClause> clauses = walkList(stmtCase.clauses(), CaseClause.class);
      Optional<Stmt> defaultStmt = walkOptional(stmtCase.defaultStmt(), Stmt.class);
      if (value == stmtCase.value() && clauses == stmtCase.clauses() && defaultStmt == stmtCase.defaultStmt())
        return stmtCase;
      return new StmtCase(value, clauses, defaultStmt, stmtCase.loc());
    }
    if (stmt instanceof StmtLoop) {
      StmtLoop loop = (StmtLoop)stmt;
      List<Stmt> body = walkList(loop.body(), Stmt.class);
      return body == loop.body() ? loop : new StmtLoop(body, loop.loc());
    }
    if (stmt instanceof StmtAssign) {
      StmtAssign assign = (StmtAssign)stmt;
      Expr lhs = walkSingle(assign.lhs(), Expr.class);
      Expr rhs = walkSingle(assign.rhs(), Expr.class);
      return lhs == assign.lhs() && rhs == assign.rhs() ? assign : new StmtAssign(lhs, rhs, assign.loc());
    }
    if (stmt instanceof StmtExpr) {
      StmtExpr stmtExpr = (StmtExpr)stmt;
      Expr expr = walkSingle(stmtExpr.expr(), Expr.class);
      return expr == stmtExpr.expr() ? stmtExpr : new StmtExpr(expr, stmtExpr.loc());
    }
    if (stmt instanceof StmtStall) {
      StmtStall stall = (StmtStall)stmt;
      Expr cond = walkSingle(stall.cond(), Expr.class);
      return cond == stall.cond() ? stall : new StmtStall(cond, stall.loc());
    }
    // StmtRead, StmtWrite, StmtFence
    return stmt;
  }

  private Tree walkExprChildren(Expr expr) {
    if (expr instanceof ExprUnary) {
      ExprUnary unary = (ExprUnary)expr;
      Expr operand = walkSingle(unary.expr(), Expr.class);
      return operand == unary.expr() ? unary : new ExprUnary(unary.op(), operand, unary.loc());
    }
    if (expr instanceof ExprBinary) {
      ExprBinary binary = (ExprBinary)expr;
      Expr lhs = walkSingle(binary.lhs(), Expr.class);
      Expr rhs = walkSingle(binary.rhs(), Expr.class);
      return lhs == binary.lhs() && rhs == binary.rhs() ? binary : new ExprBinary(lhs, binary.op(), rhs, binary.loc());
    }
    if (expr instanceof ExprTernary) {
      ExprTernary ternary = (ExprTernary)expr;
      Expr cond = walkSingle(ternary.cond(), Expr.class);
      Expr thenExpr = walkSingle(ternary.thenExpr(), Expr.class);
      Expr elseExpr = walkSingle(ternary.elseExpr(), Expr.class);
      if (cond == ternary.cond() && thenExpr == ternary.thenExpr() && elseExpr == ternary.elseExpr())
        return ternary;
      return new ExprTernary(cond, thenExpr, elseExpr, ternary.loc());
    }
    if (expr instanceof ExprCat) {
      ExprCat cat = (ExprCat)expr;
      List<Expr> parts = walkList(cat.parts(), Expr.class);
      return parts == cat.parts() ? cat : new ExprCat(parts, cat.loc());
    }
    if (expr instanceof ExprIndex) {
      ExprIndex index = (ExprIndex)expr;
      Expr base = walkSingle(index.expr(), Expr.class);
      Expr idx = walkSingle(index.index(), Expr.class);
      return base == index.expr() && idx == index.index() ? index : new ExprIndex(base, idx, index.loc());
    }
    if (expr instanceof ExprSelect) {
      ExprSelect select = (ExprSelect)expr;
      Expr base = walkSingle(select.expr(), Expr.class);
      return base == select.expr() ? select : new ExprSelect(base, select.selector(), select.loc());
    }
    if (expr instanceof ExprCall) {
      ExprCall call = (ExprCall)expr;
      Expr target = walkSingle(call.expr(), Expr.class);
      List<Expr> args = walkList(call.args(), Expr.class);
      return target == call.expr() && args == call.args() ? call : new ExprCall(target, args, call.loc());
    }
    // ExprRef, ExprNum, ExprInt
    return expr;
  }
}
