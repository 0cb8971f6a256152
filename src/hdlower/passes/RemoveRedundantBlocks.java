package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.Stmt;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtIf;
import hdlower.tree.StmtLoop;
import hdlower.tree.Tree;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Splices nested blocks into the enclosing statement list and unwraps single-statement blocks. */
public class RemoveRedundantBlocks extends TreeTransformer {
  public RemoveRedundantBlocks(CompilerContext cc) { super(cc); }

  @Override
  protected boolean skip(Tree tree) {
    return tree instanceof Expr;
  }

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof StmtBlock) {
      StmtBlock block = (StmtBlock)tree;
      List<Stmt> body = flatten(block.body());
      if (body.size() == 1)
        return body.get(0);
      return body == block.body() ? block : new StmtBlock(body, block.loc());
    }
    if (tree instanceof StmtLoop) {
      StmtLoop loop = (StmtLoop)tree;
      List<Stmt> body = flatten(loop.body());
      return body == loop.body() ? loop : new StmtLoop(body, loop.loc());
    }
    if (tree instanceof StmtIf) {
      StmtIf stmtIf = (StmtIf)tree;
      if (stmtIf.elseStmt().filter(RemoveRedundantBlocks::isEmptyBlock).isPresent())
        return new StmtIf(stmtIf.cond(), stmtIf.thenStmt(), Optional.empty(), stmtIf.loc());
      return stmtIf;
    }
    if (tree instanceof Entity) {
      Entity entity = (Entity)tree;
      List<Stmt> statements = flatten(entity.statements());
      return statements == entity.statements() ? entity : entity.withStatements(statements);
    }
    return tree;
  }

  private static boolean isEmptyBlock(Stmt stmt) { return stmt instanceof StmtBlock && ((StmtBlock)stmt).body().isEmpty(); }

  /** Returns {@code stmts} itself if it holds no blocks. */
  private static List<Stmt> flatten(List<Stmt> stmts) {
    if (stmts.stream().noneMatch(StmtBlock.class::isInstance))
      return stmts;
    List<Stmt> result = new ArrayList<>();
    for (Stmt stmt : stmts) {
      if (stmt instanceof StmtBlock)
        result.addAll(flatten(((StmtBlock)stmt).body()));
      else
        result.add(stmt);
    }
    return result;
  }
}
