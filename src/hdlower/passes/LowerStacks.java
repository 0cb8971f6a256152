package hdlower.passes;

import hdlower.core.Attribute;
import hdlower.core.CompilerContext;
import hdlower.core.Loc;
import hdlower.core.StackFactory;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeInstance;
import hdlower.core.Types.TypeStack;
import hdlower.tree.CaseClause;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.Instance;
import hdlower.tree.Stmt;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtCase;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtFence;
import hdlower.tree.StmtIf;
import hdlower.tree.StmtLoop;
import hdlower.tree.Thicket;
import hdlower.tree.Tree;
import hdlower.util.ScopeStack;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Replaces stack variables by instances of generated stack entities (see {@link StackFactory}).
 * <p>
 * For a stack {@code s}, the owner gets local control signals {@code s_en}, {@code s_push}, {@code s_pop} and {@code s_d},
 * zeroed at the start of the body and connected to the stack instance. Stack operations become assignments to them:
 * <pre>
 *   s.push(x);     =&gt;  s_en = 1; s_push = 1; s_d = x;
 *   s.pop();       =&gt;  s_en = 1; s_pop = 1;
 *   v = s.pop();   =&gt;  v = s.q; s_en = 1; s_pop = 1;
 *   s.set(x);      =&gt;  s_en = 1; s_d = x;
 *   s.top, s.full, s.empty  =&gt;  s.q, s.full, s.empty
 * </pre>
 * The generated entity is nested into the owner, to be lifted by {@link LiftEntities}.
 */
public class LowerStacks extends TreeTransformer {

  /** Everything generated for one stack variable. */
  private record StackInfo(TermSymbol stack, TermSymbol instance, Entity entity, TermSymbol en, TermSymbol push, TermSymbol pop,
                           TermSymbol d) {}

  private final StackFactory factory;
  private final ScopeStack<Map<TermSymbol, StackInfo>> scopes = new ScopeStack<>();

  public LowerStacks(CompilerContext cc) {
    super(cc);
    this.factory = new StackFactory(cc);
  }

  private static boolean isStack(TermSymbol symbol) { return symbol.getKind() instanceof TypeStack; }

  @Override
  protected boolean skip(Tree tree) {
    if (tree instanceof Entity && scopes.isEmpty())
      return tree.preOrder().noneMatch(node -> node instanceof Decl && isStack(((Decl)node).symbol()));
    return false;
  }

  @Override
  protected void enter(Tree tree) {
    if (!(tree instanceof Entity))
      return;
    Entity entity = (Entity)tree;
    Map<TermSymbol, StackInfo> stacks = new LinkedHashMap<>();
    for (Decl decl : entity.declarations()) {
      if (isStack(decl.symbol()))
        stacks.put(decl.symbol(), materialize(decl));
    }
    if (!stacks.isEmpty()) {
      checkSingleOperation(entity.statements(), stacks.keySet(), Set.of());
    }
    scopes.push(stacks);
  }

  @Override
  protected void leave(Tree original) {
    if (original instanceof Entity)
      scopes.pop();
  }

  private StackInfo materialize(Decl decl) {
    TermSymbol stack = decl.symbol();
    TypeStack kind = (TypeStack)stack.getKind();
    String name = stack.getName();
    Loc loc = decl.loc();
    Entity entity = factory.build("stack_" + name, loc, kind.element(), kind.depth());
    cc.attributes().set(entity.symbol(), Attribute.STACK_OF, stack);
    TermSymbol instance = cc.newTermSymbol(name, loc, new TypeInstance(entity.symbol()));
    TermSymbol en = cc.newTermSymbol(name + "_en", loc, Types.bool());
    TermSymbol push = cc.newTermSymbol(name + "_push", loc, Types.bool());
    TermSymbol pop = cc.newTermSymbol(name + "_pop", loc, Types.bool());
    TermSymbol d = cc.newTermSymbol(name + "_d", loc, kind.element());
    logger.debug("Lowering stack {} to instance of {}", name, entity.getName());
    return new StackInfo(stack, instance, entity, en, push, pop, d);
  }

  private Optional<StackInfo> stackOf(Expr expr) {
    if (scopes.isEmpty() || !(expr instanceof ExprRef) || !(((ExprRef)expr).symbol() instanceof TermSymbol))
      return Optional.empty();
    return Optional.ofNullable(scopes.top().get(((ExprRef)expr).symbol()));
  }

  /** Matches {@code s.method(args)} on a stack of the current entity. */
  private Optional<StackInfo> stackCall(Expr expr, String method) {
    if (!(expr instanceof ExprCall) || !(((ExprCall)expr).expr() instanceof ExprSelect))
      return Optional.empty();
    ExprSelect select = (ExprSelect)((ExprCall)expr).expr();
    if (!select.selector().equals(method))
      return Optional.empty();
    return stackOf(select.expr());
  }

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof ExprSelect) {
      ExprSelect select = (ExprSelect)tree;
      Optional<StackInfo> info = stackOf(select.expr());
      if (info.isEmpty())
        return select;
      String port;
      switch (select.selector()) {
      case "top":
        port = StackFactory.PORT_Q;
        break;
      case "full":
        port = StackFactory.PORT_FULL;
        break;
      case "empty":
        port = StackFactory.PORT_EMPTY;
        break;
      default:
        // method selection, rewritten with the enclosing statement
        return select;
      }
      return new ExprSelect(new ExprRef(info.get().instance(), select.expr().loc()), port, select.loc());
    }
    if (tree instanceof StmtExpr) {
      StmtExpr stmt = (StmtExpr)tree;
      Loc loc = stmt.loc();
      Optional<StackInfo> push = stackCall(stmt.expr(), "push");
      if (push.isPresent())
        return thicket(loc, set(push.get().en(), 1, loc), set(push.get().push(), 1, loc),
                       new StmtAssign(ref(push.get().d(), loc), onlyArg(stmt.expr()), loc));
      Optional<StackInfo> pop = stackCall(stmt.expr(), "pop");
      if (pop.isPresent())
        return thicket(loc, set(pop.get().en(), 1, loc), set(pop.get().pop(), 1, loc));
      Optional<StackInfo> setTop = stackCall(stmt.expr(), "set");
      if (setTop.isPresent())
        return thicket(loc, set(setTop.get().en(), 1, loc), new StmtAssign(ref(setTop.get().d(), loc), onlyArg(stmt.expr()), loc));
      return stmt;
    }
    if (tree instanceof StmtAssign) {
      StmtAssign assign = (StmtAssign)tree;
      Optional<StackInfo> pop = stackCall(assign.rhs(), "pop");
      if (pop.isEmpty())
        return assign;
      Loc loc = assign.loc();
      Expr top = new ExprSelect(ref(pop.get().instance(), loc), StackFactory.PORT_Q, loc);
      return thicket(loc, new StmtAssign(assign.lhs(), top, loc), set(pop.get().en(), 1, loc), set(pop.get().pop(), 1, loc));
    }
    if (tree instanceof Entity)
      return lower((Entity)tree, scopes.top());
    return tree;
  }

  private Entity lower(Entity entity, Map<TermSymbol, StackInfo> stacks) {
    if (stacks.isEmpty())
      return entity;
    // Stack pops left over are not in statement or assignment position
    entity.statements().forEach(stmt -> stmt.preOrder().forEach(node -> {
      if (node instanceof Expr && stackCall((Expr)node, "pop").isPresent())
        cc.error(node, "Stack 'pop' must be a statement or the right hand side of an assignment");
    }));

    List<Decl> decls = new ArrayList<>();
    List<Instance> instances = new ArrayList<>(entity.instances());
    List<Connect> connects = new ArrayList<>(entity.connects());
    List<Stmt> statements = new ArrayList<>();
    List<Entity> entities = new ArrayList<>(entity.entities());
    for (Decl decl : entity.declarations()) {
      StackInfo info = stacks.get(decl.symbol());
      if (info == null) {
        decls.add(decl);
        continue;
      }
      Loc loc = decl.loc();
      for (TermSymbol signal : List.of(info.en(), info.push(), info.pop(), info.d())) {
        decls.add(new Decl(signal, Optional.empty(), loc));
        statements.add(new StmtAssign(ref(signal, loc), zero(signal.getKind()), loc));
      }
      instances.add(new Instance(info.instance(), info.entity().symbol(), loc));
      connects.add(connect(info.en(), info.instance(), StackFactory.PORT_EN, loc));
      connects.add(connect(info.push(), info.instance(), StackFactory.PORT_PUSH, loc));
      connects.add(connect(info.pop(), info.instance(), StackFactory.PORT_POP, loc));
      connects.add(connect(info.d(), info.instance(), StackFactory.PORT_D, loc));
      entities.add(info.entity());
    }
    statements.addAll(entity.statements());
    return new Entity(entity.symbol(), decls, instances, connects, statements, entities, entity.loc());
  }

  /**
   * Reports more than one operation on the same stack between two clock boundaries on any control path.
   * @param used stacks already operated on since the last fence
   * @return stacks operated on since the last fence on some path through {@code stmts}
   */
  private Set<TermSymbol> checkSingleOperation(List<Stmt> stmts, Set<TermSymbol> stacks, Set<TermSymbol> used) {
    Set<TermSymbol> state = used;
    for (Stmt stmt : stmts)
      state = checkSingleOperation(stmt, stacks, state);
    return state;
  }

  private Set<TermSymbol> checkSingleOperation(Stmt stmt, Set<TermSymbol> stacks, Set<TermSymbol> used) {
    if (stmt instanceof StmtFence)
      return Set.of();
    if (stmt instanceof StmtBlock)
      return checkSingleOperation(((StmtBlock)stmt).body(), stacks, used);
    if (stmt instanceof StmtIf) {
      StmtIf stmtIf = (StmtIf)stmt;
      Set<TermSymbol> thenOut = checkSingleOperation(stmtIf.thenStmt(), stacks, used);
      Set<TermSymbol> elseOut = stmtIf.elseStmt().isPresent() ? checkSingleOperation(stmtIf.elseStmt().get(), stacks, used) : used;
      return union(thenOut, elseOut);
    }
    if (stmt instanceof StmtCase) {
      StmtCase stmtCase = (StmtCase)stmt;
      Set<TermSymbol> out = stmtCase.defaultStmt().isPresent() ? checkSingleOperation(stmtCase.defaultStmt().get(), stacks, used) : used;
      for (CaseClause clause : stmtCase.clauses())
        out = union(out, checkSingleOperation(clause.body(), stacks, used));
      return out;
    }
    if (stmt instanceof StmtLoop)
      return union(used, checkSingleOperation(((StmtLoop)stmt).body(), stacks, used));

    Expr call = stmt instanceof StmtExpr ? ((StmtExpr)stmt).expr() : stmt instanceof StmtAssign ? ((StmtAssign)stmt).rhs() : null;
    if (!(call instanceof ExprCall) || !(((ExprCall)call).expr() instanceof ExprSelect))
      return used;
    ExprSelect select = (ExprSelect)((ExprCall)call).expr();
    if (!(select.expr() instanceof ExprRef) || !List.of("push", "pop", "set").contains(select.selector()))
      return used;
    var symbol = ((ExprRef)select.expr()).symbol();
    if (!(symbol instanceof TermSymbol) || !stacks.contains(symbol))
      return used;
    if (used.contains(symbol)) {
      cc.error(stmt, "Multiple operations on stack '" + symbol.getName() + "' in the same cycle");
      return used;
    }
    return union(used, Set.of((TermSymbol)symbol));
  }

  private static Set<TermSymbol> union(Set<TermSymbol> a, Set<TermSymbol> b) {
    Set<TermSymbol> result = new HashSet<>(a);
    result.addAll(b);
    return result;
  }

  @Override
  protected void finalCheck(Tree result) {
    if (!scopes.isEmpty())
      throw cc.ice(result, "LowerStacks scope stack not empty at the end of the pass");
    result.preOrder()
        .filter(node -> node instanceof Decl && isStack(((Decl)node).symbol()))
        .findFirst()
        .ifPresent(node -> { throw cc.ice(node, "Stack declaration remains after LowerStacks"); });
  }

  ///////////////////////////////////////////////////////////////////////////
  // Tree construction helpers
  ///////////////////////////////////////////////////////////////////////////

  private static ExprRef ref(TermSymbol symbol, Loc loc) { return new ExprRef(symbol, loc); }

  private static Stmt set(TermSymbol signal, long value, Loc loc) {
    return new StmtAssign(ref(signal, loc), new ExprInt(false, 1, BigInteger.valueOf(value), loc), loc);
  }

  private static Expr zero(Type kind) { return new ExprInt(kind.isSigned(), kind.width(), 0); }

  private static Connect connect(TermSymbol signal, TermSymbol instance, String port, Loc loc) {
    return new Connect(ref(signal, loc), new ExprSelect(ref(instance, loc), port, loc), loc);
  }

  private static Thicket thicket(Loc loc, Stmt... stmts) { return new Thicket(List.of(stmts), loc); }

  private Expr onlyArg(Expr call) {
    List<Expr> args = ((ExprCall)call).args();
    if (args.size() != 1)
      throw cc.ice(call, "Stack method expects exactly one argument, got " + args.size());
    return args.get(0);
  }
}
