package hdlower;

import hdlower.core.Attribute;
import hdlower.core.CompilerContext;
import hdlower.core.FlowControl;
import hdlower.core.Loc;
import hdlower.core.StorageType;
import hdlower.core.Symbols.Symbol;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeConst;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeInstance;
import hdlower.core.Types.TypeOut;
import hdlower.core.Types.TypePipeline;
import hdlower.core.Types.TypeSInt;
import hdlower.core.Types.TypeStack;
import hdlower.core.Types.TypeUInt;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprBinary;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprNum;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.ExprUnary;
import hdlower.tree.Instance;
import hdlower.tree.Root;
import hdlower.tree.Stmt;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtIf;
import hdlower.tree.Tree;
import hdlower.ui.LowerConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Builds typed trees for the pass tests. Every symbol and entity gets a distinct, increasing source location,
 * so source order is creation order.
 */
public class TestTreeBuilder {
  public final CompilerContext cc;
  private int offset = 0;

  public TestTreeBuilder() {
    LowerConfig config = new LowerConfig();
    config.applyTransformChecks = true;
    this.cc = new CompilerContext(config);
  }

  public Loc loc() {
    offset += 10;
    return new Loc("test.hdl", offset / 10, offset, offset + 5);
  }

  ///////////////////////////////////////////////////////////////////////////
  // Symbols
  ///////////////////////////////////////////////////////////////////////////

  public TermSymbol var(String name, Type kind) { return cc.newTermSymbol(name, loc(), kind); }
  public TermSymbol uint(String name, int width) { return var(name, new TypeUInt(width)); }
  public TermSymbol sint(String name, int width) { return var(name, new TypeSInt(width)); }

  public TermSymbol in(String name, int width) { return in(name, new TypeUInt(width), FlowControl.NONE); }
  public TermSymbol in(String name, Type kind, FlowControl flowControl) { return var(name, new TypeIn(kind, flowControl)); }

  public TermSymbol out(String name, int width) { return out(name, new TypeUInt(width), FlowControl.NONE, StorageType.REG); }
  public TermSymbol out(String name, Type kind, FlowControl flowControl, StorageType storage) {
    return var(name, new TypeOut(kind, flowControl, storage));
  }

  /** A const with its initializer also recorded as {@link Attribute#INIT}. */
  public TermSymbol konst(String name, int width, Expr init) {
    TermSymbol symbol = var(name, new TypeConst(new TypeUInt(width)));
    cc.attributes().set(symbol, Attribute.INIT, init);
    return symbol;
  }

  public TermSymbol pipeline(String name, int width) { return var(name, new TypePipeline(new TypeUInt(width))); }

  public TermSymbol stack(String name, int width, Expr depth) { return var(name, new TypeStack(new TypeUInt(width), depth)); }

  public TermSymbol instance(String name, Entity entity) { return var(name, new TypeInstance(entity.symbol())); }

  ///////////////////////////////////////////////////////////////////////////
  // Expressions and statements
  ///////////////////////////////////////////////////////////////////////////

  public static ExprRef ref(Symbol symbol) { return new ExprRef(symbol); }
  public static ExprInt u(int width, long value) { return new ExprInt(false, width, value); }
  public static ExprNum num(long value) { return new ExprNum(value); }
  public static ExprBinary bin(Expr lhs, String op, Expr rhs) { return new ExprBinary(lhs, op, rhs, Loc.UNKNOWN); }
  public static ExprUnary unary(String op, Expr expr) { return new ExprUnary(op, expr, Loc.UNKNOWN); }
  public static ExprCat cat(Expr... parts) { return new ExprCat(List.of(parts), Loc.UNKNOWN); }
  public static ExprCat cat(Symbol... parts) { return new ExprCat(Arrays.stream(parts).map(TestTreeBuilder::ref).map(Expr.class::cast).toList(), Loc.UNKNOWN); }
  public static ExprSelect select(Expr expr, String selector) { return new ExprSelect(expr, selector, Loc.UNKNOWN); }
  public static ExprSelect select(Symbol symbol, String selector) { return select(ref(symbol), selector); }
  public static ExprCall call(Symbol symbol, String method, Expr... args) {
    return new ExprCall(select(symbol, method), List.of(args), Loc.UNKNOWN);
  }

  public static StmtAssign assign(Expr lhs, Expr rhs) { return new StmtAssign(lhs, rhs, Loc.UNKNOWN); }
  public static StmtAssign assign(Symbol lhs, Expr rhs) { return assign(ref(lhs), rhs); }
  public static StmtExpr stmt(Expr expr) { return new StmtExpr(expr, Loc.UNKNOWN); }
  public static StmtBlock block(Stmt... body) { return new StmtBlock(List.of(body), Loc.UNKNOWN); }
  public static StmtIf ifThen(Expr cond, Stmt thenStmt) { return new StmtIf(cond, thenStmt, Optional.empty(), Loc.UNKNOWN); }
  public static StmtIf ifElse(Expr cond, Stmt thenStmt, Stmt elseStmt) {
    return new StmtIf(cond, thenStmt, Optional.of(elseStmt), Loc.UNKNOWN);
  }
  public static Connect connect(Expr lhs, Expr rhs) { return new Connect(lhs, rhs, Loc.UNKNOWN); }

  public static Root root(Entity... entities) { return new Root(List.of(entities)); }

  ///////////////////////////////////////////////////////////////////////////
  // Entities
  ///////////////////////////////////////////////////////////////////////////

  public EntityBuilder entity(String name) { return new EntityBuilder(name); }

  /** Collects the parts of one entity; the entity symbol's ports are the declared TypeIn/TypeOut symbols. */
  public class EntityBuilder {
    private final String name;
    private final Loc loc = loc();
    private final List<Decl> decls = new ArrayList<>();
    private final List<Instance> instances = new ArrayList<>();
    private final List<Connect> connects = new ArrayList<>();
    private final List<Stmt> statements = new ArrayList<>();
    private final List<Entity> entities = new ArrayList<>();

    private EntityBuilder(String name) { this.name = name; }

    public EntityBuilder decl(TermSymbol... symbols) {
      for (TermSymbol symbol : symbols)
        decls.add(new Decl(symbol));
      return this;
    }
    public EntityBuilder decl(TermSymbol symbol, Expr init) {
      decls.add(new Decl(symbol, init));
      return this;
    }
    public EntityBuilder instance(TermSymbol symbol) {
      instances.add(new Instance(symbol, ((TypeInstance)symbol.getKind()).entitySymbol(), loc));
      return this;
    }
    public EntityBuilder connect(Expr lhs, Expr rhs) {
      connects.add(TestTreeBuilder.connect(lhs, rhs));
      return this;
    }
    public EntityBuilder stmt(Stmt... stmts) {
      statements.addAll(List.of(stmts));
      return this;
    }
    public EntityBuilder nest(Entity... nested) {
      entities.addAll(List.of(nested));
      return this;
    }

    public Entity build() {
      List<TermSymbol> ports = decls.stream()
                                   .map(Decl::symbol)
                                   .filter(symbol -> symbol.getKind() instanceof TypeIn || symbol.getKind() instanceof TypeOut)
                                   .toList();
      TypeSymbol symbol = cc.newTypeSymbol(name, loc, new TypeEntity(ports));
      return new Entity(symbol, decls, instances, connects, statements, entities, loc);
    }
  }

  ///////////////////////////////////////////////////////////////////////////
  // Queries
  ///////////////////////////////////////////////////////////////////////////

  public static <T extends Tree> List<T> collect(Tree tree, Class<T> nodeClass) {
    return tree.preOrder().filter(nodeClass::isInstance).map(nodeClass::cast).toList();
  }

  public static Entity entityNamed(Root root, String name) {
    return root.entities().stream().filter(entity -> entity.getName().equals(name)).findFirst()
        .orElseThrow(() -> new AssertionError("No entity named " + name));
  }

  public static Optional<Decl> declNamed(Entity entity, String name) {
    return entity.declarations().stream().filter(decl -> decl.symbol().getName().equals(name)).findFirst();
  }
}
