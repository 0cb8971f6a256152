package hdlower.core;

import hdlower.analysis.ConstantEvaluator;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeArray;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeOut;
import hdlower.core.Types.TypeUInt;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprBinary;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprIndex;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.ExprUnary;
import hdlower.tree.Stmt;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtBlock;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtIf;
import hdlower.util.Bits;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generates the entity implementing a hardware stack of a given element type and depth.
 * <p>
 * Ports: inputs {@code en, d, push, pop}, outputs {@code q, empty, full}. On a cycle with {@code en} set, at most one of
 * push (store {@code d} on top), pop (drop the top) and set (neither push nor pop: replace the top with {@code d}) happens.
 * {@code q} is the top element.
 */
public class StackFactory {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilerContext cc;

  public StackFactory(CompilerContext cc) { this.cc = cc; }

  /** Fixed port names of generated stack entities. */
  public static final String PORT_EN = "en";
  public static final String PORT_D = "d";
  public static final String PORT_PUSH = "push";
  public static final String PORT_POP = "pop";
  public static final String PORT_Q = "q";
  public static final String PORT_EMPTY = "empty";
  public static final String PORT_FULL = "full";

  /**
   * Builds the stack entity. The depth must fold to a positive constant.
   * @param name name of the generated entity
   * @param kind element type, must be packed
   * @param depthExpr number of elements
   */
  public Entity build(String name, Loc loc, Type kind, Expr depthExpr) {
    Optional<BigInteger> depthValue = new ConstantEvaluator(cc.attributes()).value(depthExpr);
    if (depthValue.isEmpty() || depthValue.get().signum() <= 0 || depthValue.get().bitLength() > 30)
      throw cc.ice(depthExpr, "Stack with non-computable depth");
    if (!kind.isPacked())
      throw cc.ice(loc, "Stack element type " + kind + " is not packed");
    int depth = depthValue.get().intValue();
    logger.debug("Generating stack entity {} of depth {} and element type {}", name, depth, kind);
    return depth == 1 ? buildSingle(name, loc, kind) : buildMulti(name, loc, kind, depth);
  }

  /** Depth 1: storage register plus valid flag, empty/full are wires derived from the flag. */
  private Entity buildSingle(String name, Loc loc, Type kind) {
    Ports ports = new Ports(loc, kind, StorageType.WIRE);
    TermSymbol valid = cc.newTermSymbol("valid", loc, Types.bool());
    TermSymbol storage = cc.newTermSymbol("storage", loc, kind);
    Expr validInit = new ExprInt(false, 1, 0);
    cc.attributes().set(valid, Attribute.INIT, validInit);

    List<Decl> decls = new ArrayList<>(ports.decls());
    decls.add(new Decl(valid, validInit));
    decls.add(new Decl(storage));

    // if (en) { storage = d; valid = ~pop & (valid | push); }
    Stmt body = new StmtIf(ref(ports.en), block(loc, assign(storage, ref(ports.d)),
                                                  assign(valid, and(not(ref(ports.pop)), binary(ref(valid), "|", ref(ports.push))))),
                           Optional.empty(), loc);

    List<Connect> connects = List.of(new Connect(not(ref(valid)), ref(ports.empty), loc), new Connect(ref(valid), ref(ports.full), loc),
                                     new Connect(ref(storage), ref(ports.q), loc));
    return entity(name, loc, ports, decls, connects, body);
  }

  /** Depth N: array of N registers, pointer register and registered empty/full flags. */
  private Entity buildMulti(String name, Loc loc, Type kind, int depth) {
    Ports ports = new Ports(loc, kind, StorageType.REG);
    int ptrWidth = Bits.clog2(depth);
    TermSymbol storage = cc.newTermSymbol("storage", loc, new TypeArray(kind, depth));
    TermSymbol ptr = cc.newTermSymbol("ptr", loc, new TypeUInt(ptrWidth));
    Expr ptrInit = new ExprInt(false, ptrWidth, 0);
    cc.attributes().set(ptr, Attribute.INIT, ptrInit);

    List<Decl> decls = new ArrayList<>(ports.decls());
    decls.add(new Decl(storage));
    decls.add(new Decl(ptr, ptrInit));

    Expr ptrIsZero = binary(ref(ptr), "==", new ExprInt(false, ptrWidth, 0));
    Expr ptrIsLast = binary(ref(ptr), "==", new ExprInt(false, ptrWidth, depth - 1));
    Stmt onPop = block(loc, assign(ports.empty, ptrIsZero), assign(ports.full, new ExprInt(false, 1, 0)),
                       assign(ptr, binary(ref(ptr), "-", zext(not(ref(ports.empty)), ptrWidth))));
    Expr incr = and(and(not(ref(ports.empty)), not(ref(ports.full))), ref(ports.push));
    Stmt write = new StmtExpr(new ExprCall(new ExprSelect(ref(storage), "write", loc), List.of(ref(ptr), ref(ports.d)), loc), loc);
    Stmt onPushOrSet = block(loc, assign(ptr, binary(ref(ptr), "+", zext(incr, ptrWidth))), write,
                             assign(ports.empty, and(ref(ports.empty), not(ref(ports.push)))), assign(ports.full, ptrIsLast));
    Stmt body = new StmtIf(ref(ports.en), block(loc, new StmtIf(ref(ports.pop), onPop, Optional.of(onPushOrSet), loc)), Optional.empty(), loc);

    List<Connect> connects = List.of(new Connect(new ExprIndex(ref(storage), ref(ptr), loc), ref(ports.q), loc));
    return entity(name, loc, ports, decls, connects, body);
  }

  private Entity entity(String name, Loc loc, Ports ports, List<Decl> decls, List<Connect> connects, Stmt body) {
    TypeEntity kind = new TypeEntity(ports.all());
    TypeSymbol symbol = cc.newTypeSymbol(name, loc, kind);
    cc.attributes().set(symbol, Attribute.VARIANT, "fsm");
    cc.attributes().set(symbol, Attribute.HIGH_LEVEL_KIND, kind);
    return new Entity(symbol, decls, List.of(), connects, List.of(body), List.of(), loc);
  }

  /** The port symbols of one stack entity. */
  private class Ports {
    final TermSymbol en, d, push, pop, q, empty, full;
    private final boolean registeredFlags;

    Ports(Loc loc, Type kind, StorageType flagStorage) {
      en = cc.newTermSymbol(PORT_EN, loc, new TypeIn(Types.bool(), FlowControl.NONE));
      d = cc.newTermSymbol(PORT_D, loc, new TypeIn(kind, FlowControl.NONE));
      push = cc.newTermSymbol(PORT_PUSH, loc, new TypeIn(Types.bool(), FlowControl.NONE));
      pop = cc.newTermSymbol(PORT_POP, loc, new TypeIn(Types.bool(), FlowControl.NONE));
      q = cc.newTermSymbol(PORT_Q, loc, new TypeOut(kind, FlowControl.NONE, StorageType.WIRE));
      empty = cc.newTermSymbol(PORT_EMPTY, loc, new TypeOut(Types.bool(), FlowControl.NONE, flagStorage));
      full = cc.newTermSymbol(PORT_FULL, loc, new TypeOut(Types.bool(), FlowControl.NONE, flagStorage));
      registeredFlags = !flagStorage.isWire();
      if (registeredFlags) {
        cc.attributes().set(empty, Attribute.INIT, new ExprInt(false, 1, 1));
        cc.attributes().set(full, Attribute.INIT, new ExprInt(false, 1, 0));
      }
    }

    List<TermSymbol> all() { return List.of(en, d, push, pop, q, empty, full); }

    List<Decl> decls() {
      List<Decl> decls = new ArrayList<>();
      for (TermSymbol port : all())
        decls.add(registeredFlags && (port == empty || port == full) ? new Decl(port, cc.attributes().get(port, Attribute.INIT).get())
                                                                    : new Decl(port));
      return decls;
    }
  }

  ///////////////////////////////////////////////////////////////////////////
  // Tree construction helpers
  ///////////////////////////////////////////////////////////////////////////

  private static ExprRef ref(TermSymbol symbol) { return new ExprRef(symbol, symbol.getLoc()); }
  private static Expr not(Expr expr) { return new ExprUnary("~", expr, expr.loc()); }
  private static Expr and(Expr lhs, Expr rhs) { return binary(lhs, "&", rhs); }
  private static Expr binary(Expr lhs, String op, Expr rhs) { return new ExprBinary(lhs, op, rhs, lhs.loc()); }
  private static Stmt assign(TermSymbol target, Expr rhs) { return new StmtAssign(ref(target), rhs, target.getLoc()); }
  private static Stmt block(Loc loc, Stmt... body) { return new StmtBlock(List.of(body), loc); }

  /** Zero-extends a 1-bit value to {@code width} bits. */
  private static Expr zext(Expr bit, int width) {
    if (width <= 1)
      return bit;
    return new ExprCat(List.of(new ExprInt(false, width - 1, 0), bit), bit.loc());
  }
}
