package hdlower.tree;

import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeArray;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeInstance;
import hdlower.core.Types.TypeNum;
import hdlower.core.Types.TypeOut;
import hdlower.core.Types.TypeSInt;
import hdlower.core.Types.TypeStack;
import hdlower.core.Types.TypeStruct;
import hdlower.core.Types.TypeUInt;
import hdlower.core.Types.TypeVoid;
import java.util.List;
import java.util.Set;

/**
 * Derives expression types from the kinds of the referenced symbols.
 * Only the expression shapes the lowering passes produce or consume are covered; anything else is {@link TypeVoid}.
 */
public final class TypeAssigner {
  private TypeAssigner() {}

  private static final Set<String> comparisonOps = Set.of("==", "!=", "<", ">", "<=", ">=", "&&", "||");
  private static final Set<String> shiftOps = Set.of("<<", ">>", "<<<", ">>>");
  private static final Set<String> reductionOps = Set.of("&", "|", "^", "!");

  public static Type typeOf(Expr expr) {
    if (expr instanceof ExprRef) {
      Type kind = ((ExprRef)expr).symbol().getKind();
      if (kind instanceof TypeInstance || kind instanceof TypeStack || kind instanceof TypeEntity)
        return kind;
      return kind.underlying();
    }
    if (expr instanceof ExprNum)
      return new TypeNum(((ExprNum)expr).signed());
    if (expr instanceof ExprInt) {
      ExprInt exprInt = (ExprInt)expr;
      return exprInt.signed() ? new TypeSInt(exprInt.width()) : new TypeUInt(exprInt.width());
    }
    if (expr instanceof ExprUnary) {
      ExprUnary unary = (ExprUnary)expr;
      return reductionOps.contains(unary.op()) ? new TypeUInt(1) : unary.expr().tpe();
    }
    if (expr instanceof ExprBinary) {
      ExprBinary binary = (ExprBinary)expr;
      if (comparisonOps.contains(binary.op()))
        return new TypeUInt(1);
      Type lhsType = binary.lhs().tpe();
      if (shiftOps.contains(binary.op()))
        return lhsType;
      return combine(lhsType, binary.rhs().tpe());
    }
    if (expr instanceof ExprTernary) {
      ExprTernary ternary = (ExprTernary)expr;
      Type thenType = ternary.thenExpr().tpe();
      return thenType.isPacked() ? thenType : ternary.elseExpr().tpe();
    }
    if (expr instanceof ExprCat) {
      List<Type> partTypes = ((ExprCat)expr).parts().stream().map(Expr::tpe).toList();
      if (!partTypes.stream().allMatch(Type::isPacked))
        return TypeVoid.INSTANCE;
      return new TypeUInt(partTypes.stream().mapToInt(Type::width).sum());
    }
    if (expr instanceof ExprIndex) {
      Type base = ((ExprIndex)expr).expr().tpe();
      return base instanceof TypeArray ? ((TypeArray)base).element() : new TypeUInt(1);
    }
    if (expr instanceof ExprSelect)
      return selectType((ExprSelect)expr);
    if (expr instanceof ExprCall)
      return callType((ExprCall)expr);
    return TypeVoid.INSTANCE;
  }

  /** The kind of the symbol for references, the type otherwise. Keeps port-ness visible for method selection. */
  public static Type kindOf(Expr expr) {
    if (expr instanceof ExprRef)
      return ((ExprRef)expr).symbol().getKind();
    return expr.tpe();
  }

  private static Type combine(Type a, Type b) {
    if (a.isPacked() && b.isPacked()) {
      int width = Math.max(a.width(), b.width());
      return a.isSigned() && b.isSigned() ? new TypeSInt(width) : new TypeUInt(width);
    }
    if (a.isPacked())
      return a;
    if (b.isPacked())
      return b;
    return new TypeNum(a.isSigned() && b.isSigned());
  }

  private static Type selectType(ExprSelect select) {
    Type base = kindOf(select.expr());
    String sel = select.selector();
    if (base instanceof TypeStruct)
      return ((TypeStruct)base).fieldType(sel).orElse(TypeVoid.INSTANCE);
    if (base instanceof TypeInstance) {
      Type entityKind = ((TypeInstance)base).entitySymbol().getKind();
      if (entityKind instanceof TypeEntity)
        return ((TypeEntity)entityKind).port(sel).map(TermSymbol::getKind).map(Type::underlying).orElse(TypeVoid.INSTANCE);
      return TypeVoid.INSTANCE;
    }
    if (base instanceof TypeStack) {
      switch (sel) {
      case "top":
        return ((TypeStack)base).element();
      case "full":
      case "empty":
        return new TypeUInt(1);
      default:
        return TypeVoid.INSTANCE;
      }
    }
    if ((base instanceof TypeIn || base instanceof TypeOut) && (sel.equals("valid") || sel.equals("ready")))
      return new TypeUInt(1);
    if (base.underlying() instanceof TypeStruct)
      return ((TypeStruct)base.underlying()).fieldType(sel).orElse(TypeVoid.INSTANCE);
    return TypeVoid.INSTANCE;
  }

  private static Type callType(ExprCall call) {
    if (!(call.expr() instanceof ExprSelect))
      return TypeVoid.INSTANCE;
    ExprSelect select = (ExprSelect)call.expr();
    Type base = kindOf(select.expr());
    if (base instanceof TypeIn && select.selector().equals("read"))
      return base.underlying();
    if (base instanceof TypeStack && select.selector().equals("pop"))
      return ((TypeStack)base).element();
    return TypeVoid.INSTANCE;
  }
}
