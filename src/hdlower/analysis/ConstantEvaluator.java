package hdlower.analysis;

import hdlower.core.Attribute;
import hdlower.core.AttributeStore;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeConst;
import hdlower.tree.Expr;
import hdlower.tree.ExprBinary;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprIndex;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprNum;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprTernary;
import hdlower.tree.ExprUnary;
import hdlower.util.Bits;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Folds integer expressions to their value, given the bindings valid at the point of evaluation.
 * References to {@code const} symbols fold through their {@link Attribute#INIT} initializer.
 * Sized results are truncated to the width of the expression.
 */
public class ConstantEvaluator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Shift amounts beyond this are not folded. */
  private static final int MAX_SHIFT = 1 << 16;
  /** Operators whose result depends on the signedness of the operands, not only on their bits. */
  private static final Set<String> contextSensitiveOps = Set.of("/", "%", "==", "!=", "<", ">", "<=", ">=");

  private final AttributeStore attributes;

  public ConstantEvaluator(AttributeStore attributes) { this.attributes = attributes; }

  public Optional<BigInteger> value(Expr expr) { return value(expr, Bindings.empty()); }

  public Optional<BigInteger> value(Expr expr, Bindings bindings) {
    return Optional.ofNullable(eval(expr, bindings, new HashSet<>()));
  }

  /** Returns the condition value as a boolean, or empty if it does not fold. */
  public Optional<Boolean> truth(Expr cond, Bindings bindings) {
    return value(cond, bindings).map(value -> value.signum() != 0);
  }

  private BigInteger eval(Expr expr, Bindings bindings, Set<TermSymbol> visitingConsts) {
    BigInteger result = evalUntruncated(expr, bindings, visitingConsts);
    if (result == null)
      return null;
    Type type = expr.tpe();
    if (type.isPacked())
      return Bits.truncate(result, type.width(), type.isSigned());
    return result;
  }

  private BigInteger evalUntruncated(Expr expr, Bindings bindings, Set<TermSymbol> visitingConsts) {
    if (expr instanceof ExprNum)
      return ((ExprNum)expr).value();
    if (expr instanceof ExprInt)
      return ((ExprInt)expr).value();
    if (expr instanceof ExprRef)
      return evalRef((ExprRef)expr, bindings, visitingConsts);
    if (expr instanceof ExprUnary) {
      ExprUnary unary = (ExprUnary)expr;
      BigInteger operand = eval(unary.expr(), bindings, visitingConsts);
      return operand == null ? null : unaryOp(unary.op(), operand, unary.expr().tpe());
    }
    if (expr instanceof ExprBinary) {
      ExprBinary binary = (ExprBinary)expr;
      BigInteger lhs = eval(binary.lhs(), bindings, visitingConsts);
      if (lhs == null)
        return null;
      // Short circuit
      if (binary.op().equals("&&") && lhs.signum() == 0)
        return BigInteger.ZERO;
      if (binary.op().equals("||") && lhs.signum() != 0)
        return BigInteger.ONE;
      BigInteger rhs = eval(binary.rhs(), bindings, visitingConsts);
      return rhs == null ? null : binaryOp(binary.op(), lhs, rhs, binary.lhs().tpe(), binary.rhs().tpe());
    }
    if (expr instanceof ExprTernary) {
      ExprTernary ternary = (ExprTernary)expr;
      BigInteger cond = eval(ternary.cond(), bindings, visitingConsts);
      if (cond == null)
        return null;
      return eval(cond.signum() != 0 ? ternary.thenExpr() : ternary.elseExpr(), bindings, visitingConsts);
    }
    if (expr instanceof ExprCat) {
      BigInteger acc = BigInteger.ZERO;
      for (Expr part : ((ExprCat)expr).parts()) {
        Type partType = part.tpe();
        if (!partType.isPacked())
          return null;
        BigInteger partValue = eval(part, bindings, visitingConsts);
        if (partValue == null)
          return null;
        acc = acc.shiftLeft(partType.width()).or(partValue.and(Bits.mask(partType.width())));
      }
      return acc;
    }
    if (expr instanceof ExprIndex) {
      ExprIndex index = (ExprIndex)expr;
      if (!index.expr().tpe().isPacked())
        return null;
      BigInteger base = eval(index.expr(), bindings, visitingConsts);
      BigInteger idx = eval(index.index(), bindings, visitingConsts);
      if (base == null || idx == null || idx.signum() < 0 || idx.bitLength() > 31 || idx.intValue() >= index.expr().tpe().width())
        return null;
      return base.testBit(idx.intValue()) ? BigInteger.ONE : BigInteger.ZERO;
    }
    return null;
  }

  private BigInteger evalRef(ExprRef ref, Bindings bindings, Set<TermSymbol> visitingConsts) {
    if (!(ref.symbol() instanceof TermSymbol))
      return null;
    TermSymbol symbol = (TermSymbol)ref.symbol();
    Optional<BigInteger> bound = bindings.get(symbol);
    if (bound.isPresent())
      return bound.get();
    if (!(symbol.getKind() instanceof TypeConst))
      return null;
    Optional<Expr> init = attributes.get(symbol, Attribute.INIT);
    if (init.isEmpty() || !visitingConsts.add(symbol)) {
      if (init.isPresent())
        logger.warn("Cyclic constant definition through {}", symbol);
      return null;
    }
    try {
      return eval(init.get(), bindings, visitingConsts);
    } finally {
      visitingConsts.remove(symbol);
    }
  }

  private static BigInteger unaryOp(String op, BigInteger operand, Type operandType) {
    switch (op) {
    case "+":
      return operand;
    case "-":
      return operand.negate();
    case "~":
      return operand.not();
    case "!":
      return bool(operand.signum() == 0);
    default:
      break;
    }
    if (!operandType.isPacked())
      return null;
    BigInteger bits = operand.and(Bits.mask(operandType.width()));
    switch (op) {
    case "&":
      return bool(bits.equals(Bits.mask(operandType.width())));
    case "|":
      return bool(bits.signum() != 0);
    case "^":
      return bool(bits.bitCount() % 2 == 1);
    default:
      return null;
    }
  }

  private static BigInteger binaryOp(String op, BigInteger lhs, BigInteger rhs, Type lhsType, Type rhsType) {
    // Mixed signedness makes the whole operation unsigned at the wider width
    if (contextSensitiveOps.contains(op) && lhsType.isPacked() && rhsType.isPacked() && !(lhsType.isSigned() && rhsType.isSigned())) {
      BigInteger mask = Bits.mask(Math.max(lhsType.width(), rhsType.width()));
      lhs = lhs.and(mask);
      rhs = rhs.and(mask);
    }
    switch (op) {
    case "+":
      return lhs.add(rhs);
    case "-":
      return lhs.subtract(rhs);
    case "*":
      return lhs.multiply(rhs);
    case "/":
      return rhs.signum() == 0 ? null : lhs.divide(rhs);
    case "%":
      return rhs.signum() == 0 ? null : lhs.remainder(rhs);
    case "&":
      return lhs.and(rhs);
    case "|":
      return lhs.or(rhs);
    case "^":
      return lhs.xor(rhs);
    case "==":
      return bool(lhs.equals(rhs));
    case "!=":
      return bool(!lhs.equals(rhs));
    case "<":
      return bool(lhs.compareTo(rhs) < 0);
    case ">":
      return bool(lhs.compareTo(rhs) > 0);
    case "<=":
      return bool(lhs.compareTo(rhs) <= 0);
    case ">=":
      return bool(lhs.compareTo(rhs) >= 0);
    case "&&":
      return bool(lhs.signum() != 0 && rhs.signum() != 0);
    case "||":
      return bool(lhs.signum() != 0 || rhs.signum() != 0);
    default:
      break;
    }
    if (rhs.signum() < 0 || rhs.compareTo(BigInteger.valueOf(MAX_SHIFT)) > 0)
      return null;
    int amount = rhs.intValue();
    switch (op) {
    case "<<":
    case "<<<":
      return lhs.shiftLeft(amount);
    case ">>":
      if (lhsType.isPacked())
        return lhs.and(Bits.mask(lhsType.width())).shiftRight(amount);
      return lhs.shiftRight(amount);
    case ">>>":
      // Arithmetic only for signed operands
      if (lhsType.isPacked() && !lhsType.isSigned())
        return lhs.and(Bits.mask(lhsType.width())).shiftRight(amount);
      return lhs.shiftRight(amount);
    default:
      return null;
    }
  }

  private static BigInteger bool(boolean value) { return value ? BigInteger.ONE : BigInteger.ZERO; }
}
