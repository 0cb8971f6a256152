package hdlower.analysis;

import static hdlower.TestTreeBuilder.bin;
import static hdlower.TestTreeBuilder.cat;
import static hdlower.TestTreeBuilder.num;
import static hdlower.TestTreeBuilder.ref;
import static hdlower.TestTreeBuilder.u;
import static hdlower.TestTreeBuilder.unary;

import hdlower.TestTreeBuilder;
import hdlower.core.Attribute;
import hdlower.core.Loc;
import hdlower.core.Symbols.TermSymbol;
import hdlower.tree.Expr;
import hdlower.tree.ExprIndex;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprTernary;
import java.math.BigInteger;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ConstantEvaluatorTest {

  private static Optional<BigInteger> big(long value) { return Optional.of(BigInteger.valueOf(value)); }

  private static ExprInt i(int width, long value) { return new ExprInt(true, width, value); }

  @Test
  void testArithmeticTruncatesToWidth() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());

    Assertions.assertEquals(big(5), evaluator.value(bin(num(2), "+", num(3))));
    Assertions.assertEquals(big(1), evaluator.value(bin(u(4, 15), "+", u(4, 2))));
    Assertions.assertEquals(big(14), evaluator.value(unary("~", u(4, 1))));
    Assertions.assertEquals(big(1), evaluator.value(unary("&", u(3, 7))));
    Assertions.assertEquals(big(0x2d), evaluator.value(cat(u(2, 2), u(4, 13))));
    Assertions.assertEquals(big(1), evaluator.value(new ExprIndex(u(4, 4), num(2), Loc.UNKNOWN)));
    Assertions.assertEquals(big(7), evaluator.value(new ExprTernary(u(1, 0), num(3), num(7), Loc.UNKNOWN)));
    Assertions.assertEquals(big(4), evaluator.value(bin(u(8, 16), ">>", num(2))));
  }

  @Test
  void testShiftsFollowSignedness() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());

    // >> is logical, >>> is arithmetic on signed operands only
    Assertions.assertEquals(big(4), evaluator.value(bin(i(4, -8), ">>", num(1))));
    Assertions.assertEquals(big(-4), evaluator.value(bin(i(4, -8), ">>>", num(1))));
    Assertions.assertEquals(big(4), evaluator.value(bin(u(4, 8), ">>>", num(1))));
    Assertions.assertEquals(big(-1), evaluator.value(bin(i(8, -1), ">>>", num(7))));
    Assertions.assertEquals(big(1), evaluator.value(bin(i(8, -1), ">>", num(7))));
  }

  @Test
  void testMixedSignednessIsUnsigned() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());

    Assertions.assertEquals(big(1), evaluator.value(bin(i(4, -1), "==", u(4, 15))));
    Assertions.assertEquals(big(0), evaluator.value(bin(i(4, -1), "<", u(4, 1))));
    Assertions.assertEquals(big(1), evaluator.value(bin(i(4, -1), ">", u(8, 200))));
    Assertions.assertEquals(big(4), evaluator.value(bin(i(4, -8), "/", u(4, 2))));
    Assertions.assertEquals(big(1), evaluator.value(bin(i(4, -7), "%", u(4, 4))));
    // Both signed: signed comparison
    Assertions.assertEquals(big(1), evaluator.value(bin(i(4, -1), "<", i(4, 1))));
    Assertions.assertEquals(big(-4), evaluator.value(bin(i(4, -8), "/", i(4, 2))));
  }

  @Test
  void testHugeIndexDoesNotFold() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());
    Assertions.assertTrue(evaluator.value(new ExprIndex(u(4, 5), num(1L << 32), Loc.UNKNOWN)).isEmpty());
    Assertions.assertTrue(evaluator.value(new ExprIndex(u(4, 5), num(4), Loc.UNKNOWN)).isEmpty());
    Assertions.assertEquals(big(1), evaluator.value(new ExprIndex(u(4, 5), num(2), Loc.UNKNOWN)));
  }

  @Test
  void testUnknownValues() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());
    TermSymbol x = tb.uint("x", 8);

    Assertions.assertTrue(evaluator.value(ref(x)).isEmpty());
    Assertions.assertTrue(evaluator.value(bin(num(1), "/", num(0))).isEmpty());
    Assertions.assertEquals(big(9), evaluator.value(bin(ref(x), "+", num(1)), Bindings.empty().with(x, BigInteger.valueOf(8))));
    // The unknown right hand side is never looked at
    Assertions.assertEquals(big(0), evaluator.value(bin(u(1, 0), "&&", ref(x))));
    Assertions.assertEquals(Optional.of(true), evaluator.truth(bin(u(1, 1), "||", ref(x)), Bindings.empty()));
  }

  @Test
  void testConstsFoldThroughInitializer() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());
    TermSymbol width = tb.konst("W", 8, u(8, 6));
    TermSymbol depth = tb.konst("D", 8, bin(ref(width), "*", num(2)));
    Assertions.assertEquals(big(12), evaluator.value(ref(depth)));
  }

  @Test
  void testCyclicConstsDoNotFold() {
    var tb = new TestTreeBuilder();
    var evaluator = new ConstantEvaluator(tb.cc.attributes());
    TermSymbol a = tb.konst("A", 8, u(8, 0));
    TermSymbol b = tb.konst("B", 8, bin(ref(a), "+", num(1)));
    Expr cyclic = bin(ref(b), "+", num(1));
    tb.cc.attributes().set(a, Attribute.INIT, cyclic);
    Assertions.assertTrue(evaluator.value(ref(a)).isEmpty());
  }
}
