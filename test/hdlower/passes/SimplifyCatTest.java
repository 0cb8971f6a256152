package hdlower.passes;

import static hdlower.TestTreeBuilder.assign;
import static hdlower.TestTreeBuilder.cat;
import static hdlower.TestTreeBuilder.ref;
import static hdlower.TestTreeBuilder.root;
import static hdlower.TestTreeBuilder.u;

import hdlower.TestTreeBuilder;
import hdlower.core.Message;
import hdlower.core.Message.Severity;
import hdlower.core.Symbols.TermSymbol;
import hdlower.tree.Connect;
import hdlower.tree.Entity;
import hdlower.tree.ExprInt;
import hdlower.tree.Root;
import hdlower.tree.StmtAssign;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimplifyCatTest {

  private static List<StmtAssign> assignsAfter(TestTreeBuilder tb, Root design) {
    return new SimplifyCat(tb.cc).apply(design).entities().get(0).statements().stream().map(StmtAssign.class::cast).toList();
  }

  @Test
  void testRegroupsByWidth() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 2);
    TermSymbol b = tb.uint("b", 3);
    TermSymbol c = tb.uint("c", 2);
    TermSymbol d = tb.uint("d", 1);
    TermSymbol e = tb.uint("e", 2);
    Root design = root(tb.entity("top").decl(a, b, c, d, e).stmt(assign(cat(a, b), cat(c, d, e))).build());

    List<StmtAssign> assigns = assignsAfter(tb, design);
    Assertions.assertEquals(2, assigns.size());
    Assertions.assertEquals(assign(a, ref(c)), assigns.get(0));
    Assertions.assertEquals(assign(ref(b), cat(d, e)), assigns.get(1));
  }

  @Test
  void testNoCommonBoundaryUnchanged() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 2);
    TermSymbol b = tb.uint("b", 3);
    TermSymbol c = tb.uint("c", 1);
    TermSymbol d = tb.uint("d", 4);
    Root design = root(tb.entity("top").decl(a, b, c, d).stmt(assign(cat(a, b), cat(c, d))).build());
    Assertions.assertSame(design, new SimplifyCat(tb.cc).apply(design));
  }

  @Test
  void testSwapIsNotSplit() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 4);
    TermSymbol b = tb.uint("b", 4);
    Root design = root(tb.entity("top").decl(a, b).stmt(assign(cat(a, b), cat(b, a))).build());
    Assertions.assertSame(design, new SimplifyCat(tb.cc).apply(design));
  }

  @Test
  void testConstantIsSplit() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 4);
    TermSymbol b = tb.sint("b", 4);
    Root design = root(tb.entity("top").decl(a, b).stmt(assign(cat(a, b), u(8, 0xac))).build());

    List<StmtAssign> assigns = assignsAfter(tb, design);
    Assertions.assertEquals(2, assigns.size());
    Assertions.assertEquals(assign(a, u(4, 0xa)), assigns.get(0));
    ExprInt low = (ExprInt)assigns.get(1).rhs();
    Assertions.assertTrue(low.signed());
    Assertions.assertEquals(BigInteger.valueOf(-4), low.value());
  }

  @Test
  void testWidthMismatchIsReported() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 2);
    TermSymbol b = tb.uint("b", 3);
    TermSymbol c = tb.uint("c", 2);
    TermSymbol d = tb.uint("d", 2);
    StmtAssign bad = assign(cat(a, b), cat(c, d));
    Root design = root(tb.entity("top").decl(a, b, c, d).stmt(bad).build());

    Root result = new SimplifyCat(tb.cc).apply(design);
    Assertions.assertSame(bad, result.entities().get(0).statements().get(0));
    List<Message> errors = tb.cc.getMessages(Severity.ERROR);
    Assertions.assertEquals(1, errors.size());
    Assertions.assertEquals(List.of("Widths do not match", "left hand side is 5 bits wide", "right hand side is 4 bits wide"),
                            errors.get(0).lines());
  }

  @Test
  void testNestedAndSinglePartConcatenations() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 2);
    TermSymbol b = tb.uint("b", 2);
    TermSymbol c = tb.uint("c", 2);
    TermSymbol x = tb.uint("x", 6);
    TermSymbol y = tb.uint("y", 2);
    Root design = root(tb.entity("top").decl(a, b, c, x, y).stmt(assign(x, cat(cat(a, b), ref(c))), assign(ref(y), cat(ref(a)))).build());

    List<StmtAssign> assigns = assignsAfter(tb, design);
    Assertions.assertEquals(assign(x, cat(a, b, c)), assigns.get(0));
    Assertions.assertEquals(assign(y, ref(a)), assigns.get(1));
  }

  @Test
  void testConnectsAreSplit() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.in("a", 4);
    TermSymbol b = tb.in("b", 1);
    TermSymbol c = tb.out("c", 4);
    TermSymbol d = tb.out("d", 1);
    Entity top = tb.entity("top").decl(a, b, c, d).connect(cat(a, b), cat(c, d)).build();

    List<Connect> connects = new SimplifyCat(tb.cc).apply(root(top)).entities().get(0).connects();
    Assertions.assertEquals(2, connects.size());
    Assertions.assertEquals(ref(a), connects.get(0).lhs());
    Assertions.assertEquals(List.of(ref(c)), connects.get(0).rhs());
    Assertions.assertEquals(ref(b), connects.get(1).lhs());
  }

  @Test
  void testIdempotent() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 2);
    TermSymbol b = tb.uint("b", 3);
    TermSymbol c = tb.uint("c", 2);
    TermSymbol d = tb.uint("d", 1);
    TermSymbol e = tb.uint("e", 2);
    Root design = root(tb.entity("top").decl(a, b, c, d, e).stmt(assign(cat(a, b), cat(cat(c, d), ref(e))), assign(cat(a, b), u(5, 9))).build());

    Root once = new SimplifyCat(tb.cc).apply(design);
    Assertions.assertSame(once, new SimplifyCat(tb.cc).apply(once));
    Assertions.assertFalse(tb.cc.hasErrors());
  }
}
