package hdlower.tree;

import static hdlower.TestTreeBuilder.bin;
import static hdlower.TestTreeBuilder.call;
import static hdlower.TestTreeBuilder.cat;
import static hdlower.TestTreeBuilder.num;
import static hdlower.TestTreeBuilder.ref;
import static hdlower.TestTreeBuilder.select;
import static hdlower.TestTreeBuilder.u;
import static hdlower.TestTreeBuilder.unary;

import hdlower.TestTreeBuilder;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types.TypeNum;
import hdlower.core.Types.TypeSInt;
import hdlower.core.Types.TypeUInt;
import hdlower.core.Types.TypeVoid;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class TypeAssignerTest {

  @Test
  void testReferencesSeeThroughPorts() {
    var tb = new TestTreeBuilder();
    TermSymbol x = tb.in("x", 8);
    TermSymbol o = tb.out("o", 3);
    TermSymbol p = tb.pipeline("p", 5);
    Assertions.assertEquals(new TypeUInt(8), ref(x).tpe());
    Assertions.assertEquals(new TypeUInt(3), ref(o).tpe());
    Assertions.assertEquals(new TypeUInt(5), ref(p).tpe());
    Assertions.assertEquals(x.getKind(), TypeAssigner.kindOf(ref(x)));
  }

  @Test
  void testOperators() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 4);
    TermSymbol b = tb.sint("b", 6);
    TermSymbol c = tb.sint("c", 2);
    Assertions.assertEquals(new TypeUInt(6), bin(ref(a), "+", ref(b)).tpe());
    Assertions.assertEquals(new TypeSInt(6), bin(ref(c), "-", ref(b)).tpe());
    Assertions.assertEquals(new TypeUInt(1), bin(ref(a), "<", ref(b)).tpe());
    Assertions.assertEquals(new TypeUInt(4), bin(ref(a), "<<", ref(b)).tpe());
    Assertions.assertEquals(new TypeUInt(4), bin(ref(a), "*", num(3)).tpe());
    Assertions.assertEquals(new TypeNum(false), bin(num(1), "+", num(3)).tpe());
    Assertions.assertEquals(new TypeUInt(1), unary("|", ref(a)).tpe());
    Assertions.assertEquals(new TypeSInt(6), unary("-", ref(b)).tpe());
  }

  @Test
  void testCatAndCalls() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.uint("a", 4);
    TermSymbol x = tb.in("x", 8);
    TermSymbol s = tb.stack("s", 7, num(2));
    Assertions.assertEquals(new TypeUInt(12), cat(ref(a), u(8, 0)).tpe());
    Assertions.assertEquals(TypeVoid.INSTANCE, cat(ref(a), num(1)).tpe());
    Assertions.assertEquals(new TypeUInt(8), call(x, "read").tpe());
    Assertions.assertEquals(new TypeUInt(7), call(s, "pop").tpe());
    Assertions.assertEquals(new TypeUInt(7), select(s, "top").tpe());
    Assertions.assertEquals(new TypeUInt(1), select(s, "empty").tpe());
    Assertions.assertEquals(new TypeUInt(1), select(x, "valid").tpe());
    Assertions.assertEquals(TypeVoid.INSTANCE, call(s, "push", ref(a)).tpe());
  }
}
