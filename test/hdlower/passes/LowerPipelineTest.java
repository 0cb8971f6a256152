package hdlower.passes;

import static hdlower.TestTreeBuilder.assign;
import static hdlower.TestTreeBuilder.bin;
import static hdlower.TestTreeBuilder.declNamed;
import static hdlower.TestTreeBuilder.ref;
import static hdlower.TestTreeBuilder.root;
import static hdlower.TestTreeBuilder.u;

import hdlower.TestTreeBuilder;
import hdlower.core.FatalErrorException;
import hdlower.core.FlowControl;
import hdlower.core.Loc;
import hdlower.core.StorageType;
import hdlower.core.StorageType.SliceKind;
import hdlower.core.Symbols.Symbol;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeOut;
import hdlower.core.Types.TypeStruct;
import hdlower.core.Types.TypeUInt;
import hdlower.tree.Connect;
import hdlower.tree.Entity;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.Root;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtRead;
import hdlower.tree.StmtWrite;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class LowerPipelineTest {

  private static StmtRead read() { return new StmtRead(Loc.UNKNOWN); }
  private static StmtWrite write() { return new StmtWrite(Loc.UNKNOWN); }

  private static List<String> names(List<? extends Symbol> symbols) { return symbols.stream().map(Symbol::getName).toList(); }

  private static TypeStruct portStruct(TermSymbol port) { return (TypeStruct)port.getKind().underlying(); }

  @Test
  void testThreeStages() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.pipeline("a", 8);
    TermSymbol b = tb.pipeline("b", 8);
    TermSymbol c = tb.pipeline("c", 8);
    TermSymbol o = tb.out("o", 8);
    Entity s0 = tb.entity("s0").stmt(assign(a, u(8, 1)), assign(b, u(8, 2)), assign(c, u(8, 3)), write()).build();
    Entity s1 = tb.entity("s1").stmt(read(), assign(a, bin(ref(a), "+", ref(b))), write()).build();
    Entity s2 = tb.entity("s2").decl(o).stmt(read(), assign(o, bin(ref(a), "+", ref(c)))).build();
    TermSymbol i0 = tb.instance("s0_i", s0);
    TermSymbol i1 = tb.instance("s1_i", s1);
    TermSymbol i2 = tb.instance("s2_i", s2);
    // Stages listed out of order: the order comes from the connections
    Entity top = tb.entity("top")
                     .decl(a, b, c)
                     .instance(i0)
                     .instance(i1)
                     .instance(i2)
                     .connect(ref(i1), ref(i2))
                     .connect(ref(i0), ref(i1))
                     .nest(s2, s0, s1)
                     .build();

    Root result = new LowerPipeline(tb.cc).apply(root(top));
    Entity outer = result.entities().get(0);
    Assertions.assertTrue(outer.declarations().isEmpty());
    for (Connect connect : outer.connects()) {
      Assertions.assertEquals(LowerPipeline.OUTPUT_PORT, ((ExprSelect)connect.lhs()).selector());
      Assertions.assertEquals(LowerPipeline.INPUT_PORT, ((ExprSelect)connect.rhs().get(0)).selector());
    }

    Entity first = outer.entities().stream().filter(e -> e.getName().equals("s0")).findFirst().get();
    Entity middle = outer.entities().stream().filter(e -> e.getName().equals("s1")).findFirst().get();
    Entity last = outer.entities().stream().filter(e -> e.getName().equals("s2")).findFirst().get();

    Assertions.assertTrue(declNamed(first, LowerPipeline.INPUT_PORT).isEmpty());
    TermSymbol firstOut = declNamed(first, LowerPipeline.OUTPUT_PORT).get().symbol();
    Assertions.assertEquals(List.of("a", "b", "c"), portStruct(firstOut).fieldNames());

    // c is not used in the middle stage but has to be carried through it
    TermSymbol middleIn = declNamed(middle, LowerPipeline.INPUT_PORT).get().symbol();
    TermSymbol middleOut = declNamed(middle, LowerPipeline.OUTPUT_PORT).get().symbol();
    Assertions.assertEquals(List.of("a", "b", "c"), portStruct(middleIn).fieldNames());
    Assertions.assertEquals(List.of("a", "c"), portStruct(middleOut).fieldNames());
    Assertions.assertEquals(new TypeIn(portStruct(middleIn), FlowControl.READY), middleIn.getKind());
    Assertions.assertEquals(new TypeOut(portStruct(middleOut), FlowControl.READY, StorageType.slices(SliceKind.FWD)), middleOut.getKind());
    Assertions.assertEquals(List.of(new TypeUInt(8), new TypeUInt(8)), portStruct(middleOut).fieldTypes());
    Assertions.assertEquals(List.of(LowerPipeline.INPUT_PORT, LowerPipeline.OUTPUT_PORT),
                            names(((TypeEntity)middle.symbol().getKind()).portSymbols()));
    Assertions.assertEquals(List.of(LowerPipeline.INPUT_PORT, LowerPipeline.OUTPUT_PORT, "a", "b", "c"),
                            middle.declarations().stream().map(decl -> decl.symbol().getName()).toList());

    TermSymbol lastIn = declNamed(last, LowerPipeline.INPUT_PORT).get().symbol();
    Assertions.assertEquals(List.of("a", "c"), portStruct(lastIn).fieldNames());
    Assertions.assertTrue(declNamed(last, LowerPipeline.OUTPUT_PORT).isEmpty());

    // read: {a, b, c} = pipeline_i.read();
    StmtAssign readAssign = (StmtAssign)middle.statements().get(0);
    Assertions.assertEquals(List.of("a", "b", "c"),
                            ((ExprCat)readAssign.lhs()).parts().stream().map(part -> ((ExprRef)part).symbol().getName()).toList());
    ExprSelect readSelect = (ExprSelect)((ExprCall)readAssign.rhs()).expr();
    Assertions.assertEquals("read", readSelect.selector());
    Assertions.assertSame(middleIn, ((ExprRef)readSelect.expr()).symbol());

    // write: pipeline_o.write({a, c});
    ExprCall writeCall = (ExprCall)((StmtExpr)middle.statements().get(2)).expr();
    Assertions.assertEquals("write", ((ExprSelect)writeCall.expr()).selector());
    Assertions.assertEquals(List.of("a", "c"),
                            ((ExprCat)writeCall.args().get(0)).parts().stream().map(part -> ((ExprRef)part).symbol().getName()).toList());

    // Stages refer to their own local copies
    TermSymbol localA = declNamed(middle, "a").get().symbol();
    Assertions.assertNotSame(a, localA);
    Assertions.assertEquals(new TypeUInt(8), localA.getKind());
    Assertions.assertEquals(localA, ((ExprRef)((StmtAssign)middle.statements().get(1)).lhs()).symbol());
  }

  @Test
  void testNothingCarriedDropsConnection() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.pipeline("a", 8);
    TermSymbol b = tb.pipeline("b", 8);
    Entity s0 = tb.entity("s0").stmt(assign(a, u(8, 1))).build();
    Entity s1 = tb.entity("s1").stmt(assign(b, u(8, 2))).build();
    TermSymbol i0 = tb.instance("s0_i", s0);
    TermSymbol i1 = tb.instance("s1_i", s1);
    Entity top = tb.entity("top").decl(a, b).instance(i0).instance(i1).connect(ref(i0), ref(i1)).nest(s0, s1).build();

    Entity outer = new LowerPipeline(tb.cc).apply(root(top)).entities().get(0);
    Assertions.assertTrue(outer.connects().isEmpty());
    Assertions.assertTrue(outer.entities().stream().allMatch(stage -> declNamed(stage, LowerPipeline.OUTPUT_PORT).isEmpty()));
  }

  @Test
  void testReadInFirstStage() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.pipeline("a", 8);
    Entity s0 = tb.entity("s0").stmt(read()).build();
    Entity s1 = tb.entity("s1").stmt(assign(a, u(8, 1))).build();
    TermSymbol i0 = tb.instance("s0_i", s0);
    TermSymbol i1 = tb.instance("s1_i", s1);
    Entity top = tb.entity("top").decl(a).instance(i0).instance(i1).connect(ref(i0), ref(i1)).nest(s0, s1).build();

    var error = Assertions.assertThrows(FatalErrorException.class, () -> new LowerPipeline(tb.cc).apply(root(top)));
    Assertions.assertEquals("'read' statement in first pipeline stage", error.getMsg().text());
  }

  @Test
  void testWriteInLastStage() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.pipeline("a", 8);
    Entity s0 = tb.entity("s0").stmt(assign(a, u(8, 1)), write()).build();
    Entity s1 = tb.entity("s1").stmt(read(), assign(a, u(8, 2)), write()).build();
    TermSymbol i0 = tb.instance("s0_i", s0);
    TermSymbol i1 = tb.instance("s1_i", s1);
    Entity top = tb.entity("top").decl(a).instance(i0).instance(i1).connect(ref(i0), ref(i1)).nest(s0, s1).build();

    var error = Assertions.assertThrows(FatalErrorException.class, () -> new LowerPipeline(tb.cc).apply(root(top)));
    Assertions.assertEquals("'write' statement in last pipeline stage", error.getMsg().text());
  }

  @Test
  void testReferenceFromEntityNestedInStage() {
    var tb = new TestTreeBuilder();
    TermSymbol a = tb.pipeline("a", 8);
    TermSymbol b = tb.uint("b", 8);
    Entity inner = tb.entity("inner").decl(b).stmt(assign(b, ref(a))).build();
    Entity s0 = tb.entity("s0").stmt(assign(a, u(8, 1)), write()).build();
    Entity s1 = tb.entity("s1").instance(tb.instance("inner_i", inner)).stmt(read()).nest(inner).build();
    TermSymbol i0 = tb.instance("s0_i", s0);
    TermSymbol i1 = tb.instance("s1_i", s1);
    Entity top = tb.entity("top").decl(a).instance(i0).instance(i1).connect(ref(i0), ref(i1)).nest(s0, s1).build();

    var error = Assertions.assertThrows(FatalErrorException.class, () -> new LowerPipeline(tb.cc).apply(root(top)));
    Assertions.assertEquals("Pipeline variable 'a' referenced outside of a pipeline stage body", error.getMsg().text());
  }

  @Test
  void testDesignWithoutPipelineUnchanged() {
    var tb = new TestTreeBuilder();
    TermSymbol x = tb.uint("x", 8);
    Entity inner = tb.entity("inner").decl(x).stmt(assign(x, u(8, 1))).build();
    Root design = root(tb.entity("top").nest(inner).build());
    Assertions.assertSame(design, new LowerPipeline(tb.cc).apply(design));
  }
}
