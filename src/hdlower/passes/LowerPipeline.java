package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.core.FlowControl;
import hdlower.core.StorageType;
import hdlower.core.StorageType.SliceKind;
import hdlower.core.Symbols.Symbol;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import hdlower.core.Types.Type;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeInstance;
import hdlower.core.Types.TypeOut;
import hdlower.core.Types.TypePipeline;
import hdlower.core.Types.TypeStruct;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprCall;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.StmtAssign;
import hdlower.tree.StmtExpr;
import hdlower.tree.StmtRead;
import hdlower.tree.StmtWrite;
import hdlower.tree.Tree;
import hdlower.util.ScopeStack;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers pipeline variables to explicit ports between pipeline stages.
 * <p>
 * The stages are the nested entities of an entity declaring pipeline variables, chained by instance to instance connections.
 * A variable is carried into a stage if it is used there, or if it is used at a later stage and carried into the previous
 * one. Each stage gets a {@code pipeline_i} input port with the variables carried in from the previous stage and a
 * {@code pipeline_o} output port with the variables carried on to the next stage. {@code read} and {@code write} statements
 * become calls of these ports' methods.
 */
public class LowerPipeline extends TreeTransformer {
  public static final String INPUT_PORT = "pipeline_i";
  public static final String OUTPUT_PORT = "pipeline_o";

  private enum Role { OUTER, STAGE, OTHER }

  /** Ports and local variables synthesized for one stage. */
  private record StagePorts(Optional<TermSymbol> iPort, Optional<TermSymbol> oPort, Map<TermSymbol, TermSymbol> locals) {}

  private record Frame(Role role, Map<TypeSymbol, StagePorts> stages, StagePorts ports) {}

  private final ScopeStack<Frame> frames = new ScopeStack<>();

  public LowerPipeline(CompilerContext cc) { super(cc); }

  private static boolean isPipeline(Symbol symbol) { return symbol.getKind() instanceof TypePipeline; }

  private static boolean declaresPipelineVariables(Entity entity) {
    return entity.declarations().stream().anyMatch(decl -> isPipeline(decl.symbol()));
  }

  @Override
  protected boolean skip(Tree tree) {
    if (tree instanceof Entity && frames.isEmpty())
      return tree.preOrder().noneMatch(node -> node instanceof Decl && isPipeline(((Decl)node).symbol()));
    return false;
  }

  @Override
  protected void enter(Tree tree) {
    if (!(tree instanceof Entity))
      return;
    Entity entity = (Entity)tree;
    if (declaresPipelineVariables(entity) && !entity.entities().isEmpty()) {
      frames.push(new Frame(Role.OUTER, analyse(entity), null));
    } else if (!frames.isEmpty() && frames.top().role() == Role.OUTER && frames.top().stages().containsKey(entity.symbol())) {
      frames.push(new Frame(Role.STAGE, Map.of(), frames.top().stages().get(entity.symbol())));
    } else {
      frames.push(new Frame(Role.OTHER, Map.of(), null));
    }
  }

  @Override
  protected void leave(Tree original) {
    if (original instanceof Entity)
      frames.pop();
  }

  /** Orders the stages, computes the carried variables and creates the stage ports. */
  private Map<TypeSymbol, StagePorts> analyse(Entity outer) {
    Map<TypeSymbol, TypeSymbol> nextMap = new HashMap<>();
    for (Connect connect : outer.connects()) {
      Optional<TypeSymbol> from = instanceEntity(connect.lhs());
      Optional<TypeSymbol> to = connect.rhs().size() == 1 ? instanceEntity(connect.rhs().get(0)) : Optional.empty();
      if (from.isPresent() && to.isPresent())
        nextMap.put(from.get(), to.get());
    }
    Set<TypeSymbol> hasPrev = new HashSet<>(nextMap.values());

    Map<TypeSymbol, Entity> bySymbol = new LinkedHashMap<>();
    outer.entities().forEach(inner -> bySymbol.put(inner.symbol(), inner));
    List<Entity> stages = new ArrayList<>();
    Optional<TypeSymbol> head = bySymbol.keySet().stream().filter(symbol -> !hasPrev.contains(symbol)).findFirst();
    Set<TypeSymbol> seen = new HashSet<>();
    for (TypeSymbol curr = head.orElse(null); curr != null && seen.add(curr); curr = nextMap.get(curr)) {
      Entity stage = bySymbol.get(curr);
      if (stage == null)
        throw cc.ice(outer, "Pipeline connection in " + outer.getName() + " to an entity that is not nested in it: " + curr.getName());
      stages.add(stage);
    }
    if (stages.size() != bySymbol.size())
      throw cc.ice(outer, "Pipeline stages of " + outer.getName() + " do not form a single chain");

    List<Set<TermSymbol>> useSets = new ArrayList<>();
    for (Entity stage : stages) {
      Set<TermSymbol> uses = new LinkedHashSet<>();
      stage.preOrder()
          .filter(ExprRef.class::isInstance)
          .map(ref -> ((ExprRef)ref).symbol())
          .filter(symbol -> symbol instanceof TermSymbol && isPipeline(symbol))
          .forEach(symbol -> uses.add((TermSymbol)symbol));
      useSets.add(uses);
    }

    // act[i] = use[i] | (use[i+1] | ... | use[n-1]) & act[i-1]
    List<Set<TermSymbol>> actSets = new ArrayList<>();
    for (int i = 0; i < stages.size(); ++i) {
      Set<TermSymbol> act = new HashSet<>(useSets.get(i));
      if (i > 0) {
        Set<TermSymbol> later = new HashSet<>();
        useSets.subList(i + 1, useSets.size()).forEach(later::addAll);
        later.retainAll(actSets.get(i - 1));
        act.addAll(later);
      }
      actSets.add(act);
    }

    Map<TypeSymbol, StagePorts> result = new HashMap<>();
    for (int i = 0; i < stages.size(); ++i) {
      Entity stage = stages.get(i);
      Set<TermSymbol> actCurr = actSets.get(i);
      Set<TermSymbol> carriedIn = new HashSet<>(i > 0 ? actSets.get(i - 1) : Set.of());
      carriedIn.retainAll(actCurr);
      Set<TermSymbol> carriedOut = new HashSet<>(i + 1 < stages.size() ? actSets.get(i + 1) : Set.of());
      carriedOut.retainAll(actCurr);
      logger.trace("Pipeline stage {} of {}: active {}, in {}, out {}", i, outer.getName(), actCurr, carriedIn, carriedOut);

      Map<TermSymbol, TermSymbol> locals = new LinkedHashMap<>();
      for (TermSymbol symbol : sortedById(actCurr))
        locals.put(symbol, cc.newTermSymbol(symbol.getName(), stage.loc(), symbol.getKind().underlying()));
      result.put(stage.symbol(), new StagePorts(makePort(stage, true, carriedIn), makePort(stage, false, carriedOut), locals));
    }
    logger.debug("Pipeline {} has {} stages", outer.getName(), stages.size());
    return result;
  }

  private Optional<TermSymbol> makePort(Entity stage, boolean input, Set<TermSymbol> carried) {
    if (carried.isEmpty())
      return Optional.empty();
    List<TermSymbol> fields = sortedById(carried);
    String name = input ? INPUT_PORT : OUTPUT_PORT;
    TypeStruct struct = new TypeStruct(name + "_t", fields.stream().map(TermSymbol::getName).toList(),
                                       fields.stream().map(symbol -> symbol.getKind().underlying()).toList());
    Type kind = input ? new TypeIn(struct, FlowControl.READY) : new TypeOut(struct, FlowControl.READY, StorageType.slices(SliceKind.FWD));
    return Optional.of(cc.newTermSymbol(name, stage.loc(), kind));
  }

  private static List<TermSymbol> sortedById(Set<TermSymbol> symbols) {
    List<TermSymbol> sorted = new ArrayList<>(symbols);
    sorted.sort(Comparator.comparingInt(TermSymbol::getId));
    return sorted;
  }

  private static Optional<TypeSymbol> instanceEntity(Expr expr) {
    if (expr instanceof ExprRef && ((ExprRef)expr).symbol().getKind() instanceof TypeInstance)
      return Optional.of(((TypeInstance)((ExprRef)expr).symbol().getKind()).entitySymbol());
    return Optional.empty();
  }

  @Override
  protected Tree transform(Tree tree) {
    Frame frame = frames.isEmpty() ? null : frames.top();
    if (tree instanceof Entity) {
      if (frame.role() == Role.OUTER)
        return lowerOuter((Entity)tree, frame);
      if (frame.role() == Role.STAGE)
        return lowerStage((Entity)tree, frame.ports());
      return tree;
    }
    if (tree instanceof StmtRead) {
      StagePorts ports = stagePorts(tree, "'read' statement outside pipeline stage");
      if (ports.iPort().isEmpty())
        throw cc.fatal(tree, "'read' statement in first pipeline stage");
      TermSymbol iPort = ports.iPort().get();
      List<Expr> lhsRefs = fieldRefs(ports, ((TypeIn)iPort.getKind()).kind(), tree);
      Expr rhs = new ExprCall(new ExprSelect(new ExprRef(iPort, tree.loc()), "read", tree.loc()), List.of(), tree.loc());
      return new StmtAssign(new ExprCat(lhsRefs, tree.loc()), rhs, tree.loc());
    }
    if (tree instanceof StmtWrite) {
      StagePorts ports = stagePorts(tree, "'write' statement outside pipeline stage");
      if (ports.oPort().isEmpty())
        throw cc.fatal(tree, "'write' statement in last pipeline stage");
      TermSymbol oPort = ports.oPort().get();
      List<Expr> rhsRefs = fieldRefs(ports, ((TypeOut)oPort.getKind()).kind(), tree);
      Expr call = new ExprCall(new ExprSelect(new ExprRef(oPort, tree.loc()), "write", tree.loc()), List.of(new ExprCat(rhsRefs, tree.loc())),
                               tree.loc());
      return new StmtExpr(call, tree.loc());
    }
    if (tree instanceof ExprRef && frame != null && frame.role() == Role.STAGE) {
      ExprRef ref = (ExprRef)tree;
      TermSymbol local = frame.ports().locals().get(ref.symbol());
      return local == null ? ref : new ExprRef(local, ref.loc());
    }
    // Stage bodies only: an entity nested in a stage has no pipeline ports of its own
    if (tree instanceof ExprRef && isPipeline(((ExprRef)tree).symbol()))
      throw cc.fatal(tree, "Pipeline variable '" + ((ExprRef)tree).symbol().getName() + "' referenced outside of a pipeline stage body");
    return tree;
  }

  private StagePorts stagePorts(Tree tree, String misplaced) {
    if (frames.isEmpty() || frames.top().role() != Role.STAGE)
      throw cc.fatal(tree, misplaced);
    return frames.top().ports();
  }

  private List<Expr> fieldRefs(StagePorts ports, Type struct, Tree at) {
    List<Expr> refs = new ArrayList<>();
    for (String fieldName : ((TypeStruct)struct).fieldNames()) {
      TermSymbol local = ports.locals().values().stream()
                             .filter(symbol -> symbol.getName().equals(fieldName))
                             .findFirst()
                             .orElseThrow(() -> cc.ice(at, "No local variable for pipeline field " + fieldName));
      refs.add(new ExprRef(local, at.loc()));
    }
    return refs;
  }

  private Entity lowerStage(Entity stage, StagePorts ports) {
    List<TermSymbol> newPorts = new ArrayList<>();
    ports.iPort().ifPresent(newPorts::add);
    ports.oPort().ifPresent(newPorts::add);
    List<Decl> decls = new ArrayList<>();
    newPorts.forEach(port -> decls.add(new Decl(port, Optional.empty(), stage.loc())));
    ports.locals().values().forEach(local -> decls.add(new Decl(local, Optional.empty(), stage.loc())));
    decls.addAll(stage.declarations());
    if (!(stage.symbol().getKind() instanceof TypeEntity))
      throw cc.ice(stage, "Entity " + stage.getName() + " does not have an entity type");
    stage.symbol().setKind(((TypeEntity)stage.symbol().getKind()).withLeadingPorts(newPorts));
    return stage.withDeclarations(decls);
  }

  private Entity lowerOuter(Entity outer, Frame frame) {
    List<Decl> decls = outer.declarations().stream().filter(decl -> !isPipeline(decl.symbol())).toList();
    List<Connect> connects = new ArrayList<>();
    for (Connect connect : outer.connects()) {
      Optional<TypeSymbol> from = instanceEntity(connect.lhs());
      Optional<TypeSymbol> to = connect.rhs().size() == 1 ? instanceEntity(connect.rhs().get(0)) : Optional.empty();
      if (from.isEmpty() || to.isEmpty()) {
        connects.add(connect);
        continue;
      }
      // Nothing carried between the two stages
      if (frame.stages().get(from.get()).oPort().isEmpty())
        continue;
      Expr lhs = new ExprSelect(connect.lhs(), OUTPUT_PORT, connect.lhs().loc());
      Expr rhs = new ExprSelect(connect.rhs().get(0), INPUT_PORT, connect.rhs().get(0).loc());
      connects.add(new Connect(lhs, rhs, connect.loc()));
    }
    return new Entity(outer.symbol(), decls, outer.instances(), connects, outer.statements(), outer.entities(), outer.loc());
  }

  @Override
  protected void finalCheck(Tree result) {
    if (!frames.isEmpty())
      throw cc.ice(result, "LowerPipeline scope stack not empty at the end of the pass");
    result.preOrder().forEach(node -> {
      if (node instanceof StmtRead)
        throw cc.ice(node, "read statement remains after LowerPipeline");
      if (node instanceof StmtWrite)
        throw cc.ice(node, "write statement remains after LowerPipeline");
      if (node instanceof Decl && isPipeline(((Decl)node).symbol()))
        throw cc.ice(node, "Pipeline variable declaration remains after LowerPipeline");
      if (node instanceof ExprRef && isPipeline(((ExprRef)node).symbol()))
        throw cc.ice(node, "Pipeline variable reference remains after LowerPipeline");
      if (node instanceof Expr && ((Expr)node).tpe() instanceof TypePipeline)
        throw cc.ice(node, "Pipeline variable type remains after LowerPipeline");
    });
  }
}
