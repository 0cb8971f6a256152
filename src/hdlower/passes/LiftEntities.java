package hdlower.passes;

import hdlower.core.Attribute;
import hdlower.core.CompilerContext;
import hdlower.core.FlowControl;
import hdlower.core.StorageType;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import hdlower.core.Types.TypeConst;
import hdlower.core.Types.TypeEntity;
import hdlower.core.Types.TypeIn;
import hdlower.core.Types.TypeOut;
import hdlower.tree.Connect;
import hdlower.tree.Decl;
import hdlower.tree.Entity;
import hdlower.tree.Expr;
import hdlower.tree.ExprRef;
import hdlower.tree.ExprSelect;
import hdlower.tree.Instance;
import hdlower.tree.Root;
import hdlower.tree.Thicket;
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
import java.util.function.Function;

/**
 * Lifts nested entities to the top level and wires through the outer ports and constants they reference directly.
 * <p>
 * A nested entity referencing an input or output port of an enclosing entity gets a fresh port of the same name and type,
 * connected to the outer port through each of its instances. Referenced outer constants, including those their
 * initializers depend on, are copied into the nested entity. Outer output ports driven from a nested entity lose their
 * storage, the register now lives in the nested entity. A lifted entity is renamed to {@code parent<sep>child}.
 */
public class LiftEntities extends TreeTransformer {

  /** A port that has to be connected to the instances of a nested entity. */
  private record Obligation(TermSymbol port, TypeSymbol entitySymbol) {}

  /** State of one entity being walked. */
  private static class Frame {
    final Entity entity;
    /** Name before lifting, used in diagnostics */
    final String name;
    // ports and consts declared by this entity
    final Set<TermSymbol> iPorts = new HashSet<>();
    final Set<TermSymbol> oPorts = new HashSet<>();
    final Map<TermSymbol, Optional<Expr>> consts = new HashMap<>();
    // outer symbol -> fresh local symbol
    final LinkedHashMap<TermSymbol, TermSymbol> freshIPorts = new LinkedHashMap<>();
    final LinkedHashMap<TermSymbol, TermSymbol> freshOPorts = new LinkedHashMap<>();
    final LinkedHashMap<TermSymbol, TermSymbol> freshConsts = new LinkedHashMap<>();
    // fresh ports of nested entities to be connected in this entity
    final LinkedHashSet<Obligation> iConns = new LinkedHashSet<>();
    final LinkedHashSet<Obligation> oConns = new LinkedHashSet<>();

    Frame(Entity entity) {
      this.entity = entity;
      this.name = entity.getName();
    }

    Optional<TermSymbol> fresh(TermSymbol outer) {
      TermSymbol inner = freshIPorts.get(outer);
      if (inner == null)
        inner = freshOPorts.get(outer);
      if (inner == null)
        inner = freshConsts.get(outer);
      return Optional.ofNullable(inner);
    }
  }

  private final ScopeStack<Frame> frames = new ScopeStack<>();

  // Output ports pushed into nested entities, to be turned into wires
  private final Set<TermSymbol> stripStorageSymbols = new HashSet<>();

  // Output ports (as seen from the directly enclosing entity) -> names of the nested entities referencing them.
  // More than one entity would mean more than one driver.
  private final Map<TermSymbol, LinkedHashSet<String>> outerORefs = new LinkedHashMap<>();
  // Same for input ports with ready flow control, which must have a single consumer
  private final Map<TermSymbol, LinkedHashSet<String>> outerIRefs = new LinkedHashMap<>();

  public LiftEntities(CompilerContext cc) { super(cc); }

  @Override
  protected boolean skip(Tree tree) {
    // Top level entities without nested entities
    if (tree instanceof Entity)
      return frames.isEmpty() && ((Entity)tree).entities().isEmpty();
    return frames.isEmpty() && !(tree instanceof Root);
  }

  @Override
  protected void enter(Tree tree) {
    if (!(tree instanceof Entity))
      return;
    Entity entity = (Entity)tree;
    Frame frame = new Frame(entity);
    Frame parent = frames.isEmpty() ? null : frames.top();

    if (parent != null) {
      List<TermSymbol> referenced = referencedSymbols(entity);
      for (TermSymbol outer : referenced) {
        if (isOuter(outer, f -> f.iPorts))
          frame.freshIPorts.put(outer, cc.newSymbolLike(outer));
        else if (isOuter(outer, f -> f.oPorts))
          frame.freshOPorts.put(outer, cc.newSymbolLike(outer));
      }
      for (TermSymbol outer : constClosure(referenced))
        frame.freshConsts.put(outer, cc.newSymbolLike(outer));

      // Initializers of the copied consts refer to the copies
      ExprSubstitution rename = ExprSubstitution.renaming(cc, frame.freshConsts);
      frame.freshConsts.forEach((outer, inner) -> {
        Optional<Expr> init = outerConstInit(outer);
        if (init.isPresent())
          cc.attributes().set(inner, Attribute.INIT, rename.apply(init.get()));
      });

      for (TermSymbol outer : frame.freshOPorts.keySet()) {
        TermSymbol seen = parent.fresh(outer).orElse(outer);
        stripStorageSymbols.add(seen);
        outerORefs.computeIfAbsent(seen, key -> new LinkedHashSet<>()).add(frame.name);
      }
      for (TermSymbol outer : frame.freshIPorts.keySet()) {
        if (outer.getKind() instanceof TypeIn && ((TypeIn)outer.getKind()).flowControl() == FlowControl.READY) {
          TermSymbol seen = parent.fresh(outer).orElse(outer);
          outerIRefs.computeIfAbsent(seen, key -> new LinkedHashSet<>()).add(frame.name);
        }
      }
      if (!frame.freshIPorts.isEmpty() || !frame.freshOPorts.isEmpty() || !frame.freshConsts.isEmpty())
        logger.trace("Entity {} references outer ports {} {} and consts {}", frame.name, frame.freshIPorts.keySet(),
                     frame.freshOPorts.keySet(), frame.freshConsts.keySet());
    }

    for (Decl decl : entity.declarations()) {
      TermSymbol symbol = decl.symbol();
      if (symbol.getKind() instanceof TypeIn)
        frame.iPorts.add(symbol);
      else if (symbol.getKind() instanceof TypeOut)
        frame.oPorts.add(symbol);
      else if (symbol.getKind() instanceof TypeConst)
        frame.consts.put(symbol, decl.init().or(() -> cc.attributes().get(symbol, Attribute.INIT)));
    }
    frames.push(frame);
  }

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof ExprRef) {
      ExprRef ref = (ExprRef)tree;
      if (frames.isEmpty() || !(ref.symbol() instanceof TermSymbol))
        return ref;
      return frames.top().fresh((TermSymbol)ref.symbol()).<Tree>map(inner -> new ExprRef(inner, ref.loc())).orElse(ref);
    }
    if (tree instanceof Entity)
      return lift((Entity)tree, frames.top());
    return tree;
  }

  private Tree lift(Entity entity, Frame frame) {
    // Fresh ports
    if (!frame.freshIPorts.isEmpty() || !frame.freshOPorts.isEmpty()) {
      List<TermSymbol> newPorts = new ArrayList<>(frame.freshIPorts.values());
      newPorts.addAll(frame.freshOPorts.values());
      List<Decl> decls = new ArrayList<>();
      newPorts.forEach(port -> decls.add(new Decl(port)));
      decls.addAll(entity.declarations());
      if (!(entity.symbol().getKind() instanceof TypeEntity))
        throw cc.ice(entity, "Entity " + entity.getName() + " does not have an entity type");
      entity.symbol().setKind(((TypeEntity)entity.symbol().getKind()).withLeadingPorts(newPorts));
      entity = entity.withDeclarations(decls);
    }

    // Fresh consts
    if (!frame.freshConsts.isEmpty()) {
      List<Decl> decls = new ArrayList<>();
      for (TermSymbol symbol : frame.freshConsts.values()) {
        Optional<Expr> init = cc.attributes().get(symbol, Attribute.INIT);
        decls.add(new Decl(symbol, init, symbol.getLoc()));
      }
      decls.addAll(entity.declarations());
      entity = entity.withDeclarations(decls);
    }

    // Strip storage of outputs driven from nested entities
    for (Decl decl : entity.declarations()) {
      TermSymbol symbol = decl.symbol();
      if (symbol.getKind() instanceof TypeOut && stripStorageSymbols.contains(symbol)) {
        TypeOut kind = (TypeOut)symbol.getKind();
        if (!kind.storage().isWire())
          symbol.setKind(kind.withStorage(StorageType.WIRE));
      }
    }

    // Connect fresh ports of nested entities
    if (!frame.iConns.isEmpty() || !frame.oConns.isEmpty()) {
      List<Connect> connects = new ArrayList<>(entity.connects());
      for (Obligation obligation : frame.iConns) {
        TermSymbol port = frame.fresh(obligation.port()).orElse(obligation.port());
        for (TermSymbol instance : instancesOf(entity, obligation.entitySymbol()))
          connects.add(new Connect(new ExprRef(port, entity.loc()),
                                   new ExprSelect(new ExprRef(instance, entity.loc()), obligation.port().getName(), entity.loc()), entity.loc()));
      }
      for (Obligation obligation : frame.oConns) {
        TermSymbol port = frame.fresh(obligation.port()).orElse(obligation.port());
        for (TermSymbol instance : instancesOf(entity, obligation.entitySymbol()))
          connects.add(new Connect(new ExprSelect(new ExprRef(instance, entity.loc()), obligation.port().getName(), entity.loc()),
                                   new ExprRef(port, entity.loc()), entity.loc()));
      }
      entity = entity.withConnects(connects);
    }

    // Extract nested entities
    if (entity.entities().isEmpty())
      return entity;
    List<Entity> children = entity.entities();
    String parentName = entity.getName();
    for (Entity child : children)
      child.symbol().rename(parentName + cc.sep() + child.getName());
    logger.debug("Lifted {} nested entities out of {}", children.size(), parentName);
    List<Tree> lifted = new ArrayList<>();
    lifted.add(entity.withEntities(List.of()));
    lifted.addAll(children);
    return new Thicket(lifted, entity.loc());
  }

  @Override
  protected void leave(Tree original) {
    if (!(original instanceof Entity))
      return;
    Frame frame = frames.pop();
    if (!frames.isEmpty()) {
      // The enclosing entity connects our fresh ports to our instances
      Frame parent = frames.top();
      for (TermSymbol outer : frame.freshIPorts.keySet())
        parent.iConns.add(new Obligation(outer, frame.entity.symbol()));
      for (TermSymbol outer : frame.freshOPorts.keySet())
        parent.oConns.add(new Obligation(outer, frame.entity.symbol()));
      return;
    }
    outerORefs.forEach((symbol, names) -> {
      if (names.size() > 1) {
        List<String> lines = new ArrayList<>();
        lines.add("Output port '" + symbol.getName() + "' is referenced by more than one nested entities:");
        lines.addAll(names);
        cc.error(symbol.getLoc(), lines);
      }
    });
    outerIRefs.forEach((symbol, names) -> {
      if (names.size() > 1) {
        List<String> lines = new ArrayList<>();
        lines.add("Input port '" + symbol.getName() + "' with 'sync ready' flow control is referenced by more than one nested entities:");
        lines.addAll(names);
        cc.error(symbol.getLoc(), lines);
      }
    });
    outerORefs.clear();
    outerIRefs.clear();
  }

  @Override
  protected void finalCheck(Tree result) {
    if (!frames.isEmpty())
      throw cc.ice(result, "LiftEntities scope stack not empty at the end of the pass");
    result.preOrder()
        .filter(node -> node instanceof Entity && !((Entity)node).entities().isEmpty())
        .findFirst()
        .ifPresent(node -> { throw cc.ice(node, "Nested entities remain after LiftEntities"); });
  }

  ///////////////////////////////////////////////////////////////////////////
  // Helpers
  ///////////////////////////////////////////////////////////////////////////

  private static List<TermSymbol> referencedSymbols(Entity entity) {
    Set<TermSymbol> symbols = new LinkedHashSet<>();
    entity.preOrder()
        .filter(ExprRef.class::isInstance)
        .map(ref -> ((ExprRef)ref).symbol())
        .filter(TermSymbol.class::isInstance)
        .forEach(symbol -> symbols.add((TermSymbol)symbol));
    return new ArrayList<>(symbols);
  }

  private boolean isOuter(TermSymbol symbol, Function<Frame, Set<TermSymbol>> declared) {
    for (Frame frame : frames)
      if (declared.apply(frame).contains(symbol))
        return true;
    return false;
  }

  private boolean isOuterConst(TermSymbol symbol) {
    for (Frame frame : frames)
      if (frame.consts.containsKey(symbol))
        return true;
    return false;
  }

  private Optional<Expr> outerConstInit(TermSymbol symbol) {
    for (Frame frame : frames) {
      Optional<Expr> init = frame.consts.get(symbol);
      if (init != null)
        return init;
    }
    return Optional.empty();
  }

  /** The referenced outer consts plus the outer consts their initializers depend on, in source order. */
  private List<TermSymbol> constClosure(List<TermSymbol> referenced) {
    List<TermSymbol> consts = new ArrayList<>();
    referenced.stream().filter(this::isOuterConst).forEach(consts::add);
    for (int i = 0; i < consts.size(); ++i) {
      outerConstInit(consts.get(i)).ifPresent(init -> init.preOrder()
          .filter(ExprRef.class::isInstance)
          .map(ref -> ((ExprRef)ref).symbol())
          .filter(symbol -> symbol instanceof TermSymbol && isOuterConst((TermSymbol)symbol) && !consts.contains(symbol))
          .forEach(symbol -> consts.add((TermSymbol)symbol)));
    }
    consts.sort(Comparator.comparingInt(symbol -> symbol.getLoc().start()));
    return consts;
  }

  private static List<TermSymbol> instancesOf(Entity entity, TypeSymbol entitySymbol) {
    return entity.instances().stream().filter(instance -> instance.entitySymbol() == entitySymbol).map(Instance::symbol).toList();
  }
}
