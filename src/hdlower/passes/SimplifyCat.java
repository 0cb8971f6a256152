package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.core.Loc;
import hdlower.core.Symbols.Symbol;
import hdlower.tree.Connect;
import hdlower.tree.Expr;
import hdlower.tree.ExprCat;
import hdlower.tree.ExprInt;
import hdlower.tree.ExprRef;
import hdlower.tree.StmtAssign;
import hdlower.tree.Thicket;
import hdlower.tree.Tree;
import hdlower.util.Bits;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Unpacks concatenations:
 * <ul>
 * <li>single-part concatenations are replaced by the part</li>
 * <li>nested concatenations are flattened</li>
 * <li>an assignment or connection between two concatenations is split into one per equal-width group of parts</li>
 * <li>a constant assigned to a concatenation is split into one constant per part</li>
 * </ul>
 */
public class SimplifyCat extends TreeTransformer {
  public SimplifyCat(CompilerContext cc) { super(cc); }

  /** Matching groups of parts of the two sides. */
  private record Group(List<Expr> lhs, List<Expr> rhs) {}

  @Override
  protected Tree transform(Tree tree) {
    if (tree instanceof ExprCat)
      return simplify((ExprCat)tree);
    if (tree instanceof StmtAssign) {
      StmtAssign assign = (StmtAssign)tree;
      if (!(assign.lhs() instanceof ExprCat))
        return assign;
      List<Expr> lhsParts = ((ExprCat)assign.lhs()).parts();
      if (assign.rhs() instanceof ExprInt)
        return splitConstant(assign, lhsParts, (ExprInt)assign.rhs());
      if (!(assign.rhs() instanceof ExprCat))
        return assign;
      List<Expr> rhsParts = ((ExprCat)assign.rhs()).parts();
      if (!allPacked(lhsParts) || !allPacked(rhsParts))
        return assign;
      // {a, b} = {b, a} must read the right hand side atomically
      Set<Symbol> lhsSymbols = referencedSymbols(lhsParts);
      if (referencedSymbols(rhsParts).stream().anyMatch(lhsSymbols::contains))
        return assign;
      List<Group> groups = pairUp(assign.loc(), lhsParts, rhsParts);
      if (groups.size() <= 1)
        return assign;
      logger.trace("Splitting concatenation assignment at {} into {} assignments", assign.loc(), groups.size());
      List<Tree> assigns = new ArrayList<>();
      for (Group group : groups)
        assigns.add(new StmtAssign(join(group.lhs(), assign.loc()), join(group.rhs(), assign.loc()), assign.loc()));
      return new Thicket(assigns, assign.loc());
    }
    if (tree instanceof Connect) {
      Connect connect = (Connect)tree;
      if (!(connect.lhs() instanceof ExprCat) || connect.rhs().size() != 1 || !(connect.rhs().get(0) instanceof ExprCat))
        return connect;
      List<Expr> lhsParts = ((ExprCat)connect.lhs()).parts();
      List<Expr> rhsParts = ((ExprCat)connect.rhs().get(0)).parts();
      if (!allPacked(lhsParts) || !allPacked(rhsParts))
        return connect;
      List<Group> groups = pairUp(connect.loc(), lhsParts, rhsParts);
      if (groups.size() <= 1)
        return connect;
      List<Tree> connects = new ArrayList<>();
      for (Group group : groups)
        connects.add(new Connect(join(group.lhs(), connect.loc()), join(group.rhs(), connect.loc()), connect.loc()));
      return new Thicket(connects, connect.loc());
    }
    return tree;
  }

  private static Expr simplify(ExprCat cat) {
    if (cat.parts().size() == 1)
      return cat.parts().get(0);
    if (cat.parts().stream().noneMatch(ExprCat.class::isInstance))
      return cat;
    List<Expr> parts = new ArrayList<>();
    for (Expr part : cat.parts()) {
      if (part instanceof ExprCat)
        parts.addAll(((ExprCat)part).parts());
      else
        parts.add(part);
    }
    return new ExprCat(parts, cat.loc());
  }

  /** {a, b} = const becomes a = const[hi:lo]; b = const[lo-1:0]. Unchanged if the widths differ. */
  private static Tree splitConstant(StmtAssign assign, List<Expr> parts, ExprInt value) {
    if (!allPacked(parts))
      return assign;
    int[] widths = parts.stream().mapToInt(part -> part.tpe().width()).toArray();
    if (Arrays.stream(widths).sum() != value.width())
      return assign;
    List<Tree> assigns = new ArrayList<>();
    int lsb = value.width();
    for (int i = 0; i < parts.size(); ++i) {
      lsb -= widths[i];
      Expr part = parts.get(i);
      boolean signed = part.tpe().isSigned();
      ExprInt field = new ExprInt(signed, widths[i], Bits.extract(value.value(), lsb, widths[i], signed), value.loc());
      assigns.add(new StmtAssign(part, field, assign.loc()));
    }
    return new Thicket(assigns, assign.loc());
  }

  private static boolean allPacked(List<Expr> exprs) { return exprs.stream().allMatch(expr -> expr.tpe().isPacked()); }

  private static int width(List<Expr> exprs) { return exprs.stream().mapToInt(expr -> expr.tpe().width()).sum(); }

  /**
   * Partitions both part lists into the finest sequence of contiguous groups with pairwise equal widths.
   * Reports an error and returns a single group if the total widths differ.
   */
  private List<Group> pairUp(Loc loc, List<Expr> as, List<Expr> bs) {
    int aWidth = width(as);
    int bWidth = width(bs);
    if (aWidth != bWidth) {
      cc.error(loc, "Widths do not match", String.format("left hand side is %d bits wide", aWidth),
               String.format("right hand side is %d bits wide", bWidth));
      return List.of(new Group(as, bs));
    }
    List<Group> groups = new ArrayList<>();
    int ai = 0;
    int bi = 0;
    while (ai < as.size()) {
      int aStart = ai;
      int bStart = bi;
      int aw = as.get(ai++).tpe().width();
      int bw = bs.get(bi++).tpe().width();
      while (aw != bw) {
        if (aw < bw)
          aw += as.get(ai++).tpe().width();
        else
          bw += bs.get(bi++).tpe().width();
      }
      groups.add(new Group(as.subList(aStart, ai), bs.subList(bStart, bi)));
    }
    return groups;
  }

  private static Expr join(List<Expr> parts, Loc loc) { return parts.size() == 1 ? parts.get(0) : new ExprCat(parts, loc); }

  private static Set<Symbol> referencedSymbols(List<Expr> exprs) {
    return exprs.stream()
        .flatMap(Expr::preOrder)
        .filter(ExprRef.class::isInstance)
        .map(ref -> ((ExprRef)ref).symbol())
        .collect(Collectors.toCollection(HashSet::new));
  }
}
