package hdlower.tree;

import hdlower.core.Types.Type;

/** Expression nodes. */
public interface Expr extends Tree {
  /**
   * The type of this expression, derived from the children and the symbol kinds on every call.
   * Rewritten trees thus never carry a stale type.
   */
  default Type tpe() { return TypeAssigner.typeOf(this); }
}
