package hdlower.core;

import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Types.TypeEntity;
import hdlower.tree.Expr;

/**
 * Typed key into the per-symbol attribute side table ({@link AttributeStore}).
 * @param <T> the type of the attribute value
 */
public final class Attribute<T> {
  /** Initializer expression of a const, register or port. */
  public static final Attribute<Expr> INIT = new Attribute<>("init", Expr.class);
  /** Structural role of an entity, e.g. "fsm" for generated state machines. */
  public static final Attribute<String> VARIANT = new Attribute<>("variant", String.class);
  /** Kind of an entity before any lowering pass widened it. */
  public static final Attribute<TypeEntity> HIGH_LEVEL_KIND = new Attribute<>("highLevelKind", TypeEntity.class);
  /** On a generated stack entity: the stack declaration it implements. */
  public static final Attribute<TermSymbol> STACK_OF = new Attribute<>("stackOf", TermSymbol.class);

  private final String name;
  private final Class<T> valueClass;

  public Attribute(String name, Class<T> valueClass) {
    this.name = name;
    this.valueClass = valueClass;
  }

  public String getName() { return name; }

  T cast(Object value) { return valueClass.cast(value); }

  @Override
  public String toString() {
    return name;
  }
}
