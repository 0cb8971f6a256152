package hdlower.analysis;

import hdlower.core.Symbols.TermSymbol;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from term symbols to statically known values at one program point.
 * An absent symbol has an unknown value.
 */
public final class Bindings {
  private static final Bindings EMPTY = new Bindings(Map.of());

  private final Map<TermSymbol, BigInteger> values;

  private Bindings(Map<TermSymbol, BigInteger> values) { this.values = values; }

  public static Bindings empty() { return EMPTY; }

  public static Bindings of(Map<TermSymbol, BigInteger> values) {
    return values.isEmpty() ? EMPTY : new Bindings(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  public Optional<BigInteger> get(TermSymbol symbol) { return Optional.ofNullable(values.get(symbol)); }
  public boolean isEmpty() { return values.isEmpty(); }
  public int size() { return values.size(); }
  public Map<TermSymbol, BigInteger> asMap() { return values; }

  public Bindings with(TermSymbol symbol, BigInteger value) {
    if (value.equals(values.get(symbol)))
      return this;
    var newValues = new LinkedHashMap<>(values);
    newValues.put(symbol, value);
    return new Bindings(Collections.unmodifiableMap(newValues));
  }

  public Bindings without(TermSymbol symbol) {
    if (!values.containsKey(symbol))
      return this;
    var newValues = new LinkedHashMap<>(values);
    newValues.remove(symbol);
    return of(newValues);
  }

  public Bindings withoutAll(Collection<TermSymbol> symbols) {
    if (symbols.stream().noneMatch(values::containsKey))
      return this;
    var newValues = new LinkedHashMap<>(values);
    newValues.keySet().removeAll(symbols);
    return of(newValues);
  }

  /** Keeps the bindings both sides agree on: the join of two control flow paths. */
  public Bindings merge(Bindings other) {
    if (other == this)
      return this;
    var newValues = new LinkedHashMap<TermSymbol, BigInteger>();
    values.forEach((symbol, value) -> {
      if (value.equals(other.values.get(symbol)))
        newValues.put(symbol, value);
    });
    return newValues.size() == values.size() ? this : of(newValues);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bindings && ((Bindings)obj).values.equals(values);
  }
  @Override
  public int hashCode() {
    return values.hashCode();
  }
  @Override
  public String toString() {
    return values.toString();
  }
}
