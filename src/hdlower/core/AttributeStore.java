package hdlower.core;

import hdlower.core.Symbols.Symbol;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Side table attaching pass-specific metadata to symbols, keyed by symbol id.
 * Owned by the {@link CompilerContext}. Each symbol has a single writer at a time, but entries of different symbols may be
 * accessed concurrently.
 */
public class AttributeStore {
  private final ConcurrentHashMap<Integer, Map<Attribute<?>, Object>> table = new ConcurrentHashMap<>();

  public <T> Optional<T> get(Symbol symbol, Attribute<T> attr) {
    Map<Attribute<?>, Object> entries = table.get(symbol.getId());
    if (entries == null)
      return Optional.empty();
    synchronized (entries) {
      return Optional.ofNullable(entries.get(attr)).map(attr::cast);
    }
  }

  public boolean has(Symbol symbol, Attribute<?> attr) { return get(symbol, attr).isPresent(); }

  public <T> void set(Symbol symbol, Attribute<T> attr, T value) {
    if (value == null)
      throw new IllegalArgumentException("Use clear to remove attribute " + attr);
    Map<Attribute<?>, Object> entries = table.computeIfAbsent(symbol.getId(), id -> new HashMap<>());
    synchronized (entries) {
      entries.put(attr, value);
    }
  }

  public void clear(Symbol symbol, Attribute<?> attr) {
    Map<Attribute<?>, Object> entries = table.get(symbol.getId());
    if (entries == null)
      return;
    synchronized (entries) {
      entries.remove(attr);
    }
  }

  /** Copies all attributes of one symbol to another, overwriting existing entries of the target. */
  public void copy(Symbol from, Symbol to) {
    Map<Attribute<?>, Object> entries = table.get(from.getId());
    if (entries == null)
      return;
    Map<Attribute<?>, Object> snapshot;
    synchronized (entries) {
      snapshot = new HashMap<>(entries);
    }
    Map<Attribute<?>, Object> target = table.computeIfAbsent(to.getId(), id -> new HashMap<>());
    synchronized (target) {
      target.putAll(snapshot);
    }
  }
}
