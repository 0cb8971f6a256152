package hdlower.core;

import hdlower.core.Types.Type;

/**
 * Symbols give identity to names. Term symbols name values (ports, variables, constants, instances),
 * type symbols name entities.
 * <p>
 * Symbols are allocated by {@link CompilerContext} only. The kind and the name are mutable:
 * passes widen entity kinds as they add ports, demote port storage, and rename lifted entities.
 * Equality is identity.
 */
public final class Symbols {
  private Symbols() {}

  public abstract static class Symbol {
    private final int id;
    private final Loc loc;
    private String name;
    private Type kind;

    Symbol(int id, String name, Loc loc, Type kind) {
      if (name == null || name.isEmpty())
        throw new IllegalArgumentException("Symbol name must not be empty");
      this.id = id;
      this.name = name;
      this.loc = loc;
      this.kind = kind;
    }

    /** Creation order of the symbol, unique within one {@link CompilerContext}. */
    public int getId() { return id; }
    public String getName() { return name; }
    public Loc getLoc() { return loc; }
    public Type getKind() { return kind; }

    public void setKind(Type kind) {
      if (kind == null)
        throw new IllegalArgumentException("kind must not be null");
      this.kind = kind;
    }
    public void rename(String newName) {
      if (newName == null || newName.isEmpty())
        throw new IllegalArgumentException("Symbol name must not be empty");
      this.name = newName;
    }

    @Override
    public final boolean equals(Object obj) {
      return this == obj;
    }
    @Override
    public final int hashCode() {
      return Integer.hashCode(id);
    }
    @Override
    public String toString() {
      return String.format("%s(%d)", name, id);
    }
  }

  public static final class TermSymbol extends Symbol {
    TermSymbol(int id, String name, Loc loc, Type kind) { super(id, name, loc, kind); }
  }

  public static final class TypeSymbol extends Symbol {
    TypeSymbol(int id, String name, Loc loc, Type kind) { super(id, name, loc, kind); }
  }
}
