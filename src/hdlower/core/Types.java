package hdlower.core;

import hdlower.tree.Expr;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed set of types (symbol kinds) handled by the lowering passes.
 * All types are immutable; a symbol changes its kind by being assigned a new Type object.
 */
public final class Types {
  private Types() {}

  /** Common interface of all types. */
  public interface Type {
    /** Returns true for types with a fixed bit width. */
    default boolean isPacked() { return false; }
    /** Bit width of a packed type. */
    default int width() { throw new IllegalStateException("Type " + this + " has no width"); }
    default boolean isSigned() { return false; }
    /** Strips port, const and pipeline wrappers. */
    default Type underlying() { return this; }
  }

  public record TypeUInt(int width) implements Type {
    public TypeUInt {
      if (width <= 0)
        throw new IllegalArgumentException("width must be positive");
    }
    @Override
    public boolean isPacked() {
      return true;
    }
    @Override
    public String toString() {
      return "u" + width;
    }
  }

  public record TypeSInt(int width) implements Type {
    public TypeSInt {
      if (width <= 0)
        throw new IllegalArgumentException("width must be positive");
    }
    @Override
    public boolean isPacked() {
      return true;
    }
    @Override
    public boolean isSigned() {
      return true;
    }
    @Override
    public String toString() {
      return "i" + width;
    }
  }

  /** Type of unsized numeric literals. */
  public record TypeNum(boolean signed) implements Type {
    @Override
    public boolean isSigned() {
      return signed;
    }
  }

  public record TypeVoid() implements Type {
    public static final TypeVoid INSTANCE = new TypeVoid();
  }

  public record TypeStruct(String name, List<String> fieldNames, List<Type> fieldTypes) implements Type {
    public TypeStruct {
      fieldNames = List.copyOf(fieldNames);
      fieldTypes = List.copyOf(fieldTypes);
      if (fieldNames.size() != fieldTypes.size())
        throw new IllegalArgumentException("field name and type lists differ in length");
    }
    @Override
    public boolean isPacked() {
      return true;
    }
    @Override
    public int width() {
      return fieldTypes.stream().mapToInt(Type::width).sum();
    }
    public Optional<Type> fieldType(String fieldName) {
      int idx = fieldNames.indexOf(fieldName);
      return idx < 0 ? Optional.empty() : Optional.of(fieldTypes.get(idx));
    }
  }

  public record TypeArray(Type element, int size) implements Type {}

  /** Input port. */
  public record TypeIn(Type kind, FlowControl flowControl) implements Type {
    @Override
    public boolean isPacked() {
      return kind.isPacked();
    }
    @Override
    public int width() {
      return kind.width();
    }
    @Override
    public boolean isSigned() {
      return kind.isSigned();
    }
    @Override
    public Type underlying() {
      return kind;
    }
  }

  /** Output port. */
  public record TypeOut(Type kind, FlowControl flowControl, StorageType storage) implements Type {
    @Override
    public boolean isPacked() {
      return kind.isPacked();
    }
    @Override
    public int width() {
      return kind.width();
    }
    @Override
    public boolean isSigned() {
      return kind.isSigned();
    }
    @Override
    public Type underlying() {
      return kind;
    }
    public TypeOut withStorage(StorageType newStorage) { return new TypeOut(kind, flowControl, newStorage); }
  }

  public record TypeConst(Type kind) implements Type {
    @Override
    public boolean isPacked() {
      return kind.isPacked();
    }
    @Override
    public int width() {
      return kind.width();
    }
    @Override
    public boolean isSigned() {
      return kind.isSigned();
    }
    @Override
    public Type underlying() {
      return kind;
    }
  }

  /** Pipeline variable, threaded implicitly between the stages of a pipeline. */
  public record TypePipeline(Type kind) implements Type {
    @Override
    public boolean isPacked() {
      return kind.isPacked();
    }
    @Override
    public int width() {
      return kind.width();
    }
    @Override
    public Type underlying() {
      return kind;
    }
  }

  /** Hardware stack of the given depth; the depth must fold to a constant by the time it is materialized. */
  public record TypeStack(Type element, Expr depth) implements Type {}

  /** Kind of an entity symbol. */
  public record TypeEntity(List<Symbols.TermSymbol> portSymbols) implements Type {
    public TypeEntity { portSymbols = List.copyOf(portSymbols); }

    public Optional<Symbols.TermSymbol> port(String name) {
      return portSymbols.stream().filter(symbol -> symbol.getName().equals(name)).findFirst();
    }

    /** Returns a copy with the given ports placed in front of the existing ones. */
    public TypeEntity withLeadingPorts(List<Symbols.TermSymbol> newPorts) {
      List<Symbols.TermSymbol> ports = new ArrayList<>(newPorts);
      ports.addAll(portSymbols);
      return new TypeEntity(ports);
    }

    @Override
    public String toString() {
      return portSymbols.stream().map(Symbols.TermSymbol::getName).collect(Collectors.joining(", ", "entity(", ")"));
    }
  }

  /** Kind of an instance symbol. */
  public record TypeInstance(Symbols.TypeSymbol entitySymbol) implements Type {
    @Override
    public String toString() {
      return "instance(" + entitySymbol.getName() + ")";
    }
  }

  public static TypeUInt bool() { return new TypeUInt(1); }
}
