package hdlower.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Register placement policy of an output port.
 * A {@link Kind#SLICES} storage carries a non-empty, ordered chain of register slices.
 */
public record StorageType(Kind kind, List<SliceKind> slices) {
  public enum Kind { REG, WIRE, SLICES }

  /** One stage of a pipelined register chain. */
  public enum SliceKind {
    FWD("fslice"),
    BWD("bslice"),
    BUBBLE("bubble");

    public final String serialName;

    private SliceKind(String serialName) { this.serialName = serialName; }
  }

  public static final StorageType REG = new StorageType(Kind.REG, List.of());
  public static final StorageType WIRE = new StorageType(Kind.WIRE, List.of());

  public StorageType {
    slices = List.copyOf(slices);
    if ((kind == Kind.SLICES) == slices.isEmpty())
      throw new IllegalArgumentException("slices must be given exactly for SLICES storage");
  }

  public static StorageType slices(List<SliceKind> slices) { return new StorageType(Kind.SLICES, slices); }
  public static StorageType slices(SliceKind... slices) { return slices(List.of(slices)); }

  public boolean isWire() { return kind == Kind.WIRE; }

  @Override
  public String toString() {
    switch (kind) {
    case REG:
      return "reg";
    case WIRE:
      return "wire";
    default:
      return slices.stream().map(slice -> slice.serialName).collect(Collectors.joining(" "));
    }
  }
}
