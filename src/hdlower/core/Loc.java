package hdlower.core;

/**
 * Source location of a tree node or symbol.
 * {@code start} and {@code end} are character offsets into the file and define the source order of declarations.
 */
public record Loc(String file, int line, int start, int end) {
  /** Location of synthesized nodes that have no source counterpart. */
  public static final Loc UNKNOWN = new Loc("<unknown>", 0, 0, 0);

  public Loc {
    if (file == null)
      throw new IllegalArgumentException("file must not be null");
    if (end < start)
      throw new IllegalArgumentException("end must not be before start");
  }

  /** Convenience constructor for a location without a meaningful extent. */
  public Loc(String file, int line, int start) { this(file, line, start, start); }

  @Override
  public String toString() {
    return file + ":" + line;
  }
}
