package hdlower.core;

import java.util.List;

/** A diagnostic reported through the {@link CompilerContext}. */
public record Message(Severity severity, Loc loc, List<String> lines) {
  public enum Severity {
    WARNING,
    ERROR,
    /** User error after which no valid output can be produced */
    FATAL,
    /** Internal compiler error: a broken invariant */
    ICE
  }

  public Message {
    lines = List.copyOf(lines);
    if (lines.isEmpty())
      throw new IllegalArgumentException("A message needs at least one line");
  }

  public String text() { return String.join("\n", lines); }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(loc).append(": ").append(severity).append(": ").append(lines.get(0));
    lines.stream().skip(1).forEach(line -> sb.append("\n... ").append(line));
    return sb.toString();
  }
}
