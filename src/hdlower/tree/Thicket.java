package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/**
 * One input node expanded into several sibling nodes. Spliced into the enclosing list by the tree transformer;
 * never survives in a finished tree.
 */
public record Thicket(List<Tree> trees, Loc loc) implements Tree {
  public Thicket { trees = List.copyOf(trees); }

  @Override
  public Stream<Tree> children() {
    return trees.stream();
  }
}
