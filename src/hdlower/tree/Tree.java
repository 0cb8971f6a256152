package hdlower.tree;

import hdlower.core.Loc;
import java.util.stream.Stream;

/**
 * Common interface of all immutable, source-located tree nodes.
 * Node equality is structural; passes that need node identity (e.g. "did anything change") compare references.
 */
public interface Tree {
  Loc loc();

  /** The direct children in traversal order. */
  Stream<Tree> children();

  /** This node followed by all descendants, in pre-order. */
  default Stream<Tree> preOrder() { return Stream.concat(Stream.of(this), children().flatMap(Tree::preOrder)); }
}
