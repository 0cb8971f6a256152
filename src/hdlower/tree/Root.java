package hdlower.tree;

import hdlower.core.Loc;
import java.util.List;
import java.util.stream.Stream;

/** The whole design: the list of top-level entities. */
public record Root(List<Entity> entities, Loc loc) implements Tree {
  public Root { entities = List.copyOf(entities); }
  public Root(List<Entity> entities) { this(entities, Loc.UNKNOWN); }

  @Override
  public Stream<Tree> children() {
    return entities.stream().map(Tree.class::cast);
  }
}
