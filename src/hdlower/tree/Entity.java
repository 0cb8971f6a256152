package hdlower.tree;

import hdlower.core.Loc;
import hdlower.core.Symbols.TypeSymbol;
import java.util.List;
import java.util.stream.Stream;

/**
 * A hardware module. Nested entities only exist before LiftEntities.
 */
public record Entity(TypeSymbol symbol, List<Decl> declarations, List<Instance> instances, List<Connect> connects,
                     List<Stmt> statements, List<Entity> entities, Loc loc) implements Tree {
  public Entity {
    declarations = List.copyOf(declarations);
    instances = List.copyOf(instances);
    connects = List.copyOf(connects);
    statements = List.copyOf(statements);
    entities = List.copyOf(entities);
  }

  public String getName() { return symbol.getName(); }

  public Entity withDeclarations(List<Decl> newDeclarations) {
    return new Entity(symbol, newDeclarations, instances, connects, statements, entities, loc);
  }
  public Entity withInstances(List<Instance> newInstances) {
    return new Entity(symbol, declarations, newInstances, connects, statements, entities, loc);
  }
  public Entity withConnects(List<Connect> newConnects) {
    return new Entity(symbol, declarations, instances, newConnects, statements, entities, loc);
  }
  public Entity withStatements(List<Stmt> newStatements) {
    return new Entity(symbol, declarations, instances, connects, newStatements, entities, loc);
  }
  public Entity withEntities(List<Entity> newEntities) {
    return new Entity(symbol, declarations, instances, connects, statements, newEntities, loc);
  }

  @Override
  public Stream<Tree> children() {
    return Stream.of(declarations.stream(), instances.stream(), connects.stream(), statements.stream(), entities.stream())
        .flatMap(stream -> stream.map(Tree.class::cast));
  }
}
