package hdlower.passes;

import hdlower.ui.LowerConfig;
import java.util.ArrayList;
import java.util.List;

/** The available passes and the order they run in. */
public class Passes {
  public static final Pass LOWER_PIPELINE = Pass.of("lower-pipeline", LowerPipeline::new);
  public static final Pass LOWER_STACKS = Pass.of("lower-stacks", LowerStacks::new);
  public static final Pass LIFT_ENTITIES = Pass.of("lift-entities", LiftEntities::new);
  public static final Pass SIMPLIFY_CAT = Pass.of("simplify-cat", SimplifyCat::new);
  public static final Pass FOLD_STMT = Pass.of("fold-stmt", FoldStmt::new);
  public static final Pass REMOVE_REDUNDANT_BLOCKS = Pass.of("remove-redundant-blocks", RemoveRedundantBlocks::new);

  /** LowerPipeline needs the stages still nested in their pipeline, so it runs before LiftEntities. */
  public static List<Pass> sequence(LowerConfig config) {
    List<Pass> passes = new ArrayList<>(List.of(LOWER_PIPELINE, LOWER_STACKS, LIFT_ENTITIES));
    for (int round = 0; round < config.normalizationRounds; ++round)
      passes.addAll(List.of(SIMPLIFY_CAT, FOLD_STMT, REMOVE_REDUNDANT_BLOCKS));
    return passes;
  }
}
