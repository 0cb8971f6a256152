package hdlower;

import hdlower.core.CompilerContext;
import hdlower.core.FatalErrorException;
import hdlower.core.Message;
import hdlower.passes.Pass;
import hdlower.passes.Passes;
import hdlower.tree.Root;
import hdlower.ui.LowerConfig;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs the lowering passes on a typed design.
 * Diagnostics are collected in the {@link CompilerContext}; internal compiler errors propagate as exceptions.
 */
public class Lowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final CompilerContext cc;
  private final List<Pass> passes;

  public Lowering(CompilerContext cc) { this(cc, Passes.sequence(cc.getConfig())); }
  public Lowering(CompilerContext cc, List<Pass> passes) {
    this.cc = cc;
    this.passes = List.copyOf(passes);
  }
  public Lowering(LowerConfig config) { this(new CompilerContext(config)); }

  public CompilerContext getContext() { return cc; }
  public List<Pass> getPasses() { return passes; }
  public List<Message> getMessages() { return cc.getMessages(); }

  /**
   * Lowers the design to flat entities.
   * @return the lowered tree, or empty if a pass failed fatally or, with {@link LowerConfig#stopAfterErrors}, reported errors
   */
  public Optional<Root> lower(Root root) {
    Root tree = root;
    for (Pass pass : passes) {
      logger.debug("Running pass {}", pass.getName());
      try {
        tree = pass.run(tree, cc);
      } catch (FatalErrorException e) {
        logger.error("Pass {} failed: {}", pass.getName(), e.getMsg().text());
        return Optional.empty();
      }
      if (cc.getConfig().stopAfterErrors && cc.hasErrors()) {
        logger.info("Stopping after pass {} due to errors", pass.getName());
        return Optional.empty();
      }
    }
    logger.debug("Lowering produced {} entities", tree.entities().size());
    return Optional.of(tree);
  }
}
