package hdlower.ui;

/**
 * Data-Class to hold lowering options.
 */
public class LowerConfig {

  /** Run the defaultCheck/finalCheck invariant verification after each pass. Slow; meant for tests. */
  public boolean applyTransformChecks = false;
  /** Joins parent and child names of lifted entities. Must not be a valid user identifier fragment. */
  public String separator = "__";

  public int normalizationRounds = 1;
  public boolean stopAfterErrors = true;
}
