package hdlower.passes;

import hdlower.core.CompilerContext;
import hdlower.tree.Root;
import java.util.function.Function;

/** A named whole-tree transformation. Each run uses a fresh {@link TreeTransformer}. */
public interface Pass {
  String getName();

  TreeTransformer create(CompilerContext cc);

  default Root run(Root root, CompilerContext cc) { return create(cc).apply(root); }

  static Pass of(String name, Function<CompilerContext, TreeTransformer> factory) {
    return new Pass() {
      @Override
      public String getName() {
        return name;
      }
      @Override
      public TreeTransformer create(CompilerContext cc) {
        return factory.apply(cc);
      }
      @Override
      public String toString() {
        return name;
      }
    };
  }
}
