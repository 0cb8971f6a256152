package hdlower.core;

import hdlower.core.Message.Severity;
import hdlower.core.Symbols.Symbol;
import hdlower.core.Symbols.TermSymbol;
import hdlower.core.Symbols.TypeSymbol;
import hdlower.core.Types.Type;
import hdlower.tree.Tree;
import hdlower.ui.LowerConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State shared by all passes of one compilation: configuration, symbol allocation, the symbol attribute side table and the
 * diagnostic sink.
 * <p>
 * Symbol ids come from a single atomic counter, so symbols may be allocated from several threads.
 */
public class CompilerContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LowerConfig config;
  private final AtomicInteger nextSymbolId = new AtomicInteger();
  private final AttributeStore attributes = new AttributeStore();
  private final List<Message> messages = Collections.synchronizedList(new ArrayList<>());

  public CompilerContext() { this(new LowerConfig()); }
  public CompilerContext(LowerConfig config) { this.config = config; }

  public LowerConfig getConfig() { return config; }
  public AttributeStore attributes() { return attributes; }
  /** The token joining parent and child names of lifted entities. */
  public String sep() { return config.separator; }

  ///////////////////////////////////////////////////////////////////////////
  // Symbols
  ///////////////////////////////////////////////////////////////////////////

  public TermSymbol newTermSymbol(String name, Loc loc, Type kind) {
    return new TermSymbol(nextSymbolId.getAndIncrement(), name, loc, kind);
  }

  public TypeSymbol newTypeSymbol(String name, Loc loc, Type kind) {
    return new TypeSymbol(nextSymbolId.getAndIncrement(), name, loc, kind);
  }

  /**
   * Creates a fresh symbol with the name, location, current kind and attributes of the template.
   * Later changes of the template do not affect the new symbol.
   */
  public TermSymbol newSymbolLike(TermSymbol template) {
    TermSymbol symbol = newTermSymbol(template.getName(), template.getLoc(), template.getKind());
    attributes.copy(template, symbol);
    return symbol;
  }

  /** See {@link #newSymbolLike(TermSymbol)}. */
  public TypeSymbol newSymbolLike(TypeSymbol template) {
    TypeSymbol symbol = newTypeSymbol(template.getName(), template.getLoc(), template.getKind());
    attributes.copy(template, symbol);
    return symbol;
  }

  ///////////////////////////////////////////////////////////////////////////
  // Diagnostics
  ///////////////////////////////////////////////////////////////////////////

  private Message report(Severity severity, Loc loc, List<String> lines) {
    Message msg = new Message(severity, loc, lines);
    messages.add(msg);
    switch (severity) {
    case WARNING:
      logger.warn(msg);
      break;
    case ERROR:
      logger.error(msg);
      break;
    default:
      logger.fatal(msg);
    }
    return msg;
  }

  public void warning(Loc loc, String... lines) { report(Severity.WARNING, loc, List.of(lines)); }
  public void warning(Tree tree, String... lines) { warning(tree.loc(), lines); }

  /** Reports a recoverable user error. The caller keeps going, usually with the unmodified node. */
  public void error(Loc loc, String... lines) { report(Severity.ERROR, loc, List.of(lines)); }
  public void error(Loc loc, List<String> lines) { report(Severity.ERROR, loc, lines); }
  public void error(Tree tree, String... lines) { error(tree.loc(), lines); }

  /**
   * Reports a fatal user error and aborts the current pass by throwing.
   * Declared to return the exception so that callers can write {@code throw cc.fatal(...)}.
   */
  public FatalErrorException fatal(Loc loc, String line) {
    throw new FatalErrorException(report(Severity.FATAL, loc, List.of(line)));
  }
  public FatalErrorException fatal(Tree tree, String line) { return fatal(tree.loc(), line); }

  /** Reports an internal compiler error and aborts by throwing. */
  public InternalCompilerErrorException ice(Loc loc, String line) {
    throw new InternalCompilerErrorException(report(Severity.ICE, loc, List.of(line)));
  }
  public InternalCompilerErrorException ice(Tree tree, String line) { return ice(tree.loc(), line); }

  public List<Message> getMessages() {
    synchronized (messages) {
      return List.copyOf(messages);
    }
  }

  public List<Message> getMessages(Severity severity) {
    synchronized (messages) {
      return messages.stream().filter(msg -> msg.severity() == severity).toList();
    }
  }

  public boolean hasErrors() {
    synchronized (messages) {
      return messages.stream().anyMatch(msg -> msg.severity() != Severity.WARNING);
    }
  }
}
