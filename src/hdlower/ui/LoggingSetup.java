package hdlower.ui;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.appender.ConsoleAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.AppenderComponentBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilder;
import org.apache.logging.log4j.core.config.builder.api.ConfigurationBuilderFactory;
import org.apache.logging.log4j.core.config.builder.impl.BuiltConfiguration;

/** Programmatic log4j setup for embedding the lowering passes in a tool. */
public class LoggingSetup {
  public static final String PATTERN = "%-5level: %msg%n%throwable";

  private static boolean initialized = false;

  /** Routes all loggers to stdout with {@link #PATTERN}. Later calls only change the level. */
  public static synchronized void initialize(Level level) {
    if (!initialized) {
      // get builder to create new appender
      ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
      AppenderComponentBuilder appenderBuilder =
          builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
      appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", PATTERN));
      builder.add(appenderBuilder);
      builder.add(builder.newRootLogger(Level.OFF).add(builder.newAppenderRef("Stdout")));
      Configurator.initialize(builder.build());
      initialized = true;
    }
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), level);
  }

  /** Maps the usual verbosity switches onto a level: quiet wins over verbose. */
  public static Level levelFor(boolean quiet, int verbosity) {
    if (quiet)
      return Level.OFF;
    if (verbosity >= 2)
      return Level.TRACE;
    if (verbosity == 1)
      return Level.DEBUG;
    return Level.INFO;
  }
}
