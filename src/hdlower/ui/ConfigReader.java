package hdlower.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link LowerConfig} options from a YAML mapping, e.g.
 * <pre>
 * separator: "__"
 * normalizationRounds: 2
 * </pre>
 * Unknown keys and values of the wrong type are reported and ignored.
 */
public class ConfigReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static LowerConfig read(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      return apply(new LowerConfig(), new Yaml().load(in));
    }
  }

  public static LowerConfig read(String yamlText) { return read(new StringReader(yamlText)); }

  public static LowerConfig read(Reader reader) { return apply(new LowerConfig(), new Yaml().load(reader)); }

  /** Applies the settings in {@code loaded} (the result of a YAML load) onto {@code config}. */
  public static LowerConfig apply(LowerConfig config, Object loaded) {
    if (loaded == null)
      return config;
    if (!(loaded instanceof Map)) {
      logger.error("Lowering configuration must be a mapping, got {}", loaded.getClass().getSimpleName());
      return config;
    }
    for (Map.Entry<?, ?> entry : ((Map<?, ?>)loaded).entrySet()) {
      String tagName = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      switch (tagName) {
      case "applyTransformChecks":
        if (value instanceof Boolean)
          config.applyTransformChecks = (Boolean)value;
        else
          wrongType(tagName, "a boolean", value);
        break;
      case "stopAfterErrors":
        if (value instanceof Boolean)
          config.stopAfterErrors = (Boolean)value;
        else
          wrongType(tagName, "a boolean", value);
        break;
      case "separator":
        if (value instanceof String && !((String)value).isEmpty())
          config.separator = (String)value;
        else
          wrongType(tagName, "a non-empty string", value);
        break;
      case "normalizationRounds":
        if (value instanceof Integer && (Integer)value >= 0)
          config.normalizationRounds = (Integer)value;
        else
          wrongType(tagName, "a non-negative integer", value);
        break;
      default:
        logger.warn("Ignoring unknown tag {}", tagName);
      }
    }
    return config;
  }

  private static void wrongType(String tagName, String expected, Object value) {
    logger.warn("Ignoring '{}': expected {}, got '{}'", tagName, expected, value);
  }
}
