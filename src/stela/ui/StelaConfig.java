package stela.ui;

import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.TypeDescription;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold elaboration options.
 */
public class StelaConfig {

  /** Attach source lines and loop bindings to the generated statements. */
  public boolean debug = false;
  /** With debug, also attach the literal and signal bindings of the environment to assignments and assertions. */
  public boolean capture_locals = true;
  /** Reject blocks without decoration instead of treating them as combinational. */
  public boolean require_decoration = false;

  /**
   * Reads a configuration from YAML. Keys that are not given keep their defaults.
   * An empty document yields the default configuration.
   */
  public static StelaConfig load(InputStream yamlStream) {
    Constructor yamlConstructor = new Constructor(StelaConfig.class, new LoaderOptions());
    yamlConstructor.addTypeDescription(new TypeDescription(StelaConfig.class, "!StelaConfig"));
    Yaml yaml = new Yaml(yamlConstructor);
    StelaConfig config = yaml.load(yamlStream);
    return config == null ? new StelaConfig() : config;
  }

  @Override
  public String toString() {
    return String.format("StelaConfig(debug=%b, capture_locals=%b, require_decoration=%b)", debug, capture_locals, require_decoration);
  }
}
