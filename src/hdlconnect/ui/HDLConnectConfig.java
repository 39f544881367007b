package hdlconnect.ui;

import hdlconnect.connect.ConnectOptions;
import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class HDLConnectConfig {

  public boolean connectFieldsMustMatch = false;
  public boolean dontAssumeDirectionality = false;
  public boolean dontTryConnectionsSwapped = false;

  public int maxBindingDepth = ConnectOptions.DEFAULT_MAX_BINDING_DEPTH;

  /** If set, a failing connect statement does not emit any commands. */
  public boolean atomic = false;

  public ConnectOptions toConnectOptions() {
    return new ConnectOptions(connectFieldsMustMatch, dontAssumeDirectionality, dontTryConnectionsSwapped, maxBindingDepth);
  }

  /**
   * Reads the options from a YAML mapping; missing keys keep their defaults.
   * @param input the YAML document
   * @return the options, or the defaults for an empty document
   */
  public static HDLConnectConfig load(InputStream input) {
    Yaml yamlConfig = new Yaml(new Constructor(HDLConnectConfig.class, new LoaderOptions()));
    HDLConnectConfig cfg = yamlConfig.load(input);
    return (cfg != null) ? cfg : new HDLConnectConfig();
  }
}
