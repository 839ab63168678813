package ca.gc.cra.kestrel.application.plugin;

import ca.gc.cra.kestrel.application.port.AuxiliaryModule;
import ca.gc.cra.kestrel.application.port.MachineryModule;
import ca.gc.cra.kestrel.application.port.ProcessingModule;
import ca.gc.cra.kestrel.application.port.ReportingModule;
import ca.gc.cra.kestrel.application.signatures.Signature;
import java.util.Locale;

/**
 * Capability groups a plugin can be registered under, each bound to the contract its plugins implement.
 *
 * @since 0.1.0
 */
public enum PluginGroup {
  AUXILIARY(AuxiliaryModule.class),
  MACHINERY(MachineryModule.class),
  PROCESSING(ProcessingModule.class),
  REPORTING(ReportingModule.class),
  SIGNATURES(Signature.class);

  private final Class<?> contract;

  PluginGroup(Class<?> contract) {
    this.contract = contract;
  }

  /**
   * Returns the interface every plugin of this group implements.
   *
   * @return plugin contract
   */
  public Class<?> contract() {
    return contract;
  }

  /**
   * Returns the lowercase group id used in configuration and logs.
   *
   * @return group id, e.g. {@code processing}
   */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
