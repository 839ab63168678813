package ca.gc.cra.kestrel.application.port;

import ca.gc.cra.kestrel.config.ModuleOptions;
import java.util.List;

/**
 * Virtualization backend controlling the analysis machines.
 *
 * <p>The core only registers machinery plugins; the sandbox layer drives them.</p>
 *
 * @since 0.1.0
 */
public interface MachineryModule {
  /**
   * Prepares the backend.
   *
   * @param options machinery configuration section
   * @throws ModuleException when the backend is unusable
   */
  void initialize(ModuleOptions options) throws ModuleException;

  /**
   * Lists the machine labels managed by this backend.
   *
   * @return machine labels
   */
  List<String> machines();

  /**
   * Starts (restores) a machine.
   *
   * @param label machine label
   * @throws ModuleException when the machine cannot start
   */
  void start(String label) throws ModuleException;

  /**
   * Stops a machine.
   *
   * @param label machine label
   * @throws ModuleException when the machine cannot stop
   */
  void stop(String label) throws ModuleException;
}
