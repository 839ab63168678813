/**
 * Ports and plugin contracts of the analysis core.
 *
 * <p>Plugins implement one of {@link ca.gc.cra.kestrel.application.port.AuxiliaryModule},
 * {@link ca.gc.cra.kestrel.application.port.MachineryModule},
 * {@link ca.gc.cra.kestrel.application.port.ProcessingModule},
 * {@link ca.gc.cra.kestrel.application.port.ReportingModule} or
 * {@link ca.gc.cra.kestrel.application.signatures.Signature}. Declared failures extend
 * {@link ca.gc.cra.kestrel.application.port.ModuleException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.port;
