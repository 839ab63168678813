/**
 * Pipeline stages of an analysis: auxiliary start/stop, processing, signatures and reporting.
 *
 * <p>Every stage funnels modules through {@link ca.gc.cra.kestrel.application.pipeline.ModuleRunner}, which
 * contains module failures; no stage throws for a faulty plugin.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.pipeline;
