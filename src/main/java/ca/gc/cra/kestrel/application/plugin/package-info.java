/**
 * Plugin registration table shared by every pipeline stage.
 *
 * <p>Discovery of which plugins exist is an external step; it calls
 * {@link ca.gc.cra.kestrel.application.plugin.PluginRegistry#register(PluginDescriptor)} once per plugin.
 * Plugin <em>types</em> are shared between runs, instances never are.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.application.plugin;
