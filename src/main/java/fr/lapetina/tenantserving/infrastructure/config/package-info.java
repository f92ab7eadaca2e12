/**
 * YAML configuration and hot reload.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tenantserving.infrastructure.config.ServingConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.tenantserving.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.tenantserving.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - operational HTTP server (port, backlog, threads)</li>
 *   <li>{@code pool} - slot pool capacity or worker node list</li>
 *   <li>{@code admission} - ring buffer, wait strategy, sweep interval, strict registration, default policy</li>
 *   <li>{@code tenants} - per-tenant policies</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>A reload re-applies tenant policies and the default policy. Pool and pipeline
 * settings only take effect on restart.
 */
package fr.lapetina.tenantserving.infrastructure.config;
