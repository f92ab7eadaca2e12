/**
 * Multi-tenant admission control and scheduling in front of a shared resource pool.
 *
 * <p>Tenants get a weight, a concurrency quota and a token-bucket rate limit. Requests
 * that cannot be served at once wait in a weighted fair queue until capacity frees or
 * their deadline passes.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tenantserving.ServingFactory} - Builds a configured controller from YAML</li>
 *   <li>{@link fr.lapetina.tenantserving.admission.AdmissionController} - Submit, complete, cancel</li>
 *   <li>{@link fr.lapetina.tenantserving.TenantServingApplication} - Standalone process with the
 *       operational HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ServingFactory factory = ServingFactory.create("config.yaml").start()) {
 *     AdmissionController controller = factory.getController();
 *
 *     RequestHandle handle = controller.submit("tenant-a");
 *     AdmissionOutcome outcome = handle.outcome().get();
 *     if (outcome.isDispatched()) {
 *         try {
 *             // use outcome.lease().resourceId()
 *         } finally {
 *             controller.complete(outcome.lease());
 *         }
 *     }
 * }
 * }</pre>
 *
 * @see fr.lapetina.tenantserving.ServingFactory
 * @see fr.lapetina.tenantserving.disruptor.AdmissionPipeline
 */
package fr.lapetina.tenantserving;
