/**
 * LMAX Disruptor-based ingress pipeline for admission requests.
 *
 * <p>Every submitted request is published into a pre-allocated ring buffer and decided by a
 * chain of single-threaded stages. Publishing never blocks: a full ring buffer is reported to
 * the caller as backpressure.
 *
 * <h2>Pipeline Stages</h2>
 * <p>Events flow through handlers in sequence:
 * <pre>
 * Policy → Quota → Rate Limit → Dispatch → Metrics → Completion
 * </pre>
 * <p>A stage that rejects the request marks the event; later decision stages skip it and the
 * completion stage delivers the rejection.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tenantserving.disruptor.AdmissionPipeline} - Pipeline orchestrator</li>
 *   <li>{@link fr.lapetina.tenantserving.disruptor.exception.BackpressureException} - Thrown when ring buffer is full</li>
 * </ul>
 *
 * @see fr.lapetina.tenantserving.disruptor.AdmissionPipeline
 * @see com.lmax.disruptor.dsl.Disruptor
 */
package fr.lapetina.tenantserving.disruptor;
