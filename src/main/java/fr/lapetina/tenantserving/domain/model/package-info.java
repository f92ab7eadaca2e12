/**
 * Value objects of the admission layer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.tenantserving.domain.model.TenantPolicy} - Weight, quota, rate, burst and max wait of a tenant</li>
 *   <li>{@link fr.lapetina.tenantserving.domain.model.AdmissionRequest} - A request for one unit of pool capacity</li>
 *   <li>{@link fr.lapetina.tenantserving.domain.model.AdmissionOutcome} - Final decision, with the lease when dispatched</li>
 *   <li>{@link fr.lapetina.tenantserving.domain.model.PoolLease} - One occupied capacity unit</li>
 *   <li>{@link fr.lapetina.tenantserving.domain.model.OutcomeStatus} - Distinct outcome causes</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every type here is an immutable record or enum. A policy change replaces the whole
 * {@code TenantPolicy}, so readers never see a mix of old and new fields.
 */
package fr.lapetina.tenantserving.domain.model;
