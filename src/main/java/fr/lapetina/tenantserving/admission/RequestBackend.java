package fr.lapetina.tenantserving.admission;

import fr.lapetina.tenantserving.domain.model.AdmissionRequest;
import fr.lapetina.tenantserving.domain.model.PoolLease;

import java.util.concurrent.CompletionStage;

/**
 * The component that performs the actual work once a request holds a lease.
 *
 * Called on the thread that dispatched the request, so implementations must not block.
 * When the returned stage finishes, normally or exceptionally, the controller releases the
 * lease. Returning {@code null} leaves the release to the caller through
 * {@link AdmissionController#complete(PoolLease)}.
 */
@FunctionalInterface
public interface RequestBackend {

    CompletionStage<?> execute(AdmissionRequest request, PoolLease lease);

    /**
     * A backend that starts nothing: whoever holds the outcome's lease completes it.
     */
    static RequestBackend callerManaged() {
        return (request, lease) -> null;
    }
}
