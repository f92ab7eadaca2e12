package fr.lapetina.tenantserving.disruptor.exception;

/**
 * Thrown by {@code submit} when the ingress ring buffer has no free slot.
 *
 * Nothing was admitted or charged: the caller may retry later or shed the request.
 */
public final class BackpressureException extends RuntimeException {

    private final BackpressureReason reason;
    private final int bufferSize;

    public BackpressureException(BackpressureReason reason, int bufferSize) {
        super("Backpressure: " + reason.getMessage() + " (size " + bufferSize + ")");
        this.reason = reason;
        this.bufferSize = bufferSize;
    }

    public BackpressureReason getReason() {
        return reason;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public enum BackpressureReason {
        RING_BUFFER_FULL("Ingress ring buffer is full");

        private final String message;

        BackpressureReason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
