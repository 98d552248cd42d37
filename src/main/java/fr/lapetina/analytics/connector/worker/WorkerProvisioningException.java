package fr.lapetina.analytics.connector.worker;

/**
 * Thrown when a worker cannot be provisioned. Propagated through the
 * {@code createWorker} future.
 */
public final class WorkerProvisioningException extends RuntimeException {

    private final ProvisioningFailure reason;

    public WorkerProvisioningException(ProvisioningFailure reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public WorkerProvisioningException(ProvisioningFailure reason, String details) {
        super(reason.getMessage() + " - " + details);
        this.reason = reason;
    }

    public WorkerProvisioningException(ProvisioningFailure reason, String details, Throwable cause) {
        super(reason.getMessage() + " - " + details, cause);
        this.reason = reason;
    }

    public ProvisioningFailure getReason() {
        return reason;
    }

    public enum ProvisioningFailure {
        CLIENT_UNAVAILABLE("Failed to create worker because the gateway client failed to initialize"),
        QUERY_NOT_CREATED("Failed to create query"),
        WORKER_FAILED("Worker failed to start"),
        MANAGER_DISPOSED("Worker manager has been disposed");

        private final String message;

        ProvisioningFailure(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
