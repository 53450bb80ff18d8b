package uk.gegc.boxbilling.shared.exception;

/**
 * A referenced box, subscription, plan or grace period does not exist.
 * Inside webhook handlers this is a retryable condition, since the data may arrive later.
 */
public class ResourceNotFoundException extends RuntimeException {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
