package uk.gegc.boxbilling.features.billing.application;

/**
 * Outcome of processing one webhook event.
 *
 * @param accepted         {@code false} only for failures, which the provider should redeliver
 * @param alreadyProcessed the event id had been seen before
 * @param error            failure message, {@code null} unless {@code status} is {@code FAILED}
 */
public record ProcessingResult(
        Status status,
        boolean accepted,
        boolean alreadyProcessed,
        String eventId,
        String error
) {

    public enum Status {
        PROCESSED,
        DUPLICATE,
        IGNORED,
        FAILED
    }

    public static ProcessingResult processed(String eventId) {
        return new ProcessingResult(Status.PROCESSED, true, false, eventId, null);
    }

    public static ProcessingResult duplicate(String eventId) {
        return new ProcessingResult(Status.DUPLICATE, true, true, eventId, null);
    }

    public static ProcessingResult ignored(String eventId) {
        return new ProcessingResult(Status.IGNORED, true, false, eventId, null);
    }

    public static ProcessingResult failed(String eventId, String error) {
        return new ProcessingResult(Status.FAILED, false, false, eventId, error);
    }
}
