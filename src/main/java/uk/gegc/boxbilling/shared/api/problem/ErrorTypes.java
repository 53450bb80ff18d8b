package uk.gegc.boxbilling.shared.api.problem;

import java.net.URI;

/**
 * Problem type URIs returned in the {@code type} field of every error response.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://boxbilling.gegc.uk/docs/errors/";

    // request
    public static final URI VALIDATION_FAILED = type("validation-failed");
    public static final URI INVALID_ARGUMENT = type("invalid-argument");
    public static final URI TYPE_MISMATCH = type("type-mismatch");
    public static final URI MALFORMED_JSON = type("malformed-json");

    // state
    public static final URI RESOURCE_NOT_FOUND = type("resource-not-found");
    public static final URI ILLEGAL_STATE = type("illegal-state");
    public static final URI DATA_CONFLICT = type("data-conflict");
    public static final URI OPTIMISTIC_LOCK_CONFLICT = type("optimistic-lock-conflict");

    // webhooks
    public static final URI WEBHOOK_INVALID_SIGNATURE = type("webhook-invalid-signature");
    public static final URI INVALID_BILLING_EVENT = type("invalid-billing-event");

    public static final URI INTERNAL_SERVER_ERROR = type("internal-server-error");

    private ErrorTypes() {
    }

    private static URI type(String slug) {
        return URI.create(BASE_URL + slug);
    }
}
