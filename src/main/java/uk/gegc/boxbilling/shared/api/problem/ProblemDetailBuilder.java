package uk.gegc.boxbilling.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.context.request.WebRequest;

import java.net.URI;
import java.time.Instant;

/**
 * Builds RFC 7807 bodies with a type from {@link ErrorTypes}, a title, the request path as
 * {@code instance} and a {@code timestamp} property.
 */
public final class ProblemDetailBuilder {

    private static final String URI_PREFIX = "uri=";

    private ProblemDetailBuilder() {
    }

    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        return build(status, type, title, detail, request == null ? null : request.getRequestURI());
    }

    /**
     * Variant for the {@code ResponseEntityExceptionHandler} overrides, which only get a {@link WebRequest}.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       WebRequest request) {
        String path = null;
        if (request != null) {
            String description = request.getDescription(false);
            path = description.startsWith(URI_PREFIX) ? description.substring(URI_PREFIX.length()) : description;
        }
        return build(status, type, title, detail, path);
    }

    private static ProblemDetail build(HttpStatus status, URI type, String title, String detail, String path) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (path != null && !path.isEmpty()) {
            problem.setInstance(URI.create(path));
        }
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
