package com.infomedia.abacox.routingreconciler.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the {@code application/problem+json} answers shared by the fix
 * endpoints and the servlet error page. Every problem names the failing
 * request path and carries a {@code kind} and a {@code timestamp}.
 */
final class ProblemResponses {

    static final String INVALID_REQUEST = "InvalidRequest";
    static final String UNAUTHORIZED = "Unauthorized";
    static final String HTTP_ERROR = "HttpError";

    private ProblemResponses() {
    }

    static ProblemDetail problem(HttpStatusCode status, String kind, String detail, String path) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, detail);
        pd.setType(URI.create(slug("error-" + kind)));
        pd.setTitle(reasonPhrase(status));
        if (path != null) {
            pd.setInstance(URI.create(path));
        }
        pd.setProperty("kind", kind);
        pd.setProperty("timestamp", Instant.now().toString());
        return pd;
    }

    /**
     * Fills in the reconciler fields on a problem that Spring MVC already built.
     */
    static ProblemDetail decorate(ProblemDetail pd, String kind, String path) {
        pd.setType(URI.create(slug("error-" + kind)));
        if (pd.getInstance() == null && path != null) {
            pd.setInstance(URI.create(path));
        }
        pd.setProperty("kind", kind);
        pd.setProperty("timestamp", Instant.now().toString());
        return pd;
    }

    static ResponseEntity<ProblemDetail> respond(ProblemDetail pd) {
        return ResponseEntity
                .status(pd.getStatus())
                .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .body(pd);
    }

    static String kindFor(HttpStatusCode status) {
        if (status.value() == 401) {
            return UNAUTHORIZED;
        }
        return status.is4xxClientError() ? INVALID_REQUEST : HTTP_ERROR;
    }

    /** {@code RangeTooLarge} becomes {@code range-too-large}. */
    static String slug(String input) {
        if (input == null) {
            return "";
        }
        return input.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1-$2")
                .toLowerCase()
                .replaceAll("[^a-z0-9-]+", "-")
                .replaceAll("-{2,}", "-");
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "HTTP " + status.value();
    }
}
