package com.infomedia.abacox.routingreconciler.controller;

import com.infomedia.abacox.routingreconciler.exception.ReconciliationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@RestControllerAdvice
@Log4j2
public class FixExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ProblemDetail> handleReconciliationException(ReconciliationException e, HttpServletRequest request) {
        if (e.isInputError()) {
            log.warn("Rejected {}: {} | {}", request.getRequestURI(), e.getKind(), e.getMessage());
        } else {
            log.error("Operation failed on {}: {} | {}", request.getRequestURI(), e.getKind(), e.getMessage(), e);
        }

        return ProblemResponses.respond(
                ProblemResponses.problem(e.getStatus(), e.getKind(), e.getMessage(), request.getRequestURI()));
    }

    /**
     * Unreadable bodies, missing fields and the other MVC failures get a {@code kind} too.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, @Nullable Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        String path = requestPath(request);
        if (body instanceof ProblemDetail) {
            String kind = ProblemResponses.kindFor(statusCode);
            ProblemResponses.decorate((ProblemDetail) body, kind, path);
            log.warn("Rejected {}: {} | {}", path, kind, ex.getMessage());
        }
        return super.handleExceptionInternal(ex, body, headers, statusCode, request);
    }

    private static String requestPath(WebRequest request) {
        if (request instanceof NativeWebRequest) {
            HttpServletRequest servletRequest = ((NativeWebRequest) request).getNativeRequest(HttpServletRequest.class);
            if (servletRequest != null) {
                return servletRequest.getRequestURI();
            }
        }
        return null;
    }
}
