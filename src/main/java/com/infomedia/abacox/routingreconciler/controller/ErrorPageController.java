package com.infomedia.abacox.routingreconciler.controller;

import io.swagger.v3.oas.annotations.Hidden;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.web.servlet.error.ErrorAttributes;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.ServletWebRequest;

/**
 * Answers the servlet error dispatch, e.g. the 401 sent by
 * {@link com.infomedia.abacox.routingreconciler.config.ApiTokenFilter},
 * with the same problem body as the fix endpoints.
 */
@Hidden
@RestController
@RequiredArgsConstructor
@Log4j2
@RequestMapping("${server.error.path:${error.path:/error}}")
public class ErrorPageController implements ErrorController {

    private final ErrorAttributes errorAttributes;

    @RequestMapping
    public ResponseEntity<ProblemDetail> error(HttpServletRequest request) {
        HttpStatus status = statusOf(request);
        String path = (String) request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        Throwable error = errorAttributes.getError(new ServletWebRequest(request));
        if (error != null && status.is5xxServerError()) {
            log.error("Unhandled error on {}: {}", path, error.getMessage(), error);
        }

        ProblemDetail pd = ProblemResponses.problem(status, ProblemResponses.kindFor(status),
                detailOf(request, error, status), path != null ? path : request.getRequestURI());
        return ProblemResponses.respond(pd);
    }

    private static HttpStatus statusOf(HttpServletRequest request) {
        Object code = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        HttpStatus status = code instanceof Integer ? HttpStatus.resolve((Integer) code) : null;
        return status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String detailOf(HttpServletRequest request, Throwable error, HttpStatus status) {
        if (error != null && error.getMessage() != null) {
            return error.getMessage();
        }
        Object message = request.getAttribute(RequestDispatcher.ERROR_MESSAGE);
        if (message instanceof String && !((String) message).isBlank()) {
            return (String) message;
        }
        return status.getReasonPhrase();
    }
}
