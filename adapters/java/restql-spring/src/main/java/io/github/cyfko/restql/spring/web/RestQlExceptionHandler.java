package io.github.cyfko.restql.spring.web;

import io.github.cyfko.restql.core.dispatch.ActionResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.logging.Logger;

/**
 * Failures raised by Spring MVC before a resource action runs, answered with the same
 * {@code {"errors": ...}} payload as the actions themselves.
 */
@RestControllerAdvice(assignableTypes = ResourceEndpoint.class)
public class RestQlExceptionHandler {

    private static final Logger logger = Logger.getLogger(RestQlExceptionHandler.class.getName());

    static final String MALFORMED_BODY_MESSAGE = "Request body is not a valid JSON object";

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadableBody(HttpMessageNotReadableException e) {
        logger.fine(() -> "Rejected unreadable request body: " + e.getMessage());
        return ResourceEndpoint.toResponseEntity(
                ActionResponse.error(ActionResponse.BAD_REQUEST, MALFORMED_BODY_MESSAGE), null);
    }
}
