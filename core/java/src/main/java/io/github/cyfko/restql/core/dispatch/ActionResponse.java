package io.github.cyfko.restql.core.dispatch;

import java.util.Collections;
import java.util.Map;

/**
 * Outcome of an action: HTTP status, serializable payload and, for {@code create}, the key of
 * the new record used to build its location.
 *
 * @param status      HTTP status code
 * @param body        payload, {@code null} for {@code 204}
 * @param locationKey key of the created record, {@code null} otherwise
 */
public record ActionResponse(int status, Object body, String locationKey) {

    public static final int OK = 200;
    public static final int CREATED = 201;
    public static final int NO_CONTENT = 204;
    public static final int BAD_REQUEST = 400;
    public static final int NOT_FOUND = 404;
    public static final int UNPROCESSABLE_ENTITY = 422;
    public static final int INTERNAL_SERVER_ERROR = 500;

    public static ActionResponse ok(String rootKey, Object payload) {
        return new ActionResponse(OK, Collections.singletonMap(rootKey, payload), null);
    }

    public static ActionResponse created(String rootKey, Object payload, String locationKey) {
        return new ActionResponse(CREATED, Collections.singletonMap(rootKey, payload), locationKey);
    }

    public static ActionResponse noContent() {
        return new ActionResponse(NO_CONTENT, null, null);
    }

    /**
     * @param status error status
     * @param errors message, or field name to messages
     * @return {@code {"errors": errors}}
     */
    public static ActionResponse error(int status, Object errors) {
        return new ActionResponse(status, Map.of("errors", errors), null);
    }

    public boolean isError() {
        return status >= BAD_REQUEST;
    }
}
