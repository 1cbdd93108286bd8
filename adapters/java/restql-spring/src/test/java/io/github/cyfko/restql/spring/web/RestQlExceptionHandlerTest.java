package io.github.cyfko.restql.spring.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.mock.http.MockHttpInputMessage;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RestQlExceptionHandlerTest {

    @Test
    @DisplayName("An unreadable body is answered 400 with the errors payload")
    void unreadableBody() {
        // Given
        HttpMessageNotReadableException failure = new HttpMessageNotReadableException(
                "JSON parse error", new MockHttpInputMessage(new byte[0]));

        // When
        ResponseEntity<Object> response = new RestQlExceptionHandler().handleUnreadableBody(failure);

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("errors", RestQlExceptionHandler.MALFORMED_BODY_MESSAGE), response.getBody());
    }
}
