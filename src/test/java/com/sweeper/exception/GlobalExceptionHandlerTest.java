package com.sweeper.exception;

import com.sweeper.model.ValidationResult;
import com.sweeper.model.ValidationRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should return 404 NOT_FOUND for GameNotFoundException")
    void shouldHandle404ForMissingGame() {
        ResponseEntity<Map<String, String>> response = handler.handleGameNotFound(new GameNotFoundException("abc"));

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertEquals("Game not found: abc", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 422 with the failed rule for ValidationFailedException")
    void shouldHandle422ForRejectedLayout() {
        var ex = new ValidationFailedException(ValidationResult.failure(ValidationRule.ORTHOGONAL_PAIR));

        ResponseEntity<Map<String, String>> response = handler.handleLayoutValidation(ex);

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("ORTHOGONAL_PAIR", response.getBody().get("rule"));
        assertEquals(ValidationRule.ORTHOGONAL_PAIR.getMessage(), response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 400 BAD_REQUEST for ConfigurationException")
    void shouldHandle400ForConfiguration() {
        var ex = new ConfigurationException("Not enough free cells");

        ResponseEntity<Map<String, String>> response = handler.handleIllegalArgument(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Not enough free cells", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 400 BAD_REQUEST for InvalidCoordinateException")
    void shouldHandle400ForCoordinate() {
        var ex = new InvalidCoordinateException(9, 0, 8, 8);

        ResponseEntity<Map<String, String>> response = handler.handleIllegalArgument(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertTrue(response.getBody().get("error").contains("(9,0)"));
    }

    @Test
    @DisplayName("should return 409 CONFLICT for IllegalOperationException")
    void shouldHandle409ForIllegalOperation() {
        var ex = new IllegalOperationException("Cannot reveal: game is already WON");

        ResponseEntity<Map<String, String>> response = handler.handleIllegalState(ex);

        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("Cannot reveal: game is already WON", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should not fail on a null message")
    void shouldHandleNullMessage() {
        ResponseEntity<Map<String, String>> response = handler.handleIllegalState(new IllegalStateException());

        assertEquals("", response.getBody().get("error"));
    }

    @Test
    @DisplayName("should return 500 INTERNAL_SERVER_ERROR for generic Exception")
    void shouldHandle500ForGenericException() {
        ResponseEntity<Map<String, String>> response = handler.handleGeneral(new NullPointerException("cell"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("An unexpected error occurred", response.getBody().get("error"),
                "Should not leak details to client");
    }

    @Test
    @DisplayName("should return 400 with field errors for MethodArgumentNotValidException")
    @SuppressWarnings("unchecked")
    void shouldHandle400ForValidationErrors() throws NoSuchMethodException {
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "rows", "Rows must be at least 1"));
        bindingResult.addError(new FieldError("request", "treasures", "At least one treasure is required"));

        MethodParameter methodParameter = new MethodParameter(
                GlobalExceptionHandlerTest.class.getDeclaredMethod("shouldHandle400ForValidationErrors"), -1);

        MethodArgumentNotValidException ex = new MethodArgumentNotValidException(methodParameter, bindingResult);

        ResponseEntity<Map<String, Object>> response = handler.handleValidation(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Validation failed", response.getBody().get("error"));
        Map<String, String> details = (Map<String, String>) response.getBody().get("details");
        assertEquals("Rows must be at least 1", details.get("rows"));
        assertEquals("At least one treasure is required", details.get("treasures"));
    }

    @Test
    @DisplayName("should return 404 NOT_FOUND for NoResourceFoundException")
    void shouldHandle404ForNoResourceFound() {
        var ex = new NoResourceFoundException(HttpMethod.GET, "api/unknown", null);

        ResponseEntity<Map<String, String>> response = handler.handleNoResourceFound(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody().get("error"));
    }
}
