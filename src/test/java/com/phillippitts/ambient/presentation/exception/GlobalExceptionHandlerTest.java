package com.phillippitts.ambient.presentation.exception;

import com.phillippitts.ambient.exception.InvalidFilterException;
import com.phillippitts.ambient.exception.InvalidPatternException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesInvalidPatternReturns400WithField() {
        InvalidPatternException ex = new InvalidPatternException("windowPattern", "Invalid windowPattern for focus");

        ResponseEntity<?> response = handler.handleInvalidConfiguration(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidPatternException")
                .contains("Invalid windowPattern")
                .contains("Invalid windowPattern for focus");
    }

    @Test
    void verifiesInvalidFilterUsesItsOwnErrorCode() {
        ResponseEntity<?> response = handler.handleInvalidConfiguration(
                new InvalidFilterException("app", "app must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("InvalidFilterException");
    }

    @Test
    void verifiesMissingParameterReturns400() {
        ResponseEntity<?> response = handler.handleInvalidParameter(
                new MissingServletRequestParameterException("query", "String"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("ValidationFailed").contains("query");
    }

    @Test
    void verifiesUnreadableBodyDoesNotEchoParserDetails() {
        HttpMessageNotReadableException ex = new HttpMessageNotReadableException(
                "JSON parse error at line 3", mock(HttpInputMessage.class));

        ResponseEntity<?> response = handler.handleUnreadable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("MalformedRequest")
                .doesNotContain("line 3");
    }

    @Test
    void verifiesUnexpectedErrorReturns500WithoutLeakingMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret internals");
    }
}
