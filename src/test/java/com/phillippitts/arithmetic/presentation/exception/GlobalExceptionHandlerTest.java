package com.phillippitts.arithmetic.presentation.exception;

import com.phillippitts.arithmetic.exception.InvalidOperandException;
import com.phillippitts.arithmetic.exception.UndefinedOperationException;
import com.phillippitts.arithmetic.exception.UnsupportedOperatorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidOperandReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEvaluationFailure(new InvalidOperandException("b", Double.NaN));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidOperandException");
        assertThat(response.getBody().message()).isEqualTo("Invalid operand");
        assertThat(response.getBody().details()).contains("'b'").contains("finite");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void divisionByZeroReturns400WithDistinctMessage() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEvaluationFailure(UndefinedOperationException.divisionByZero());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("UndefinedOperationException");
        assertThat(response.getBody().message()).isEqualTo("Division by zero");
    }

    @Test
    void unsupportedOperatorReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleEvaluationFailure(new UnsupportedOperatorException("mod"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("Unsupported operator");
        assertThat(response.getBody().details()).contains("'mod'");
    }

    @Test
    void missingParameterReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleMissingParameter(new MissingServletRequestParameterException("a", "double"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).contains("'a'");
    }

    @Test
    void springErrorResponsesKeepTheirStatus() {
        ResponseEntity<GlobalExceptionHandler.ApiError> notFound =
                handler.handleUnexpected(new NoResourceFoundException(HttpMethod.GET, "nope"));
        ResponseEntity<GlobalExceptionHandler.ApiError> notAllowed =
                handler.handleUnexpected(new HttpRequestMethodNotSupportedException("DELETE"));

        assertThat(notFound.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(notAllowed.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
        assertThat(notAllowed.getBody().message()).isEqualTo("Method Not Allowed");
    }

    @Test
    void unexpectedErrorReturns500WithoutLeakingDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret internal state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret internal state");
    }
}
