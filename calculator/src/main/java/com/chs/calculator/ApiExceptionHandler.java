package com.chs.calculator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.Comparator;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps every failure to a {@code {"detail": "..."}} body.
 *
 * <ul>
 *   <li>missing, null or non-numeric operands, unreadable or non-JSON bodies: 422</li>
 *   <li>{@link DivisionByZeroException}: 400</li>
 *   <li>unknown route: 404, wrong method: 405</li>
 *   <li>anything else: 500 with a fixed message; the cause is only logged</li>
 * </ul>
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    static final String NOT_FOUND = "Endpoint not found";
    static final String METHOD_NOT_ALLOWED = "Method not allowed";
    static final String INTERNAL_ERROR = "Internal server error";

    private static final String NOT_JSON = "Request body must be JSON";
    private static final String NOT_A_NUMBER = "Input should be a valid number";

    @ExceptionHandler(DivisionByZeroException.class)
    public ResponseEntity<ErrorResponse> handleDivisionByZero(DivisionByZeroException ex, WebRequest request) {
        log.warn("{}: {}", request.getDescription(false), ex.getMessage());
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, WebRequest request) {
        log.error("Unhandled error on {}", request.getDescription(false), ex);
        return ResponseEntity.internalServerError().contentType(MediaType.APPLICATION_JSON)
                .body(new ErrorResponse(INTERNAL_ERROR));
    }

    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return handleExceptionInternal(ex, new ErrorResponse(detail), headers,
                HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        return handleExceptionInternal(ex, new ErrorResponse(describeUnreadable(ex)), headers,
                HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex,
            HttpHeaders headers, HttpStatusCode status, WebRequest request) {
        return handleExceptionInternal(ex, new ErrorResponse(NOT_JSON), headers,
                HttpStatus.UNPROCESSABLE_ENTITY, request);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
            HttpStatusCode statusCode, WebRequest request) {
        ErrorResponse error = body instanceof ErrorResponse
                ? (ErrorResponse) body
                : new ErrorResponse(defaultDetail(statusCode));
        if (statusCode.is5xxServerError()) {
            log.error("Request {} failed", request.getDescription(false), ex);
        } else {
            log.warn("{} -> {}: {}", request.getDescription(false), statusCode.value(), error.getDetail());
        }
        // error bodies are JSON whatever the client asked for in Accept
        HttpHeaders jsonHeaders = new HttpHeaders();
        jsonHeaders.putAll(headers);
        jsonHeaders.setContentType(MediaType.APPLICATION_JSON);
        return super.handleExceptionInternal(ex, error, jsonHeaders, statusCode, request);
    }

    private static String describeUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof MismatchedInputException) {
            String field = ((MismatchedInputException) cause).getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining("."));
            return field.isEmpty() ? "Request body must be a JSON object" : field + ": " + NOT_A_NUMBER;
        }
        if (cause instanceof JsonProcessingException) {
            return "Request body is not valid JSON";
        }
        return "Request body is required";
    }

    private static String defaultDetail(HttpStatusCode status) {
        return switch (status.value()) {
            case 404 -> NOT_FOUND;
            case 405 -> METHOD_NOT_ALLOWED;
            case 406 -> "Not acceptable";
            default -> status.is5xxServerError() ? INTERNAL_ERROR : "Bad request";
        };
    }
}
