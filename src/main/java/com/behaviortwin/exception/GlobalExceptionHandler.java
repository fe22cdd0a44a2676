package com.behaviortwin.exception;

import com.behaviortwin.config.RequestIdFilter;
import com.behaviortwin.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more fields failed validation", request, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations()
            .stream()
            .map(cv -> ApiError.FieldError.builder()
                .field(cv.getPropertyPath().toString())
                .rejectedValue(cv.getInvalidValue())
                .message(cv.getMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more parameters failed validation", request, fieldErrors);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(
            HandlerMethodValidationException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getAllValidationResults()
            .stream()
            .flatMap(result -> result.getResolvableErrors().stream()
                .map(err -> ApiError.FieldError.builder()
                    .field(result.getMethodParameter().getParameterName())
                    .rejectedValue(result.getArgument())
                    .message(err.getDefaultMessage())
                    .build()))
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more parameters failed validation", request, fieldErrors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be parsed", request, null);
    }

    @ExceptionHandler({NoBaselineDataException.class, NoBehaviorDataException.class,
                       NoWebIntelException.class, BehaviorDataNotFoundException.class})
    public ResponseEntity<ApiError> handleNoData(
            BehaviorTwinException ex, HttpServletRequest request) {
        log.warn("No data | code={} | {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getErrorCode(), ex.getMessage(),
                     request, null);
    }

    @ExceptionHandler(NoMatchingSegmentsException.class)
    public ResponseEntity<ApiError> handleNoMatchingSegments(
            NoMatchingSegmentsException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "No Matching Segments", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(BehaviorDataReadException.class)
    public ResponseEntity<ApiError> handleReadFailure(
            BehaviorDataReadException ex, HttpServletRequest request) {
        log.error("Behavior data unreadable: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Data Source Error", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String code, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .success(false)
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(RequestIdFilter.requestIdOf(request))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
