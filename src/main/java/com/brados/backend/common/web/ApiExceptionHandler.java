package com.brados.backend.common.web;

import com.brados.backend.common.error.ApiException;
import com.brados.backend.common.error.ConflictException;
import com.brados.backend.common.error.InvalidTransitionException;
import com.brados.backend.common.error.NotFoundException;
import com.brados.backend.common.error.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the core's rejections to HTTP:
 * - 400: ValidationException (incl. invalid profile / performance), InvalidTransitionException,
 *        bean validation, unreadable or mistyped input
 * - 404: NotFoundException
 * - 409: ConflictException, stale optimistic-lock writes
 * - 500: anything else
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // ===== 400 =====

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(ValidationException e, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, e, req);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiErrorResponse> handleTransition(InvalidTransitionException e, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, e, req);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleBeanValidation(MethodArgumentNotValidException e,
                                                                 HttpServletRequest req) {
        var fieldErrors = e.getBindingResult().getFieldErrors();
        String msg = fieldErrors.isEmpty()
                ? "VALIDATION_FAILED"
                : fieldErrors.get(0).getField() + " " + fieldErrors.get(0).getDefaultMessage();
        return ResponseEntity.badRequest()
                .body(new ApiErrorResponse(ValidationException.CODE, msg, RequestIdFilter.current(req)));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ApiErrorResponse> handleUnreadable(Exception e, HttpServletRequest req) {
        return ResponseEntity.badRequest()
                .body(new ApiErrorResponse(ValidationException.CODE, "Malformed request", RequestIdFilter.current(req)));
    }

    // ===== 404 =====

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, e, req);
    }

    // ===== 409 =====

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleConflict(ConflictException e, HttpServletRequest req) {
        return respond(HttpStatus.CONFLICT, e, req);
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiErrorResponse> handleStaleWrite(ObjectOptimisticLockingFailureException e,
                                                             HttpServletRequest req) {
        log.info("stale_write entity={} id={}", e.getPersistentClassName(), e.getIdentifier());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ApiErrorResponse(ConflictException.CODE,
                        "Entity was modified concurrently, reload and retry",
                        RequestIdFilter.current(req)));
    }

    // ===== 500 =====

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled_error path={}", req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiErrorResponse("INTERNAL_ERROR", e.getMessage(), RequestIdFilter.current(req)));
    }

    // ===== helpers =====

    private static ResponseEntity<ApiErrorResponse> respond(HttpStatus status, ApiException e, HttpServletRequest req) {
        return ResponseEntity.status(status)
                .body(new ApiErrorResponse(e.code(), safeMsgOrCode(e), RequestIdFilter.current(req)));
    }

    private static String safeMsgOrCode(ApiException e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.code() : m;
    }
}
