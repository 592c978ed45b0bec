package com.flagship.split_ledger.exception;

import com.flagship.split_ledger.group.GroupNotFoundException;
import com.flagship.split_ledger.group.NotAGroupMemberException;
import com.flagship.split_ledger.ledger.UnbalancedLedgerException;
import com.flagship.split_ledger.money.InvalidAmountException;
import com.flagship.split_ledger.settlement.DuplicateReferenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses with an {@link ApiError} body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read", null);
    }

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<ApiError> handleInvalidAmount(InvalidAmountException e) {
        log.warn("Invalid amount: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Amount", e.getMessage(), null);
    }

    @ExceptionHandler(GroupNotFoundException.class)
    public ResponseEntity<ApiError> handleGroupNotFound(GroupNotFoundException e) {
        log.warn("Group not found: groupId={}", e.getGroupId());
        return respond(HttpStatus.NOT_FOUND, "Group Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(NotAGroupMemberException.class)
    public ResponseEntity<ApiError> handleNotAGroupMember(NotAGroupMemberException e) {
        log.warn("Not a group member: groupId={}, member={}", e.getGroupId(), e.getMember());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Not A Group Member", e.getMessage(),
            Map.of("member", e.getMember().getAddress()));
    }

    @ExceptionHandler(DuplicateReferenceException.class)
    public ResponseEntity<ApiError> handleDuplicateReference(DuplicateReferenceException e) {
        log.info("Duplicate transfer reference: {}", e.getExternalRef());
        return respond(HttpStatus.CONFLICT, "Duplicate Reference", e.getMessage(),
            Map.of("external_ref", e.getExternalRef()));
    }

    @ExceptionHandler(UnbalancedLedgerException.class)
    public ResponseEntity<ApiError> handleUnbalancedLedger(UnbalancedLedgerException e) {
        log.error("Ledger out of balance: groupId={}, total={}", e.getGroupId(), e.getTotal(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Ledger Inconsistent",
            "Group balances do not sum to zero", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                                    Map<String, String> details) {
        return ResponseEntity.status(status).body(ApiError.of(status, error, message, details));
    }
}
