package com.lunchmate.backend.common.error;

import lombok.Getter;

/**
 * Business rule failure with a stable code; the web layer maps {@link ErrorCode} to an HTTP status.
 */
@Getter
public class DomainException extends RuntimeException {

    private final ErrorCode code;

    public DomainException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public static DomainException invalidArgument(String message) {
        return new DomainException(ErrorCode.INVALID_ARGUMENT, message);
    }

    public static DomainException notFound(String message) {
        return new DomainException(ErrorCode.NOT_FOUND, message);
    }

    public static DomainException invalidSelection(String message) {
        return new DomainException(ErrorCode.INVALID_SELECTION, message);
    }

    public static DomainException cutoffExpired(String message) {
        return new DomainException(ErrorCode.CUTOFF_EXPIRED, message);
    }

    public static DomainException invalidTransition(Object from, Object to) {
        return new DomainException(ErrorCode.INVALID_STATUS_TRANSITION,
                "status transition " + from + " -> " + to + " is not allowed");
    }

    public static DomainException notEditable(String message) {
        return new DomainException(ErrorCode.ORDER_NOT_EDITABLE, message);
    }

    public static DomainException forbiddenRole(String message) {
        return new DomainException(ErrorCode.FORBIDDEN_ROLE, message);
    }
}
