package com.lunchmate.backend.common.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_SELECTION(HttpStatus.UNPROCESSABLE_ENTITY),
    CUTOFF_EXPIRED(HttpStatus.CONFLICT),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT),
    ORDER_NOT_EDITABLE(HttpStatus.CONFLICT),
    FORBIDDEN_ROLE(HttpStatus.FORBIDDEN);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
