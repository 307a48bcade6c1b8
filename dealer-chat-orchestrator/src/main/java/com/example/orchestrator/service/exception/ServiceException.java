package com.example.orchestrator.service.exception;

import org.springframework.http.HttpStatus;

public class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ServiceException(HttpStatus status, String message) {
        this(status, message, null, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    public ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public static ServiceException notFound(String message) {
        return new ServiceException(HttpStatus.NOT_FOUND, message, "not_found");
    }

    public static ServiceException badRequest(String message) {
        return new ServiceException(HttpStatus.BAD_REQUEST, message, "bad_request");
    }

    /** A request that does not fit the conversation's current status. */
    public static ServiceException invalidTransition(String message) {
        return new ServiceException(HttpStatus.CONFLICT, message, "invalid_transition");
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
