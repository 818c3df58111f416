package com.driveflow.crm.exception;

/** Machine-readable error kinds returned in every error body. */
public enum ErrorKind {
    INVALID_ARGUMENT, UNAUTHORIZED, FORBIDDEN, NOT_FOUND, CONFLICT, INTERNAL
}
