package com.driveflow.crm.exception;

/**
 * Rejected input: malformed identifiers, out-of-range paging, mistakes that do
 * not belong to the lesson's template. Mapped to 400.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
