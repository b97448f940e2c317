package com.mead.oncology.exception;

import lombok.Getter;

/**
 * Consultation input rejected before matching. Recoverable: the caller can correct the named field.
 */
@Getter
public class InvalidInputException extends IllegalArgumentException {

    private final String field;

    public InvalidInputException(String field, String message) {
        super(message);
        this.field = field;
    }
}
