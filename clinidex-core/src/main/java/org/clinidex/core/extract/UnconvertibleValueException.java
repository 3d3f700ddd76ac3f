package org.clinidex.core.extract;

/**
 * Raised by {@link ValueConverter} for a present value that its rule's kind cannot read.
 */
class UnconvertibleValueException extends RuntimeException {

    UnconvertibleValueException(String message) {
        super(message);
    }

    UnconvertibleValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
