package com.slowlog.analyzer;

/**
 * Base of the analyzer's unchecked exceptions.
 */
public class SlowLogException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SlowLogException(String message) {
        super(message);
    }

    public SlowLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
