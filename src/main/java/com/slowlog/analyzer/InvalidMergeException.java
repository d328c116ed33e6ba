package com.slowlog.analyzer;

/**
 * A merge was requested with unusable inputs: too few results, a missing result or one without record data.
 */
public class InvalidMergeException extends SlowLogException {

    private static final long serialVersionUID = 1L;

    public InvalidMergeException(String message) {
        super(message);
    }
}
