package com.slowlog.analyzer;

/**
 * Reading one log source failed. Other sources of the same run are not affected.
 */
public class FileParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String source;

    public FileParseException(String source, Throwable cause) {
        super("Failed to parse " + source + ": " + cause.getMessage(), cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
