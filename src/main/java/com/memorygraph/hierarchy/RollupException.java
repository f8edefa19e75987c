package com.memorygraph.hierarchy;

public class RollupException extends Exception {

    public RollupException(String message, Throwable cause) {
        super(message, cause);
    }

    public RollupException(String message) {
        super(message);
    }
}
