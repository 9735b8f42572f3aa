package com.clausekit.path;

public class KeyPathException extends RuntimeException {
    public KeyPathException(String message) {
        super(message);
    }

    public KeyPathException(KeyPath path, String message) {
        super(message + " (path " + path + ")");
    }
}
