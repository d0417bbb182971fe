package com.example.battlecore.persistence;

/**
 * Content document could not be read or contains an invalid definition.
 */
public class ContentLoadException extends Exception {
    
    public ContentLoadException(String message) {
        super(message);
    }
    
    public ContentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
