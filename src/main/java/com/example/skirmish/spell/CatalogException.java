package com.example.skirmish.spell;

/**
 * Raised when a spell or item catalog resource is missing or malformed.
 */
public class CatalogException extends RuntimeException {
    
    public CatalogException(String message) {
        super(message);
    }
    
    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
