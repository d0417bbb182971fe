package com.example.battlecore.combat;

/**
 * A battle could not be set up: a referenced enemy, group, summon or party member does not exist,
 * or there is no player yet.
 */
public class FactoryException extends Exception {
    
    public FactoryException(String message) {
        super(message);
    }
    
    public FactoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
