package com.example.battlecore.persistence;

/**
 * Thrown when a content lookup is asked for an id it does not hold.
 */
public class MissingDefinitionException extends RuntimeException {
    
    private final String kind;
    private final String id;
    
    public MissingDefinitionException(String kind, String id) {
        super("Unknown " + kind + " id '" + id + "'");
        this.kind = kind;
        this.id = id;
    }
    
    public String getKind() { return kind; }
    
    public String getId() { return id; }
}
