package com.example.battlecore.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to one kind of content definition, keyed by string id.
 *
 * @param <T> definition type
 */
public interface DefinitionLookup<T> {
    
    /**
     * @throws MissingDefinitionException if no definition has this id
     */
    T get(String id);
    
    Optional<T> find(String id);
    
    /**
     * Every definition, in the order it was registered.
     */
    List<T> all();
    
    default boolean contains(String id) {
        return find(id).isPresent();
    }
}
