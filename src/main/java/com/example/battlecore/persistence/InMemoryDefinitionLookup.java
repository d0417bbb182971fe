package com.example.battlecore.persistence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Insertion-ordered map-backed lookup. Registering an id twice replaces the earlier definition in place.
 */
public class InMemoryDefinitionLookup<T> implements DefinitionLookup<T> {
    
    private final String kind;
    private final Function<T, String> idOf;
    private final Map<String, T> byId = new LinkedHashMap<>();
    
    public InMemoryDefinitionLookup(String kind, Function<T, String> idOf) {
        this.kind = kind;
        this.idOf = idOf;
    }
    
    public InMemoryDefinitionLookup<T> register(T definition) {
        String id = idOf.apply(definition);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(kind + " definition has no id");
        }
        byId.put(id, definition);
        return this;
    }
    
    @Override
    public T get(String id) {
        T def = byId.get(id);
        if (def == null) {
            throw new MissingDefinitionException(kind, id);
        }
        return def;
    }
    
    @Override
    public Optional<T> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }
    
    @Override
    public List<T> all() {
        return Collections.unmodifiableList(new ArrayList<>(byId.values()));
    }
    
    public int size() {
        return byId.size();
    }
    
    public String getKind() {
        return kind;
    }
}
