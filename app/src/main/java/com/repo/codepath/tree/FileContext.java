package com.repo.codepath.tree;

import java.util.*;
import java.util.function.Supplier;

/**
 * State of one file's lint pass. Components register per-file objects here
 * (the code path analyzer, for one) and rules retrieve them later.
 */
public class FileContext {

    private final String fileName;
    private final SyntaxNode root;
    private final Map<Class<?>, Object> slots = new HashMap<>();

    public FileContext(String fileName, SyntaxNode root) {
        this.fileName = fileName;
        this.root = root;
    }

    public String fileName() {
        return fileName;
    }

    public SyntaxNode root() {
        return root;
    }

    /**
     * Returns the object stored under the given type, creating it on first use.
     */
    public <T> T retrieve(Class<T> type, Supplier<T> factory) {
        Object existing = slots.get(type);
        if (existing == null) {
            T created = factory.get();
            slots.put(type, created);
            return created;
        }
        return type.cast(existing);
    }

    public <T> Optional<T> find(Class<T> type) {
        return Optional.ofNullable(slots.get(type)).map(type::cast);
    }

    public <T> void register(Class<T> type, T value) {
        slots.put(type, value);
    }
}
