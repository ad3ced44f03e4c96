package com.repo.codepath.codepath;

/**
 * Produces {@code prefix1}, {@code prefix2}, ...
 */
final class IdGenerator {

    private final String prefix;
    private int n;

    IdGenerator(String prefix) {
        this.prefix = prefix;
    }

    String next() {
        n++;
        return prefix + n;
    }
}
