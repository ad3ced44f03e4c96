package com.repo.codepath.tree;

/**
 * Raised when a tree dump cannot be read.
 */
public class TreeFormatException extends RuntimeException {

    private final int offset;

    public TreeFormatException(String message, int offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
