package com.repo.codepath.codepath;

/**
 * The kind of unit a code path was created for.
 */
public enum CodePathOrigin {
    PROGRAM,
    FUNCTION,
    CLASS_FIELD_INITIALIZER,
    CLASS_STATIC_BLOCK
}
