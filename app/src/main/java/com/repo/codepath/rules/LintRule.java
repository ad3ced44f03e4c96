package com.repo.codepath.rules;

import com.repo.codepath.tree.FileContext;

import java.util.List;

/**
 * A check run once a file's traversal has completed.
 */
public interface LintRule {

    /**
     * Identifier used in configuration and reports (e.g., "complexity").
     */
    String name();

    List<Violation> check(FileContext context);
}
