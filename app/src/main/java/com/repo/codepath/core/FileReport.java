package com.repo.codepath.core;

import com.repo.codepath.rules.Violation;

import java.util.List;

/**
 * Lint result for a single file.
 */
public record FileReport(
        /** Path of the analyzed tree dump */
        String filePath,

        /** Number of code paths, the program included */
        int codePathCount,

        /** Number of functions, class field initializers and static blocks */
        int functionCount,

        /** Sum of the complexities of all units */
        int totalComplexity,

        /** Highest complexity of any single unit */
        int maxComplexity,

        /** Names of units above the complexity limit */
        List<String> complexFunctions,

        /** Number of unreachable code ranges */
        int unreachableCount,

        /** Violations of all enabled rules, in source order */
        List<Violation> violations) {

    public boolean isClean() {
        return violations.isEmpty();
    }
}
