package com.repo.complexity.core;

/**
 * Source span of a node, in 1-based line numbers.
 */
public record Location(
        int startLine,
        int endLine) {

    /** Number of physical lines covered, inclusive of both ends */
    public int physicalLines() {
        return endLine - startLine + 1;
    }
}
