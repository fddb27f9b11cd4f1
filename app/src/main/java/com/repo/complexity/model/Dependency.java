package com.repo.complexity.model;

/**
 * A module dependency found in the source, e.g. a CommonJS require call.
 */
public record Dependency(
        /** Line of the call that introduced the dependency */
        int line,

        /** Module path as written in the source, or "* dynamic dependency *" */
        String path,

        /** Module system (e.g., "CommonJS", "AMD") */
        String type) {
}
