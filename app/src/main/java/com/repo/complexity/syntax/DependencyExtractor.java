package com.repo.complexity.syntax;

/**
 * Pulls dependencies out of a node.
 * The engine does not interpret the result: a collection is merged element-wise,
 * any other non-null value is added as a single dependency.
 */
@FunctionalInterface
public interface DependencyExtractor<N> {

    /**
     * @param node  node being visited
     * @param clear true until the first dependency-bearing node of the analysis
     *              has been processed
     */
    Object extract(N node, boolean clear);
}
