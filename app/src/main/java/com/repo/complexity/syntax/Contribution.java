package com.repo.complexity.syntax;

/**
 * Amount a node adds to a counter (logical lines or cyclomatic complexity).
 * Either a constant or computed from the node's shape.
 */
@FunctionalInterface
public interface Contribution<N> {

    /**
     * @return the amount to add, or null for no contribution
     */
    Integer amount(N node);

    static <N> Contribution<N> constant(int amount) {
        return node -> amount;
    }
}
