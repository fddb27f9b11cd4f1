package com.repo.complexity.syntax;

/**
 * Maps a node to the entry describing its metric contributions.
 */
@FunctionalInterface
public interface SyntaxTable<N> {

    /**
     * @return the entry for this node's kind, or null if the kind contributes nothing
     */
    SyntaxEntry<N> entryFor(N node);
}
