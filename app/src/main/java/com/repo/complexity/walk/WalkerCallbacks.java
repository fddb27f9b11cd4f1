package com.repo.complexity.walk;

import com.repo.complexity.core.Location;
import com.repo.complexity.syntax.SyntaxEntry;

/**
 * Events a walker reports while traversing a tree.
 */
public interface WalkerCallbacks<N> {

    void processNode(N node, SyntaxEntry<N> entry);

    /**
     * Enter a function scope. Subsequent nodes count towards it until the
     * matching {@link #popScope()}.
     *
     * @param name           function name, or null for anonymous functions
     * @param location       source span, or null if unknown
     * @param parameterCount declared parameters
     */
    void createScope(String name, Location location, int parameterCount);

    void popScope();
}
