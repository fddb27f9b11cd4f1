package com.repo.complexity.walk;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.core.Location;

import java.util.Optional;

/**
 * Traverses a syntax tree on behalf of the analyzer.
 * Implementations decide the traversal strategy and which syntax table applies.
 */
public interface Walker<N> {

    /**
     * Visit every node of the tree in document order, reporting each through
     * the callbacks. Scope enter/exit calls must be properly nested and bracket
     * exactly the nodes of that scope.
     *
     * @param tree      root of the tree
     * @param config    analysis options, for syntax tables that read them
     * @param callbacks sink for node and scope events
     */
    void walk(N tree, ComplexityConfig config, WalkerCallbacks<N> callbacks);

    /**
     * Location of the whole tree, used for the aggregate's line and physical SLOC.
     * Default is none.
     */
    default Optional<Location> locationOf(N tree) {
        return Optional.empty();
    }
}
