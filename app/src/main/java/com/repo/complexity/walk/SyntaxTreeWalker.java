package com.repo.complexity.walk;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.core.Location;
import com.repo.complexity.syntax.SyntaxEntry;
import com.repo.complexity.syntax.SyntaxTable;
import com.repo.complexity.tree.SyntaxNode;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Depth-first, document-order walker over {@link SyntaxNode} trees.
 *
 * A node whose entry is marked as a new scope is processed in the enclosing
 * scope; its children are then visited inside a scope named after the node's
 * {@code name} attribute, with the parameter count taken from {@code params}.
 */
public class SyntaxTreeWalker implements Walker<SyntaxNode> {

    private final Function<ComplexityConfig, SyntaxTable<SyntaxNode>> tables;

    /**
     * @param tables builds the syntax table for the options of each analysis
     */
    public SyntaxTreeWalker(Function<ComplexityConfig, SyntaxTable<SyntaxNode>> tables) {
        this.tables = tables;
    }

    /**
     * Walker that uses the same table regardless of options.
     */
    public static SyntaxTreeWalker withTable(SyntaxTable<SyntaxNode> table) {
        return new SyntaxTreeWalker(config -> table);
    }

    @Override
    public void walk(SyntaxNode tree, ComplexityConfig config, WalkerCallbacks<SyntaxNode> callbacks) {
        visit(tree, tables.apply(config), callbacks);
    }

    @Override
    public Optional<Location> locationOf(SyntaxNode tree) {
        return tree.getLocation();
    }

    private void visit(SyntaxNode node, SyntaxTable<SyntaxNode> table, WalkerCallbacks<SyntaxNode> callbacks) {
        SyntaxEntry<SyntaxNode> entry = table.entryFor(node);
        callbacks.processNode(node, entry);

        boolean scoped = entry != null && entry.isNewScope();
        if (scoped) {
            callbacks.createScope(node.text("name"), node.location(), parameterCount(node));
        }

        for (SyntaxNode child : node.children()) {
            visit(child, table, callbacks);
        }

        if (scoped) {
            callbacks.popScope();
        }
    }

    static int parameterCount(SyntaxNode node) {
        Object params = node.attribute("params");
        if (params instanceof Number) {
            return ((Number) params).intValue();
        }
        if (params instanceof List) {
            return ((List<?>) params).size();
        }
        return 0;
    }
}
