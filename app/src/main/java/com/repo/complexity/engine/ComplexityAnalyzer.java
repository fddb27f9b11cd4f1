package com.repo.complexity.engine;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.core.Location;
import com.repo.complexity.model.ModuleReport;
import com.repo.complexity.walk.Walker;

/**
 * Computes logical SLOC, cyclomatic complexity, Halstead metrics and the
 * maintainability index for one syntax tree.
 *
 * The analyzer is stateless; every call builds its own {@link AnalysisContext},
 * so one instance can serve concurrent analyses.
 */
public class ComplexityAnalyzer {

    /**
     * Analyse a tree with default options.
     */
    public <N> ModuleReport analyse(N tree, Walker<N> walker) {
        return analyse(tree, walker, null);
    }

    /**
     * Analyse a tree.
     *
     * @param tree   root of the syntax tree
     * @param walker traversal provider that reports nodes and scopes
     * @param config analysis options, or null for defaults
     * @return the finalized report
     * @throws IllegalArgumentException if the tree or walker is missing
     * @throws IllegalStateException    if the accumulated complexity is inconsistent
     */
    public <N> ModuleReport analyse(N tree, Walker<N> walker, ComplexityConfig config) {
        if (tree == null) {
            throw new IllegalArgumentException("Invalid syntax tree");
        }
        if (walker == null) {
            throw new IllegalArgumentException("Invalid walker");
        }

        ComplexityConfig settings = config != null ? config : ComplexityConfig.defaults();
        Location location = walker.locationOf(tree).orElse(null);

        AnalysisContext<N> context = new AnalysisContext<>(location);
        walker.walk(tree, settings, context);

        MetricsFinalizer.finalizeReport(context.report(), settings);
        return context.report();
    }
}
