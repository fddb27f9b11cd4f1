package com.repo.complexity.engine;

import com.repo.complexity.core.Location;
import com.repo.complexity.model.ModuleReport;
import com.repo.complexity.syntax.SyntaxEntry;
import com.repo.complexity.walk.WalkerCallbacks;

/**
 * Mutable state of a single analysis: the report under construction,
 * the scope stack and the dependency clear flag.
 * A new context is created for every call to the analyzer.
 */
class AnalysisContext<N> implements WalkerCallbacks<N> {

    private final ModuleReport report;
    private final ScopeStack scopes;
    private boolean clearDependencies = true;

    AnalysisContext(Location location) {
        this.report = new ModuleReport(location);
        this.scopes = new ScopeStack(report);
    }

    @Override
    public void processNode(N node, SyntaxEntry<N> entry) {
        boolean dependencyBearing = NodeProcessor.process(node, entry, report, scopes.current(), clearDependencies);
        if (dependencyBearing) {
            // Only the first dependency-bearing node of the whole analysis sees clear=true
            clearDependencies = false;
        }
    }

    @Override
    public void createScope(String name, Location location, int parameterCount) {
        scopes.push(name, location, parameterCount);
    }

    @Override
    public void popScope() {
        scopes.pop();
    }

    ModuleReport report() {
        return report;
    }
}
