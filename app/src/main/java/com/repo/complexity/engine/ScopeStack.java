package com.repo.complexity.engine;

import com.repo.complexity.core.Location;
import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.ModuleReport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Tracks which function report receives per-node increments.
 * The module aggregate is never on the stack.
 */
class ScopeStack {

    private final ModuleReport report;
    private final Deque<FunctionReport> scopes = new ArrayDeque<>();

    ScopeStack(ModuleReport report) {
        this.report = report;
    }

    FunctionReport push(String name, Location location, int parameterCount) {
        FunctionReport function = new FunctionReport(name, location, parameterCount);
        report.addFunction(function);
        report.getAggregate().addParams(parameterCount);
        scopes.push(function);
        return function;
    }

    void pop() {
        scopes.poll();
    }

    /**
     * Innermost open scope, or empty at module top level.
     */
    Optional<FunctionReport> current() {
        return Optional.ofNullable(scopes.peek());
    }
}
