package com.repo.complexity.model;

import com.repo.complexity.core.Location;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Complexity report for one syntax tree.
 * Holds the module aggregate, the function reports in scope-creation order,
 * and the dependencies found by the syntax table.
 */
public class ModuleReport {

    private final FunctionReport aggregate;
    private final List<FunctionReport> functions = new ArrayList<>();
    private final List<Object> dependencies = new ArrayList<>();

    // Set by the finalizer
    private double maintainability;
    private double params;

    public ModuleReport(Location location) {
        this.aggregate = FunctionReport.aggregate(location);
    }

    public void addFunction(FunctionReport function) {
        functions.add(function);
    }

    /**
     * Merge an extractor result: collections are appended element-wise,
     * any other non-null value as a single entry.
     */
    public void addDependencies(Object extracted) {
        if (extracted instanceof Collection) {
            dependencies.addAll((Collection<?>) extracted);
        } else if (extracted != null) {
            dependencies.add(extracted);
        }
    }

    public FunctionReport getAggregate() {
        return aggregate;
    }

    public List<FunctionReport> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public List<Object> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public double getMaintainability() {
        return maintainability;
    }

    public void setMaintainability(double maintainability) {
        this.maintainability = maintainability;
    }

    public double getParams() {
        return params;
    }

    public void setParams(double params) {
        this.params = params;
    }
}
