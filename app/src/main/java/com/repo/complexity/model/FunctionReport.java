package com.repo.complexity.model;

import com.repo.complexity.core.Location;

import java.util.Optional;

/**
 * Metrics for a single function scope, or for the whole module when used as
 * the aggregate.
 */
public class FunctionReport {

    private final String name;
    private final Integer line;
    private final Integer physicalSloc;
    private int params;

    private int logicalSloc;
    private int cyclomatic = 1; // straight-line path
    private double cyclomaticDensity;
    private final HalsteadMetrics halstead = new HalsteadMetrics();

    public FunctionReport(String name, Location location, int params) {
        this.name = name;
        this.params = params;
        if (location != null) {
            this.line = location.startLine();
            this.physicalSloc = location.physicalLines();
        } else {
            this.line = null;
            this.physicalSloc = null;
        }
    }

    /**
     * Create the module-level report, which has no name and no parameters.
     */
    public static FunctionReport aggregate(Location location) {
        return new FunctionReport(null, location, 0);
    }

    public void addLogicalSloc(int amount) {
        logicalSloc += amount;
    }

    /**
     * The aggregate keeps a running total of the parameters declared by every scope.
     */
    public void addParams(int amount) {
        params += amount;
    }

    public void addCyclomatic(int amount) {
        cyclomatic += amount;
    }

    /**
     * Fill in cyclomatic density and the derived Halstead metrics.
     * Density is not guarded against zero logical lines.
     */
    public void finalizeMetrics() {
        cyclomaticDensity = (double) cyclomatic / logicalSloc * 100;
        halstead.derive();
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<Integer> getLine() {
        return Optional.ofNullable(line);
    }

    public Optional<Integer> getPhysicalSloc() {
        return Optional.ofNullable(physicalSloc);
    }

    public int getParams() {
        return params;
    }

    public int getLogicalSloc() {
        return logicalSloc;
    }

    public int getCyclomatic() {
        return cyclomatic;
    }

    public double getCyclomaticDensity() {
        return cyclomaticDensity;
    }

    public HalsteadMetrics getHalstead() {
        return halstead;
    }
}
