package com.repo.complexity.engine;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.ModuleReport;

/**
 * Derives density, Halstead metrics and the maintainability index once
 * traversal has finished. Must run exactly once per report.
 */
final class MetricsFinalizer {

    static final double MAINTAINABILITY_CEILING = 171;

    private MetricsFinalizer() {
    }

    static void finalizeReport(ModuleReport report, ComplexityConfig config) {
        double sumLoc = 0;
        double sumComplexity = 0;
        double sumEffort = 0;
        double sumParams = 0;
        int samples = 0;

        for (FunctionReport function : report.getFunctions()) {
            function.finalizeMetrics();
            sumLoc += function.getLogicalSloc();
            sumComplexity += function.getCyclomatic();
            sumEffort += function.getHalstead().getEffort();
            sumParams += function.getParams();
            samples++;
        }

        FunctionReport aggregate = report.getAggregate();
        aggregate.finalizeMetrics();

        // Modules without functions are averaged over the aggregate alone
        if (samples == 0) {
            sumLoc = aggregate.getLogicalSloc();
            sumComplexity = aggregate.getCyclomatic();
            sumEffort = aggregate.getHalstead().getEffort();
            sumParams = aggregate.getParams();
            samples = 1;
        }

        report.setMaintainability(maintainabilityIndex(
                sumEffort / samples,
                sumComplexity / samples,
                sumLoc / samples,
                config.isNewMi()));
        report.setParams(sumParams / samples);
    }

    static double maintainabilityIndex(double averageEffort, double averageComplexity,
            double averageLoc, boolean rescale) {
        if (averageComplexity == 0) {
            throw new IllegalStateException("Encountered function with cyclomatic complexity zero!");
        }

        double maintainability;
        if (averageEffort == 0 || averageLoc == 0) {
            maintainability = MAINTAINABILITY_CEILING;
        } else {
            maintainability = MAINTAINABILITY_CEILING
                    - (3.42 * Math.log(averageEffort))
                    - (0.23 * Math.log(averageComplexity))
                    - (16.2 * Math.log(averageLoc));
        }

        if (rescale) {
            maintainability = Math.max(0, (maintainability * 100) / MAINTAINABILITY_CEILING);
        }
        return maintainability;
    }
}
