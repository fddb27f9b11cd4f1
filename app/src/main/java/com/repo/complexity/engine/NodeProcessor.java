package com.repo.complexity.engine;

import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.HalsteadItem;
import com.repo.complexity.model.HalsteadMetrics;
import com.repo.complexity.model.ModuleReport;
import com.repo.complexity.syntax.Contribution;
import com.repo.complexity.syntax.DependencyExtractor;
import com.repo.complexity.syntax.HalsteadDescriptor;
import com.repo.complexity.syntax.SyntaxEntry;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Applies one syntax entry to the aggregate and the current scope.
 */
final class NodeProcessor {

    private NodeProcessor() {
    }

    /**
     * Update logical lines, complexity, Halstead counts and dependencies for a node.
     *
     * @return true if the entry declares a dependency extractor
     */
    static <N> boolean process(N node, SyntaxEntry<N> entry, ModuleReport report,
            Optional<FunctionReport> current, boolean clearDependencies) {
        if (entry == null) {
            return false;
        }

        FunctionReport aggregate = report.getAggregate();

        Integer lloc = amountOf(entry.getLloc(), node);
        if (lloc != null) {
            aggregate.addLogicalSloc(lloc);
            current.ifPresent(f -> f.addLogicalSloc(lloc));
        }

        Integer complexity = amountOf(entry.getComplexity(), node);
        if (complexity != null) {
            aggregate.addCyclomatic(complexity);
            current.ifPresent(f -> f.addCyclomatic(complexity));
        }

        recordHalstead(node, entry.getOperators(), aggregate, current, HalsteadMetrics::getOperators);
        recordHalstead(node, entry.getOperands(), aggregate, current, HalsteadMetrics::getOperands);

        Optional<DependencyExtractor<N>> extractor = entry.getDependencies();
        if (extractor.isPresent()) {
            report.addDependencies(extractor.get().extract(node, clearDependencies));
            return true;
        }
        return false;
    }

    private static <N> Integer amountOf(Optional<Contribution<N>> contribution, N node) {
        return contribution.map(c -> c.amount(node)).orElse(null);
    }

    private static <N> void recordHalstead(N node, List<HalsteadDescriptor<N>> descriptors,
            FunctionReport aggregate, Optional<FunctionReport> current,
            Function<HalsteadMetrics, HalsteadItem> bucket) {
        for (HalsteadDescriptor<N> descriptor : descriptors) {
            Object identifier = descriptor.identify(node);
            if (!descriptor.appliesTo(node)) {
                continue;
            }
            current.ifPresent(f -> bucket.apply(f.getHalstead()).record(identifier));
            bucket.apply(aggregate.getHalstead()).record(identifier);
        }
    }
}
