package com.repo.complexity.syntax;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declares one Halstead operator or operand a node contributes.
 *
 * @param identifier computes the identifier from the node
 * @param filter     optional gate; when present the occurrence only counts if it passes
 */
public record HalsteadDescriptor<N>(
        Function<N, Object> identifier,
        Predicate<N> filter) {

    public static <N> HalsteadDescriptor<N> of(Object identifier) {
        return new HalsteadDescriptor<>(node -> identifier, null);
    }

    public static <N> HalsteadDescriptor<N> computed(Function<N, Object> identifier) {
        return new HalsteadDescriptor<>(identifier, null);
    }

    public HalsteadDescriptor<N> when(Predicate<N> condition) {
        return new HalsteadDescriptor<>(identifier, condition);
    }

    public boolean appliesTo(N node) {
        return filter == null || filter.test(node);
    }

    public Object identify(N node) {
        return identifier.apply(node);
    }
}
