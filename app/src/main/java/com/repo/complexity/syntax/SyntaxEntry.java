package com.repo.complexity.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * How one node kind contributes to each metric. Every part is optional.
 */
public class SyntaxEntry<N> {

    private final Contribution<N> lloc;
    private final Contribution<N> complexity;
    private final List<HalsteadDescriptor<N>> operators;
    private final List<HalsteadDescriptor<N>> operands;
    private final DependencyExtractor<N> dependencies;
    private final boolean newScope;

    private SyntaxEntry(Builder<N> builder) {
        this.lloc = builder.lloc;
        this.complexity = builder.complexity;
        this.operators = List.copyOf(builder.operators);
        this.operands = List.copyOf(builder.operands);
        this.dependencies = builder.dependencies;
        this.newScope = builder.newScope;
    }

    public static <N> Builder<N> builder() {
        return new Builder<>();
    }

    public Optional<Contribution<N>> getLloc() {
        return Optional.ofNullable(lloc);
    }

    public Optional<Contribution<N>> getComplexity() {
        return Optional.ofNullable(complexity);
    }

    public List<HalsteadDescriptor<N>> getOperators() {
        return operators;
    }

    public List<HalsteadDescriptor<N>> getOperands() {
        return operands;
    }

    public Optional<DependencyExtractor<N>> getDependencies() {
        return Optional.ofNullable(dependencies);
    }

    /** Walker hint: the node opens a function scope */
    public boolean isNewScope() {
        return newScope;
    }

    public static class Builder<N> {
        private Contribution<N> lloc;
        private Contribution<N> complexity;
        private final List<HalsteadDescriptor<N>> operators = new ArrayList<>();
        private final List<HalsteadDescriptor<N>> operands = new ArrayList<>();
        private DependencyExtractor<N> dependencies;
        private boolean newScope;

        public Builder<N> lloc(int amount) {
            return lloc(Contribution.constant(amount));
        }

        public Builder<N> lloc(Contribution<N> contribution) {
            this.lloc = contribution;
            return this;
        }

        public Builder<N> complexity(int amount) {
            return complexity(Contribution.constant(amount));
        }

        public Builder<N> complexity(Contribution<N> contribution) {
            this.complexity = contribution;
            return this;
        }

        public Builder<N> operator(HalsteadDescriptor<N> descriptor) {
            operators.add(descriptor);
            return this;
        }

        public Builder<N> operator(String identifier) {
            return operator(HalsteadDescriptor.of(identifier));
        }

        public Builder<N> operand(HalsteadDescriptor<N> descriptor) {
            operands.add(descriptor);
            return this;
        }

        public Builder<N> operand(String identifier) {
            return operand(HalsteadDescriptor.of(identifier));
        }

        public Builder<N> dependencies(DependencyExtractor<N> extractor) {
            this.dependencies = extractor;
            return this;
        }

        public Builder<N> newScope() {
            this.newScope = true;
            return this;
        }

        public SyntaxEntry<N> build() {
            return new SyntaxEntry<>(this);
        }
    }
}
