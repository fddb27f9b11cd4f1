package com.repo.complexity.model;

/**
 * Halstead operator/operand state for one report, plus the derived metrics
 * filled in by the finalizer.
 */
public class HalsteadMetrics {

    private final HalsteadItem operators = new HalsteadItem();
    private final HalsteadItem operands = new HalsteadItem();

    // Derived
    private int length;
    private double vocabulary;
    private double difficulty;
    private double volume;
    private double effort;
    private double bugs;
    private double time;

    public HalsteadItem getOperators() {
        return operators;
    }

    public HalsteadItem getOperands() {
        return operands;
    }

    /**
     * Compute length, vocabulary, difficulty, volume, effort, bugs and time
     * from the raw counts. All derived values are zero when nothing was counted.
     */
    public void derive() {
        length = operators.getTotal() + operands.getTotal();
        if (length == 0) {
            vocabulary = 0;
            difficulty = 0;
            volume = 0;
            effort = 0;
            bugs = 0;
            time = 0;
            return;
        }

        vocabulary = operators.getDistinct() + operands.getDistinct();
        double operandRatio = operands.getDistinct() == 0
                ? 1
                : (double) operands.getTotal() / operands.getDistinct();
        difficulty = (operators.getDistinct() / 2.0) * operandRatio;
        volume = length * (Math.log(vocabulary) / Math.log(2));
        effort = difficulty * volume;
        bugs = volume / 3000;
        time = effort / 18;
    }

    public int getLength() {
        return length;
    }

    public double getVocabulary() {
        return vocabulary;
    }

    public double getDifficulty() {
        return difficulty;
    }

    public double getVolume() {
        return volume;
    }

    public double getEffort() {
        return effort;
    }

    public double getBugs() {
        return bugs;
    }

    public double getTime() {
        return time;
    }
}
