package com.repo.complexity.model;

import java.util.HashSet;
import java.util.Set;

/**
 * Distinct/total occurrence counter for one Halstead bucket (operators or operands).
 */
public class HalsteadItem {

    private int distinct;
    private int total;
    private final Set<Object> identifiers = new HashSet<>();

    /**
     * Record one occurrence of an identifier.
     *
     * @return true if this is the first time the identifier was seen in this bucket
     */
    public boolean record(Object identifier) {
        total++;
        if (identifiers.add(identifier)) {
            distinct++;
            return true;
        }
        return false;
    }

    public int getDistinct() {
        return distinct;
    }

    public int getTotal() {
        return total;
    }
}
