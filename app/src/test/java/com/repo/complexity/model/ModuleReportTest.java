package com.repo.complexity.model;

import com.repo.complexity.core.Location;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ModuleReportTest {

    @Test
    void testDependencyMerging() {
        ModuleReport report = new ModuleReport(null);
        Dependency lodash = new Dependency(3, "lodash", "CommonJS");

        report.addDependencies(lodash);
        report.addDependencies(List.of("a", "b"));
        report.addDependencies(null);
        report.addDependencies(List.of());

        assertEquals(List.of(lodash, "a", "b"), report.getDependencies());
    }

    @Test
    void testAggregateHasNoNameAndTakesLocation() {
        ModuleReport report = new ModuleReport(new Location(1, 40));

        FunctionReport aggregate = report.getAggregate();
        assertEquals(Optional.empty(), aggregate.getName());
        assertEquals(Optional.of(1), aggregate.getLine());
        assertEquals(Optional.of(40), aggregate.getPhysicalSloc());
        assertEquals(0, aggregate.getParams());
        assertEquals(1, aggregate.getCyclomatic());
    }

    @Test
    void testFunctionWithoutLocation() {
        FunctionReport f = new FunctionReport("f", null, 2);

        assertTrue(f.getLine().isEmpty());
        assertTrue(f.getPhysicalSloc().isEmpty());
        assertEquals(2, f.getParams());
    }
}
