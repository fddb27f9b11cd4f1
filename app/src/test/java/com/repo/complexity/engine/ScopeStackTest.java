package com.repo.complexity.engine;

import com.repo.complexity.core.Location;
import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.ModuleReport;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest {

    @Test
    void testPushRegistersFunctionAndParams() {
        ModuleReport report = new ModuleReport(null);
        ScopeStack stack = new ScopeStack(report);

        FunctionReport f = stack.push("f", new Location(2, 4), 3);

        assertEquals(Optional.of(f), stack.current());
        assertEquals(1, report.getFunctions().size());
        assertSame(f, report.getFunctions().get(0));
        assertEquals(3, report.getAggregate().getParams());
        assertEquals(1, f.getCyclomatic(), "New scopes start with one path");
    }

    @Test
    void testPopReturnsToEnclosingScope() {
        ModuleReport report = new ModuleReport(null);
        ScopeStack stack = new ScopeStack(report);

        FunctionReport outer = stack.push("outer", null, 0);
        stack.push("inner", null, 0);
        stack.pop();

        assertEquals(Optional.of(outer), stack.current());
        assertEquals(2, report.getFunctions().size(), "Popping never removes a report");

        stack.pop();
        assertTrue(stack.current().isEmpty());
    }

    @Test
    void testPopOnEmptyStackIsNoOp() {
        ScopeStack stack = new ScopeStack(new ModuleReport(null));

        stack.pop();

        assertTrue(stack.current().isEmpty());
    }
}
