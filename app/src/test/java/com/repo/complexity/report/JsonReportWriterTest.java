package com.repo.complexity.report;

import com.repo.complexity.engine.ComplexityAnalyzer;
import com.repo.complexity.model.Dependency;
import com.repo.complexity.model.ModuleReport;
import com.repo.complexity.syntax.SyntaxEntry;
import com.repo.complexity.walk.Walker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    private final JsonReportWriter writer = new JsonReportWriter();

    @Test
    void testReportLayout() {
        String json = writer.toJson(CsvReporterTest.sampleReport());

        assertTrue(json.contains("\"name\": \"parse, quickly\""), "Named function");
        assertTrue(json.contains("\"line\": 4"), "Function line");
        assertTrue(json.contains("\"sloc\": { \"logical\": 1, \"physical\": 6 }"), "Physical SLOC when located");
        assertTrue(json.contains("\"operators\": { \"distinct\": 1, \"total\": 2 }"), "Aggregate operators");
        assertTrue(json.contains("\"maintainability\": "), "Maintainability");
        assertTrue(json.contains("\"params\": 1.0 }"), "Average params");
    }

    @Test
    void testDependenciesAndUndefinedNumbers() {
        SyntaxEntry<String> require = SyntaxEntry.<String>builder()
                .dependencies((node, clear) -> List.of(new Dependency(7, "./util \"v2\"", "CommonJS"), "raw"))
                .build();
        ModuleReport report = new ComplexityAnalyzer().analyse("module",
                (tree, config, callbacks) -> callbacks.processNode("call", require));

        String json = writer.toJson(report);

        assertTrue(json.contains("{ \"line\": 7, \"path\": \"./util \\\"v2\\\"\", \"type\": \"CommonJS\" }"), json);
        assertTrue(json.contains("\"raw\""));
        assertTrue(json.contains("\"cyclomaticDensity\": null"), "Infinite density has no JSON literal");
        assertTrue(json.contains("\"maintainability\": 171.0"));
    }

    @Test
    void testSmallValuesKeepFullPrecision() {
        Walker<String> walker = (tree, config, callbacks) -> {
            for (String op : List.of("+", "+", "=", "=")) {
                callbacks.processNode(op, SyntaxEntry.<String>builder().operator(op).build());
            }
            for (String name : List.of("a", "b", "c", "a", "b", "c")) {
                callbacks.processNode(name, SyntaxEntry.<String>builder().operand(name).build());
            }
        };
        ModuleReport report = new ComplexityAnalyzer().analyse("module", walker);
        double bugs = report.getAggregate().getHalstead().getBugs();

        String json = writer.toJson(report);

        assertEquals(0.00774, bugs, 1e-5);
        assertTrue(json.contains("\"bugs\": " + bugs + ","), json);
        assertFalse(json.contains("\"bugs\": 0.0077,"), "Not rounded to four places");
    }
}
