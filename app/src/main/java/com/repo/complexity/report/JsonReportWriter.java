package com.repo.complexity.report;

import com.repo.complexity.model.Dependency;
import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.HalsteadItem;
import com.repo.complexity.model.HalsteadMetrics;
import com.repo.complexity.model.ModuleReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a finalized report as JSON.
 * Top-level fields are aggregate, functions, dependencies, maintainability and params;
 * per-function metrics sit under "complexity".
 */
public class JsonReportWriter {

    public void generate(ModuleReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, toJson(report));
        System.out.println("JSON Report generated at: " + outputPath.toAbsolutePath());
    }

    public String toJson(ModuleReport report) {
        String functions = report.getFunctions().stream()
                .map(this::functionToJson)
                .collect(Collectors.joining(", ", "[", "]"));
        String dependencies = report.getDependencies().stream()
                .map(this::dependencyToJson)
                .collect(Collectors.joining(", ", "[", "]"));

        return String.format(Locale.ROOT,
                "{ \"aggregate\": %s, \"functions\": %s, \"dependencies\": %s, \"maintainability\": %s, \"params\": %s }",
                functionToJson(report.getAggregate()), functions, dependencies,
                number(report.getMaintainability()), number(report.getParams()));
    }

    private String functionToJson(FunctionReport f) {
        StringBuilder sb = new StringBuilder("{ ");
        f.getName().ifPresent(name -> sb.append("\"name\": \"").append(escapeJson(name)).append("\", "));
        f.getLine().ifPresent(line -> sb.append("\"line\": ").append(line).append(", "));

        sb.append("\"complexity\": { \"sloc\": { \"logical\": ").append(f.getLogicalSloc());
        f.getPhysicalSloc().ifPresent(physical -> sb.append(", \"physical\": ").append(physical));
        sb.append(" }, ");
        sb.append("\"cyclomatic\": ").append(f.getCyclomatic()).append(", ");
        sb.append("\"cyclomaticDensity\": ").append(number(f.getCyclomaticDensity())).append(", ");
        sb.append("\"halstead\": ").append(halsteadToJson(f.getHalstead())).append(", ");
        sb.append("\"params\": ").append(f.getParams());
        sb.append(" } }");
        return sb.toString();
    }

    private String halsteadToJson(HalsteadMetrics h) {
        return String.format(Locale.ROOT,
                "{ \"operators\": %s, \"operands\": %s, \"length\": %d, \"vocabulary\": %s, \"difficulty\": %s, "
                        + "\"volume\": %s, \"effort\": %s, \"bugs\": %s, \"time\": %s }",
                itemToJson(h.getOperators()), itemToJson(h.getOperands()), h.getLength(),
                number(h.getVocabulary()), number(h.getDifficulty()), number(h.getVolume()),
                number(h.getEffort()), number(h.getBugs()), number(h.getTime()));
    }

    private String itemToJson(HalsteadItem item) {
        return String.format("{ \"distinct\": %d, \"total\": %d }", item.getDistinct(), item.getTotal());
    }

    private String dependencyToJson(Object dependency) {
        if (dependency instanceof Dependency) {
            Dependency d = (Dependency) dependency;
            return String.format("{ \"line\": %d, \"path\": \"%s\", \"type\": \"%s\" }",
                    d.line(), escapeJson(d.path()), escapeJson(d.type()));
        }
        return "\"" + escapeJson(String.valueOf(dependency)) + "\"";
    }

    /**
     * JSON has no literal for NaN or infinity, e.g. the density of a function
     * without logical lines; those are written as null.
     */
    private String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "null";
        }
        return Double.toString(value);
    }

    private String escapeJson(String s) {
        if (s == null)
            return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
