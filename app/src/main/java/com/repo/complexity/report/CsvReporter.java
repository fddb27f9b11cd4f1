package com.repo.complexity.report;

import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.HalsteadMetrics;
import com.repo.complexity.model.ModuleReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public class CsvReporter {

    static final String HEADER = "Function,Line,Physical SLOC,Logical SLOC,Params,Cyclomatic,Density,"
            + "Halstead Length,Vocabulary,Difficulty,Volume,Effort,Bugs,Time\n";

    public void generate(ModuleReport report, Path outputPath) throws IOException {
        Files.writeString(outputPath, render(report));
        System.out.println("CSV Report generated at: " + outputPath.toAbsolutePath());
    }

    public String render(ModuleReport report) {
        StringBuilder csv = new StringBuilder(HEADER);

        for (FunctionReport f : report.getFunctions()) {
            csv.append(row(f.getName().orElse("<anonymous>"), f));
        }
        csv.append(row("<module>", report.getAggregate()));

        return csv.toString();
    }

    private String row(String name, FunctionReport f) {
        HalsteadMetrics h = f.getHalstead();
        return String.format(Locale.ROOT, "%s,%s,%s,%d,%d,%d,%.2f,%d,%.0f,%.2f,%.2f,%.2f,%.4f,%.2f\n",
                escape(name),
                f.getLine().map(String::valueOf).orElse(""),
                f.getPhysicalSloc().map(String::valueOf).orElse(""),
                f.getLogicalSloc(),
                f.getParams(),
                f.getCyclomatic(),
                f.getCyclomaticDensity(),
                h.getLength(),
                h.getVocabulary(),
                h.getDifficulty(),
                h.getVolume(),
                h.getEffort(),
                h.getBugs(),
                h.getTime());
    }

    private String escape(String s) {
        if (s == null)
            return "";
        // Simple CSV escaping: if contains comma, wrap in quotes
        if (s.contains(",")) {
            return "\"" + s + "\"";
        }
        return s;
    }
}
