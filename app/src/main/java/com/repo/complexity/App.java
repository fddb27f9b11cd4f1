package com.repo.complexity;

import com.repo.complexity.core.ComplexityConfig;
import com.repo.complexity.engine.ComplexityAnalyzer;
import com.repo.complexity.model.FunctionReport;
import com.repo.complexity.model.ModuleReport;
import com.repo.complexity.report.CsvReporter;
import com.repo.complexity.report.JsonReportWriter;
import com.repo.complexity.syntax.estree.EstreeSyntax;
import com.repo.complexity.tree.SyntaxNode;
import com.repo.complexity.tree.SyntaxTreeLoader;
import com.repo.complexity.walk.SyntaxTreeWalker;

import java.nio.file.Path;

public class App {

    public static void main(String[] args) {
        System.out.println("=== Complexity Report ===");

        if (args.length < 1) {
            System.err.println("Usage: app <syntax_tree.yaml> [config_dir]");
            System.exit(1);
        }

        Path treeFile = Path.of(args[0]);
        Path configDir = args.length > 1 ? Path.of(args[1]) : Path.of(".");

        try {
            ComplexityConfig config = ComplexityConfig.load(configDir);
            SyntaxNode tree = new SyntaxTreeLoader().load(treeFile);

            ModuleReport report = new ComplexityAnalyzer()
                    .analyse(tree, new SyntaxTreeWalker(EstreeSyntax::table), config);

            printSummary(treeFile, report);

            new CsvReporter().generate(report, Path.of("complexity-report.csv"));
            new JsonReportWriter().generate(report, Path.of("complexity-report.json"));
        } catch (Exception e) {
            System.err.println("Analysis of " + treeFile + " failed: " + e.getMessage());
            System.exit(1);
        }
    }

    static void printSummary(Path treeFile, ModuleReport report) {
        System.out.println("\n| %-30s | %-5s | %-5s | %-6s | %-8s | %-10s |".formatted(
                "Function", "Line", "LLOC", "CC", "Params", "Effort"));
        System.out.println("|" + "-".repeat(32) + "|" + "-".repeat(7) + "|" + "-".repeat(7) + "|" + "-".repeat(8)
                + "|" + "-".repeat(10) + "|" + "-".repeat(12) + "|");

        for (FunctionReport f : report.getFunctions()) {
            System.out.println("| %-30s | %-5s | %-5d | %-6d | %-8d | %-10.2f |".formatted(
                    truncate(f.getName().orElse("<anonymous>"), 30),
                    f.getLine().map(String::valueOf).orElse("?"),
                    f.getLogicalSloc(),
                    f.getCyclomatic(),
                    f.getParams(),
                    f.getHalstead().getEffort()));
        }

        FunctionReport aggregate = report.getAggregate();
        System.out.println("\n--- " + treeFile.getFileName() + " ---");
        System.out.println("Logical SLOC    : " + aggregate.getLogicalSloc());
        System.out.println("Cyclomatic      : " + aggregate.getCyclomatic());
        System.out.println("Maintainability : %.2f".formatted(report.getMaintainability()));
        System.out.println("Avg params      : %.2f".formatted(report.getParams()));
        System.out.println("Dependencies    : " + report.getDependencies().size());
    }

    private static String truncate(String s, int len) {
        if (s.length() <= len)
            return s;
        return "..." + s.substring(s.length() - (len - 3));
    }
}
