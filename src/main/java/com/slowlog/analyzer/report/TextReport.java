package com.slowlog.analyzer.report;

import java.io.FileNotFoundException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.util.Comparator;
import java.util.Map;

import com.slowlog.analyzer.ParseDiagnostics;
import com.slowlog.analyzer.accumulator.GlobalSummary;
import com.slowlog.analyzer.accumulator.GlobalSummary.TypePerformance;
import com.slowlog.analyzer.accumulator.TemplateStats;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.sql.StatementType;

/**
 * Console and CSV renderings of an analysis.
 */
public class TextReport {

    private static final String[] CSV_HEADERS = new String[] {
            "Type", "Count", "MinSec", "MaxSec", "AvgSec", "P95Sec", "TotalSec", "RowsExamined", "RowsSent",
            "Grade", "Template"
    };

    public static void report(AnalysisResult result, PrintStream out, int top) {
        GlobalSummary summary = result.getGlobalSummary();
        ParseDiagnostics diagnostics = result.getDiagnostics();

        out.println("Analysis: " + result.getName() + "  sources: " + String.join(", ", result.getSourceFiles()));
        out.printf("Queries: %d  templates: %d  skipped entries: %d  incomplete entries: %d%s%n",
                result.getTotalQueries(), result.getTotalTemplates(), diagnostics.getSkippedEntries(),
                diagnostics.getIncompleteEntries(), diagnostics.isTruncated() ? "  (truncated)" : "");
        out.printf("Query time: min %.3fs  max %.3fs  mean %.3fs  median %.3fs  total %.3fs%n",
                summary.getMinQueryTime(), summary.getMaxQueryTime(), summary.getMeanQueryTime(),
                summary.getMedianQueryTime(), summary.getTotalQueryTime());

        out.println();
        out.println(String.format("%-8s %8s %10s %10s %10s", "type", "count", "avg_sec", "max_sec", "share"));
        out.println("=".repeat(50));
        for (Map.Entry<StatementType, TypePerformance> e : summary.getTypePerformance().entrySet()) {
            TypePerformance p = e.getValue();
            out.println(String.format("%-8s %8d %10.3f %10.3f %9.1f%%", e.getKey(), p.getCount(),
                    p.getAvgQueryTime(), p.getMaxQueryTime(), 100.0 * p.getCount() / summary.getTotalQueries()));
        }

        out.println();
        out.println("Execution time distribution");
        summary.getHistogram().asMap().forEach((label, count) -> out.printf("  %-10s %8d%n", label, count));

        out.println();
        out.println("Top users");
        summary.topUsers(top).forEach(e -> out.printf("  %-40s %8d%n", e.getKey(), e.getValue()));
        out.println("Top tables");
        summary.topTables(top).forEach(e -> out.printf("  %-40s %8d%n", e.getKey(), e.getValue()));

        out.println();
        out.println(String.format("%-8s %8s %10s %10s %10s %10s %12s  %s", "type", "count", "min_sec", "max_sec",
                "avg_sec", "p95_sec", "rows_exam", "template"));
        out.println("=".repeat(120));
        result.getTemplateStats().values().stream()
                .sorted(Comparator.comparingDouble(TemplateStats::getTotalQueryTime).reversed())
                .limit(top)
                .forEach(out::println);
    }

    public static void reportCsv(AnalysisResult result, String fileName) throws FileNotFoundException {
        try (PrintWriter writer = new PrintWriter(fileName)) {
            writer.println(String.join(",", CSV_HEADERS));
            result.getTemplateStats().values().stream()
                    .sorted(Comparator.comparingDouble(TemplateStats::getTotalQueryTime).reversed())
                    .forEach(stats -> writer.println(stats.toCsvString()));
        }
    }
}
