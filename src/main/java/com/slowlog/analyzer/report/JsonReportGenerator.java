package com.slowlog.analyzer.report;

import java.io.FileWriter;
import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slowlog.analyzer.ParseDiagnostics;
import com.slowlog.analyzer.accumulator.GlobalSummary;
import com.slowlog.analyzer.accumulator.GlobalSummary.TypePerformance;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.accumulator.TemplateStats;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.sql.StatementType;

/**
 * Generates structured JSON reports from slow query log analysis data
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static final int DEFAULT_TOP_USERS = 10;
    public static final int DEFAULT_TOP_TABLES = 20;

    public static void generateReport(String fileName, AnalysisResult result, double[] gradeThresholds)
            throws IOException {
        try (FileWriter writer = new FileWriter(fileName)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, buildReport(result, gradeThresholds));
        }
    }

    public static ObjectNode buildReport(AnalysisResult result, double[] gradeThresholds) {
        ObjectNode report = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", java.time.Instant.now().toString());
        metadata.put("name", result.getName());
        ArrayNode sources = metadata.putArray("sourceFiles");
        result.getSourceFiles().forEach(sources::add);
        report.set("metadata", metadata);

        report.set("summary", generateSummaryJson(result.getGlobalSummary(), DEFAULT_TOP_USERS, DEFAULT_TOP_TABLES));
        report.set("templates", generateTemplatesJson(result.getTemplateStats(), gradeThresholds));
        report.set("diagnostics", generateDiagnosticsJson(result.getDiagnostics()));
        return report;
    }

    public static JsonNode generateTemplatesJson(Map<TemplateKey, TemplateStats> templateStats,
            double[] gradeThresholds) {
        ArrayNode templates = mapper.createArrayNode();
        templateStats.values().stream()
                .sorted((a, b) -> Double.compare(b.getTotalQueryTime(), a.getTotalQueryTime()))
                .forEach(stats -> {
                    ObjectNode t = mapper.createObjectNode();
                    t.put("normalizedText", stats.getTemplate().getNormalizedText());
                    t.put("statementType", stats.getTemplate().getStatementType().name());
                    t.put("count", stats.getCount());
                    t.put("totalQueryTime", stats.getTotalQueryTime());
                    t.put("minQueryTime", stats.getMinQueryTime());
                    t.put("maxQueryTime", stats.getMaxQueryTime());
                    t.put("avgQueryTime", stats.getAvgQueryTime());
                    t.put("p95QueryTime", stats.getPercentile95());
                    t.put("totalLockTime", stats.getTotalLockTime());
                    t.put("totalRowsExamined", stats.getTotalRowsExamined());
                    t.put("totalRowsSent", stats.getTotalRowsSent());
                    t.put("grade", stats.getGrade(gradeThresholds).name());
                    ArrayNode users = t.putArray("users");
                    stats.getUsers().forEach(users::add);
                    ArrayNode tables = t.putArray("tables");
                    stats.getTables().forEach(tables::add);
                    templates.add(t);
                });
        return templates;
    }

    public static JsonNode generateSummaryJson(GlobalSummary summary, int topUsers, int topTables) {
        ObjectNode node = mapper.createObjectNode();

        ObjectNode basic = mapper.createObjectNode();
        basic.put("totalQueries", summary.getTotalQueries());
        basic.put("totalQueryTime", summary.getTotalQueryTime());
        basic.put("minQueryTime", summary.getMinQueryTime());
        basic.put("maxQueryTime", summary.getMaxQueryTime());
        basic.put("meanQueryTime", summary.getMeanQueryTime());
        basic.put("medianQueryTime", summary.getMedianQueryTime());
        node.set("basicStats", basic);

        ObjectNode types = mapper.createObjectNode();
        for (Map.Entry<StatementType, Long> e : summary.getTypeCounts().entrySet()) {
            types.put(e.getKey().name(), e.getValue());
        }
        node.set("statementTypes", types);

        ObjectNode performance = mapper.createObjectNode();
        for (Map.Entry<StatementType, TypePerformance> e : summary.getTypePerformance().entrySet()) {
            ObjectNode p = mapper.createObjectNode();
            p.put("count", e.getValue().getCount());
            p.put("avgQueryTime", e.getValue().getAvgQueryTime());
            p.put("maxQueryTime", e.getValue().getMaxQueryTime());
            performance.set(e.getKey().name(), p);
        }
        node.set("typePerformance", performance);

        ObjectNode histogram = mapper.createObjectNode();
        summary.getHistogram().asMap().forEach(histogram::put);
        node.set("timeDistribution", histogram);

        ArrayNode users = node.putArray("topUsers");
        for (Map.Entry<String, Long> e : summary.topUsers(topUsers)) {
            users.addObject().put("user", e.getKey()).put("count", e.getValue());
        }
        ArrayNode tables = node.putArray("topTables");
        for (Map.Entry<String, Long> e : summary.topTables(topTables)) {
            tables.addObject().put("table", e.getKey()).put("count", e.getValue());
        }
        return node;
    }

    public static JsonNode generateDiagnosticsJson(ParseDiagnostics diagnostics) {
        ObjectNode node = mapper.createObjectNode();
        node.put("entries", diagnostics.getEntries());
        node.put("skippedEntries", diagnostics.getSkippedEntries());
        node.put("incompleteEntries", diagnostics.getIncompleteEntries());
        node.put("warnings", diagnostics.getWarnings());
        node.put("linesRead", diagnostics.getLinesRead());
        node.put("truncated", diagnostics.isTruncated());
        return node;
    }
}
