package com.slowlog.analyzer.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slowlog.analyzer.ParseDiagnostics;
import com.slowlog.analyzer.SlowLogException;
import com.slowlog.analyzer.SlowQuery;
import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.model.AnalysisMetadata;
import com.slowlog.analyzer.model.AnalysisMetadata.MergeInfo;
import com.slowlog.analyzer.model.AnalysisMetadata.SourceDetail;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.model.AnalyzedQuery;
import com.slowlog.analyzer.report.JsonReportGenerator;

/**
 * JSON form of an {@link AnalysisResult}.
 * <p>
 * The artifact carries the records and may carry the template statistics and global summary as a convenience for
 * other readers. On load the summaries are always rebuilt from the records and any cached copy is ignored.
 */
public class AnalysisResultCodec {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final AnalyzerConfig config;

    public AnalysisResultCodec(AnalyzerConfig config) {
        this.config = config;
    }

    public void write(AnalysisResult result, OutputStream out) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(out, toJson(result, true));
    }

    public AnalysisResult read(InputStream in) throws IOException {
        return fromJson(mapper.readTree(in));
    }

    public ObjectNode toJson(AnalysisResult result, boolean includeSummaries) {
        ObjectNode root = mapper.createObjectNode();
        root.put("name", result.getName());
        ArrayNode sources = root.putArray("sourceFiles");
        result.getSourceFiles().forEach(sources::add);
        if (result.getMetadata() != null) {
            root.set("metadata", metadataJson(result.getMetadata()));
        }
        root.set("diagnostics", JsonReportGenerator.generateDiagnosticsJson(result.getDiagnostics()));

        ArrayNode records = root.putArray("records");
        for (AnalyzedQuery query : result.getRecords()) {
            records.add(recordJson(query.getRecord()));
        }

        if (includeSummaries) {
            root.set("templateStats", JsonReportGenerator.generateTemplatesJson(result.getTemplateStats(),
                    config.getGradeThresholds()));
            root.set("globalSummary", JsonReportGenerator.generateSummaryJson(result.getGlobalSummary(),
                    JsonReportGenerator.DEFAULT_TOP_USERS, JsonReportGenerator.DEFAULT_TOP_TABLES));
        }
        return root;
    }

    public AnalysisResult fromJson(JsonNode root) {
        String name = text(root, "name");
        JsonNode recordsNode = root.get("records");
        if (recordsNode == null || !recordsNode.isArray()) {
            throw new SlowLogException("Analysis artifact '" + name + "' has no record data");
        }

        List<AnalyzedQuery> records = new ArrayList<>(recordsNode.size());
        for (JsonNode r : recordsNode) {
            records.add(AnalyzedQuery.of(parseRecord(r)));
        }

        List<String> sourceFiles = new ArrayList<>();
        JsonNode sourcesNode = root.get("sourceFiles");
        if (sourcesNode != null) {
            sourcesNode.forEach(s -> sourceFiles.add(s.asText()));
        }

        ParseDiagnostics diagnostics = null;
        JsonNode d = root.get("diagnostics");
        if (d != null) {
            diagnostics = new ParseDiagnostics(d.path("entries").asLong(), d.path("skippedEntries").asLong(),
                    d.path("incompleteEntries").asLong(), d.path("warnings").asLong(), d.path("linesRead").asLong(),
                    d.path("truncated").asBoolean());
        }

        AnalysisMetadata metadata = root.has("metadata") ? parseMetadata(root.get("metadata")) : null;
        return AnalysisResult.fromRecords(name, records, sourceFiles, diagnostics, metadata,
                config.getHistogramBounds());
    }

    private static ObjectNode recordJson(SlowQuery q) {
        ObjectNode node = mapper.createObjectNode();
        node.put("sourceId", q.getSourceId());
        node.put("time", q.getTime());
        node.put("timestamp", q.getTimestamp());
        node.put("user", q.getUser());
        node.put("host", q.getHost());
        node.put("connectionId", q.getConnectionId());
        node.put("threadId", q.getThreadId());
        node.put("schema", q.getSchema());
        node.put("qcHit", q.getQcHit());
        node.put("queryTime", q.getQueryTime());
        node.put("lockTime", q.getLockTime());
        node.put("rowsSent", q.getRowsSent());
        node.put("rowsExamined", q.getRowsExamined());
        node.put("rowsAffected", q.getRowsAffected());
        node.put("bytesSent", q.getBytesSent());
        node.put("db", q.getDb());
        node.put("sql", q.getSql());
        node.put("incomplete", q.isIncomplete());
        return node;
    }

    private static SlowQuery parseRecord(JsonNode r) {
        return SlowQuery.builder(r.path("sourceId").asText(""))
                .time(text(r, "time"))
                .timestamp(longOrNull(r, "timestamp"))
                .user(text(r, "user"))
                .host(text(r, "host"))
                .connectionId(longOrNull(r, "connectionId"))
                .threadId(longOrNull(r, "threadId"))
                .schema(text(r, "schema"))
                .qcHit(text(r, "qcHit"))
                .queryTime(r.path("queryTime").asDouble())
                .lockTime(r.path("lockTime").asDouble())
                .rowsSent(r.path("rowsSent").asLong())
                .rowsExamined(r.path("rowsExamined").asLong())
                .rowsAffected(longOrNull(r, "rowsAffected"))
                .bytesSent(longOrNull(r, "bytesSent"))
                .db(text(r, "db"))
                .sql(text(r, "sql"))
                .incomplete(r.path("incomplete").asBoolean())
                .build();
    }

    private static ObjectNode metadataJson(AnalysisMetadata metadata) {
        ObjectNode node = mapper.createObjectNode();
        node.put("originalFilename", metadata.getOriginalFilename());
        node.put("createdAt", metadata.getCreatedAt());
        node.put("totalQueries", metadata.getTotalQueries());
        node.put("totalTemplates", metadata.getTotalTemplates());
        MergeInfo mergeInfo = metadata.getMergeInfo();
        if (mergeInfo != null) {
            ObjectNode merge = node.putObject("mergeInfo");
            ArrayNode from = merge.putArray("mergedFrom");
            mergeInfo.getMergedFrom().forEach(from::add);
            merge.put("mergeTime", mergeInfo.getMergeTime());
            ArrayNode details = merge.putArray("sourceDetails");
            for (SourceDetail detail : mergeInfo.getSourceDetails()) {
                details.addObject()
                        .put("name", detail.getName())
                        .put("totalQueries", detail.getTotalQueries())
                        .put("totalTemplates", detail.getTotalTemplates());
            }
        }
        return node;
    }

    private static AnalysisMetadata parseMetadata(JsonNode node) {
        MergeInfo mergeInfo = null;
        JsonNode merge = node.get("mergeInfo");
        if (merge != null && merge.isObject()) {
            List<String> mergedFrom = new ArrayList<>();
            merge.path("mergedFrom").forEach(n -> mergedFrom.add(n.asText()));
            List<SourceDetail> details = new ArrayList<>();
            for (JsonNode detail : merge.path("sourceDetails")) {
                details.add(new SourceDetail(text(detail, "name"), detail.path("totalQueries").asLong(),
                        detail.path("totalTemplates").asLong()));
            }
            mergeInfo = new MergeInfo(mergedFrom, text(merge, "mergeTime"), details);
        }
        return new AnalysisMetadata(text(node, "originalFilename"), text(node, "createdAt"),
                node.path("totalQueries").asLong(), node.path("totalTemplates").asLong(), mergeInfo);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asLong();
    }
}
