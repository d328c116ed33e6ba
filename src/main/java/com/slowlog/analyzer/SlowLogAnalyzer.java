package com.slowlog.analyzer;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.slowlog.analyzer.config.AnalyzerConfig;
import com.slowlog.analyzer.filter.FilterSpec;
import com.slowlog.analyzer.filter.FilteredView;
import com.slowlog.analyzer.filter.RecordPage;
import com.slowlog.analyzer.model.AnalysisResult;
import com.slowlog.analyzer.model.AnalyzedQuery;
import com.slowlog.analyzer.report.JsonReportGenerator;
import com.slowlog.analyzer.report.TextReport;
import com.slowlog.analyzer.service.AnalysisService;
import com.slowlog.analyzer.service.AnalysisService.ParseOutcome;
import com.slowlog.analyzer.store.AnalysisStore;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line front end: parses slow query logs, merges them into one analysis and writes the reports.
 */
@Command(name = "slowLogAnalyzer", mixinStandardHelpOptions = true, version = "1.0",
         description = "Analyze MySQL slow query logs: group statements into templates and report their statistics")
public class SlowLogAnalyzer implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(SlowLogAnalyzer.class);

    @Option(names = { "-f", "--files" }, description = "MySQL slow query log file(s), optionally gzipped", required = true, arity = "1..*")
    private String[] fileNames;

    @Option(names = { "--config" }, description = "Analyzer configuration file")
    private String configFile;

    @Option(names = { "-n", "--name" }, description = "Name of the resulting analysis (default: first file name)")
    private String name;

    @Option(names = { "--limit" }, description = "Stop each file after the first N queries")
    private Long recordLimit;

    @Option(names = { "--json" }, description = "JSON output file for structured report data")
    private String jsonOutputFile;

    @Option(names = { "-c", "--csv" }, description = "CSV output file with per-template statistics")
    private String csvOutputFile;

    @Option(names = { "--store" }, description = "Data directory to save the analysis in")
    private String storeDir;

    @Option(names = { "--text" }, description = "Print the report to the console")
    private boolean textOutput = false;

    @Option(names = { "--top" }, description = "Number of templates, users and tables in the console report (default: ${DEFAULT-VALUE})")
    private int top = 10;

    @Option(names = { "--filter" }, description = "JSON filter, e.g. '{\"statement_type\":\"SELECT\",\"min_query_time\":5}'; prints the matching slowest queries")
    private String filterJson;

    @Override
    public Integer call() throws Exception {
        AnalyzerConfig config = loadConfiguration();
        if (recordLimit != null) {
            config.setMaxRecords(recordLimit);
        }
        AnalysisStore store = storeDir != null ? new AnalysisStore(Paths.get(storeDir), config) : null;
        AnalysisService service = new AnalysisService(config, store);

        List<Path> files = new ArrayList<>();
        for (String fileName : fileNames) {
            files.add(Paths.get(fileName));
        }
        String analysisName = name != null ? name : files.get(0).getFileName().toString();

        AnalysisResult result = analyze(service, files, analysisName);
        if (result == null) {
            System.err.println("No files were successfully processed. Exiting without generating reports.");
            return 1;
        }

        if (textOutput) {
            TextReport.report(result, System.out, top);
        }
        if (csvOutputFile != null) {
            logger.info("Generating CSV report: {}", csvOutputFile);
            TextReport.reportCsv(result, csvOutputFile);
        }
        if (jsonOutputFile != null) {
            logger.info("Generating JSON report: {}", jsonOutputFile);
            JsonReportGenerator.generateReport(jsonOutputFile, result, config.getGradeThresholds());
        }
        if (store != null) {
            store.save(result);
        }
        if (filterJson != null) {
            printFiltered(service.filter(result, FilterSpec.fromJson(filterJson)));
        }
        return 0;
    }

    private AnalysisResult analyze(AnalysisService service, List<Path> files, String analysisName)
            throws InterruptedException {
        if (files.size() == 1) {
            try {
                return service.parse(files.get(0), analysisName);
            } catch (FileParseException e) {
                System.err.println("Failed to process " + e.getSource() + ": " + e.getCause().getMessage());
                return null;
            }
        }
        ParseOutcome outcome = service.parseAll(files);
        for (FileParseException failure : outcome.getFailures()) {
            System.err.println("Failed to process " + failure.getSource() + ": " + failure.getCause().getMessage());
        }
        List<AnalysisResult> results = outcome.getResults();
        if (results.isEmpty()) {
            return null;
        }
        if (results.size() == 1) {
            return results.get(0);
        }
        return service.merge(results, analysisName);
    }

    private void printFiltered(FilteredView view) {
        RecordPage page = view.page(1, top);
        System.out.printf("%d of %d queries match %s%n", view.size(), view.getSource().getTotalQueries(),
                view.getSpec());
        for (AnalyzedQuery query : page.getItems()) {
            SlowQuery record = query.getRecord();
            System.out.printf("%10.3f %10d  %-20s %s%n", record.getQueryTime(), record.getRowsExamined(),
                    record.getUser(), query.getTemplate().getNormalizedText());
        }
    }

    private AnalyzerConfig loadConfiguration() throws IOException {
        if (configFile != null) {
            return AnalyzerConfig.load(Paths.get(configFile));
        }
        return AnalyzerConfig.loadDefaults();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SlowLogAnalyzer()).execute(args);
        System.exit(exitCode);
    }
}
