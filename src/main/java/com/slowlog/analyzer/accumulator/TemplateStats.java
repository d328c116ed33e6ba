package com.slowlog.analyzer.accumulator;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.slowlog.analyzer.SlowQuery;
import com.slowlog.analyzer.sql.SqlTemplate;

/**
 * Running statistics for all executions of one query template.
 */
public class TemplateStats {

    private static final int MAX_SAMPLES = 10000;

    private final SqlTemplate template;

    private long count;
    private double totalQueryTime;
    private double minQueryTime = Double.MAX_VALUE;
    private double maxQueryTime = 0;
    private double totalLockTime;
    private long totalRowsExamined;
    private long totalRowsSent;

    private final SortedSet<String> users = new TreeSet<>();
    private final SortedSet<String> tables = new TreeSet<>();

    // Percentile samples, capped
    private final DescriptiveStatistics executionStats = new DescriptiveStatistics();

    TemplateStats(SqlTemplate template) {
        this.template = template;
    }

    void addExecution(SlowQuery query, SqlTemplate queryTemplate) {
        double queryTime = query.getQueryTime();
        count++;
        totalQueryTime += queryTime;
        if (queryTime > maxQueryTime) {
            maxQueryTime = queryTime;
        }
        if (queryTime < minQueryTime) {
            minQueryTime = queryTime;
        }
        totalLockTime += query.getLockTime();
        totalRowsExamined += query.getRowsExamined();
        totalRowsSent += query.getRowsSent();

        if (!query.getUser().isEmpty()) {
            users.add(query.getUser());
        }
        tables.addAll(queryTemplate.getTables());

        if (executionStats.getN() < MAX_SAMPLES) {
            executionStats.addValue(queryTime);
        }
    }

    public SqlTemplate getTemplate() {
        return template;
    }

    public long getCount() {
        return count;
    }

    public double getTotalQueryTime() {
        return totalQueryTime;
    }

    public double getMinQueryTime() {
        return count > 0 ? minQueryTime : 0;
    }

    public double getMaxQueryTime() {
        return maxQueryTime;
    }

    /**
     * Mean query time, {@code total / count}. The quotient is clamped to [min, max] so that rounding in the
     * running total never reports an average outside the observed range; the clamp only changes the result in
     * the last bits of precision.
     */
    public double getAvgQueryTime() {
        if (count == 0) {
            return 0;
        }
        double avg = totalQueryTime / count;
        return Math.min(Math.max(avg, minQueryTime), maxQueryTime);
    }

    public double getPercentile95() {
        return executionStats.getN() > 0 ? executionStats.getPercentile(95) : 0.0;
    }

    public double getTotalLockTime() {
        return totalLockTime;
    }

    public long getTotalRowsExamined() {
        return totalRowsExamined;
    }

    public long getTotalRowsSent() {
        return totalRowsSent;
    }

    public SortedSet<String> getUsers() {
        return Collections.unmodifiableSortedSet(users);
    }

    public SortedSet<String> getTables() {
        return Collections.unmodifiableSortedSet(tables);
    }

    public PerformanceGrade getGrade() {
        return PerformanceGrade.classify(getAvgQueryTime());
    }

    public PerformanceGrade getGrade(double[] thresholds) {
        return PerformanceGrade.classify(getAvgQueryTime(), thresholds);
    }

    public String toString() {
        return String.format("%-8s %8d %10.3f %10.3f %10.3f %10.3f %12d  %s", template.getStatementType(), count,
                getMinQueryTime(), maxQueryTime, getAvgQueryTime(), getPercentile95(), totalRowsExamined,
                abbreviate(template.getNormalizedText(), 100));
    }

    public String toCsvString() {
        return String.format("%s,%d,%.6f,%.6f,%.6f,%.6f,%.6f,%d,%d,%s,\"%s\"", template.getStatementType(), count,
                getMinQueryTime(), maxQueryTime, getAvgQueryTime(), getPercentile95(), totalQueryTime,
                totalRowsExamined, totalRowsSent, getGrade(), template.getNormalizedText().replace("\"", "\"\""));
    }

    static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    @Override
    public int hashCode() {
        return Objects.hash(template, count, totalQueryTime, getMinQueryTime(), maxQueryTime, totalLockTime,
                totalRowsExamined, totalRowsSent, users, tables);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        TemplateStats other = (TemplateStats) obj;
        return count == other.count && Double.compare(totalQueryTime, other.totalQueryTime) == 0
                && Double.compare(getMinQueryTime(), other.getMinQueryTime()) == 0
                && Double.compare(maxQueryTime, other.maxQueryTime) == 0
                && Double.compare(totalLockTime, other.totalLockTime) == 0
                && totalRowsExamined == other.totalRowsExamined && totalRowsSent == other.totalRowsSent
                && template.equals(other.template) && users.equals(other.users) && tables.equals(other.tables);
    }
}
