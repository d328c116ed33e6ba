package com.slowlog.analyzer.accumulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.slowlog.analyzer.model.AnalyzedQuery;
import com.slowlog.analyzer.sql.StatementType;

/**
 * Dataset wide distributions: statement types, execution time buckets, users, tables and basic query time
 * statistics.
 */
public class GlobalSummary {

    private final Map<StatementType, Long> typeCounts = new EnumMap<>(StatementType.class);
    private final Map<StatementType, TypePerformance> typePerformance = new EnumMap<>(StatementType.class);
    private final Map<String, Long> userCounts = new HashMap<>();
    private final Map<String, Long> tableCounts = new HashMap<>();
    private final TimeHistogram histogram;
    private final DescriptiveStatistics queryTimes = new DescriptiveStatistics();
    private double totalQueryTime;

    public GlobalSummary(double[] histogramBounds) {
        this.histogram = new TimeHistogram(histogramBounds);
    }

    void add(AnalyzedQuery query) {
        StatementType type = query.getTemplate().getStatementType();
        double queryTime = query.getRecord().getQueryTime();

        typeCounts.merge(type, 1L, Long::sum);
        typePerformance.computeIfAbsent(type, t -> new TypePerformance()).add(queryTime);
        histogram.add(queryTime);

        String user = query.getRecord().getUser();
        if (!user.isEmpty()) {
            userCounts.merge(user, 1L, Long::sum);
        }
        for (String table : query.getTemplate().getTables()) {
            tableCounts.merge(table, 1L, Long::sum);
        }

        queryTimes.addValue(queryTime);
        totalQueryTime += queryTime;
    }

    public Map<StatementType, Long> getTypeCounts() {
        return Collections.unmodifiableMap(typeCounts);
    }

    public long getTypeCount(StatementType type) {
        return typeCounts.getOrDefault(type, 0L);
    }

    public Map<StatementType, TypePerformance> getTypePerformance() {
        return Collections.unmodifiableMap(typePerformance);
    }

    public TimeHistogram getHistogram() {
        return histogram;
    }

    public Map<String, Long> getUserCounts() {
        return Collections.unmodifiableMap(userCounts);
    }

    public Map<String, Long> getTableCounts() {
        return Collections.unmodifiableMap(tableCounts);
    }

    public long getTotalQueries() {
        return queryTimes.getN();
    }

    public double getTotalQueryTime() {
        return totalQueryTime;
    }

    public double getMinQueryTime() {
        return queryTimes.getN() > 0 ? queryTimes.getMin() : 0;
    }

    public double getMaxQueryTime() {
        return queryTimes.getN() > 0 ? queryTimes.getMax() : 0;
    }

    public double getMeanQueryTime() {
        return queryTimes.getN() > 0 ? queryTimes.getMean() : 0;
    }

    public double getMedianQueryTime() {
        return queryTimes.getN() > 0 ? queryTimes.getPercentile(50) : 0;
    }

    public List<Map.Entry<String, Long>> topUsers(int n) {
        return top(userCounts, n);
    }

    public List<Map.Entry<String, Long>> topTables(int n) {
        return top(tableCounts, n);
    }

    public SortedSet<String> tables() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(tableCounts.keySet()));
    }

    private static List<Map.Entry<String, Long>> top(Map<String, Long> counts, int n) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        List<Map.Entry<String, Long>> result = new ArrayList<>();
        for (Map.Entry<String, Long> e : entries.subList(0, Math.min(n, entries.size()))) {
            result.add(Map.entry(e.getKey(), e.getValue()));
        }
        return result;
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeCounts, typePerformance, userCounts, tableCounts, histogram);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        GlobalSummary other = (GlobalSummary) obj;
        return typeCounts.equals(other.typeCounts) && typePerformance.equals(other.typePerformance)
                && userCounts.equals(other.userCounts) && tableCounts.equals(other.tableCounts)
                && histogram.equals(other.histogram)
                && Double.compare(totalQueryTime, other.totalQueryTime) == 0;
    }

    /**
     * Count, average and maximum query time of one statement type.
     */
    public static class TypePerformance {

        private long count;
        private double totalQueryTime;
        private double maxQueryTime;

        void add(double queryTime) {
            count++;
            totalQueryTime += queryTime;
            if (queryTime > maxQueryTime) {
                maxQueryTime = queryTime;
            }
        }

        public long getCount() {
            return count;
        }

        public double getAvgQueryTime() {
            return count > 0 ? totalQueryTime / count : 0;
        }

        public double getMaxQueryTime() {
            return maxQueryTime;
        }

        @Override
        public int hashCode() {
            return Objects.hash(count, totalQueryTime, maxQueryTime);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null || getClass() != obj.getClass())
                return false;
            TypePerformance other = (TypePerformance) obj;
            return count == other.count && Double.compare(totalQueryTime, other.totalQueryTime) == 0
                    && Double.compare(maxQueryTime, other.maxQueryTime) == 0;
        }
    }
}
