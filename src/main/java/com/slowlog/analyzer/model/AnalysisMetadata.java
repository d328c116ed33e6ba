package com.slowlog.analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Descriptive information stored alongside an analysis.
 */
public class AnalysisMetadata {

    private final String originalFilename;
    private final String createdAt;
    private final long totalQueries;
    private final long totalTemplates;
    private final MergeInfo mergeInfo;

    public AnalysisMetadata(String originalFilename, String createdAt, long totalQueries, long totalTemplates,
            MergeInfo mergeInfo) {
        this.originalFilename = originalFilename;
        this.createdAt = createdAt;
        this.totalQueries = totalQueries;
        this.totalTemplates = totalTemplates;
        this.mergeInfo = mergeInfo;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    /** ISO-8601 instant. */
    public String getCreatedAt() {
        return createdAt;
    }

    public long getTotalQueries() {
        return totalQueries;
    }

    public long getTotalTemplates() {
        return totalTemplates;
    }

    /** Present only on merged analyses. */
    public MergeInfo getMergeInfo() {
        return mergeInfo;
    }

    public boolean isMerged() {
        return mergeInfo != null;
    }

    @Override
    public int hashCode() {
        return Objects.hash(originalFilename, createdAt, totalQueries, totalTemplates, mergeInfo);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        AnalysisMetadata other = (AnalysisMetadata) obj;
        return totalQueries == other.totalQueries && totalTemplates == other.totalTemplates
                && Objects.equals(originalFilename, other.originalFilename)
                && Objects.equals(createdAt, other.createdAt) && Objects.equals(mergeInfo, other.mergeInfo);
    }

    public static class MergeInfo {

        private final List<String> mergedFrom;
        private final String mergeTime;
        private final List<SourceDetail> sourceDetails;

        public MergeInfo(List<String> mergedFrom, String mergeTime, List<SourceDetail> sourceDetails) {
            this.mergedFrom = Collections.unmodifiableList(new ArrayList<>(mergedFrom));
            this.mergeTime = mergeTime;
            this.sourceDetails = Collections.unmodifiableList(new ArrayList<>(sourceDetails));
        }

        public List<String> getMergedFrom() {
            return mergedFrom;
        }

        public String getMergeTime() {
            return mergeTime;
        }

        public List<SourceDetail> getSourceDetails() {
            return sourceDetails;
        }

        @Override
        public int hashCode() {
            return Objects.hash(mergedFrom, mergeTime, sourceDetails);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null || getClass() != obj.getClass())
                return false;
            MergeInfo other = (MergeInfo) obj;
            return mergedFrom.equals(other.mergedFrom) && Objects.equals(mergeTime, other.mergeTime)
                    && sourceDetails.equals(other.sourceDetails);
        }
    }

    /**
     * Size of one input of a merge.
     */
    public static class SourceDetail {

        private final String name;
        private final long totalQueries;
        private final long totalTemplates;

        public SourceDetail(String name, long totalQueries, long totalTemplates) {
            this.name = name;
            this.totalQueries = totalQueries;
            this.totalTemplates = totalTemplates;
        }

        public String getName() {
            return name;
        }

        public long getTotalQueries() {
            return totalQueries;
        }

        public long getTotalTemplates() {
            return totalTemplates;
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, totalQueries, totalTemplates);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (obj == null || getClass() != obj.getClass())
                return false;
            SourceDetail other = (SourceDetail) obj;
            return totalQueries == other.totalQueries && totalTemplates == other.totalTemplates
                    && Objects.equals(name, other.name);
        }
    }
}
