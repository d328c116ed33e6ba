package com.slowlog.analyzer.filter;

import java.util.List;

import com.slowlog.analyzer.model.AnalyzedQuery;

/**
 * One page of records, numbered from 1.
 */
public class RecordPage {

    private final List<AnalyzedQuery> items;
    private final int page;
    private final int pageSize;
    private final long totalRecords;

    public RecordPage(List<AnalyzedQuery> items, int page, int pageSize, long totalRecords) {
        this.items = items;
        this.page = page;
        this.pageSize = pageSize;
        this.totalRecords = totalRecords;
    }

    public List<AnalyzedQuery> getItems() {
        return items;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public int getTotalPages() {
        return (int) ((totalRecords + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return page < getTotalPages();
    }
}
