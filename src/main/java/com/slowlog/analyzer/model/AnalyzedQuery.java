package com.slowlog.analyzer.model;

import java.util.Objects;

import com.slowlog.analyzer.SlowQuery;
import com.slowlog.analyzer.accumulator.TemplateKey;
import com.slowlog.analyzer.sql.SqlNormalizer;
import com.slowlog.analyzer.sql.SqlTemplate;
import com.slowlog.analyzer.sql.StatementType;

/**
 * A parsed record together with the template of its SQL.
 */
public class AnalyzedQuery {

    private final SlowQuery record;
    private final SqlTemplate template;

    public AnalyzedQuery(SlowQuery record, SqlTemplate template) {
        this.record = Objects.requireNonNull(record, "record");
        this.template = Objects.requireNonNull(template, "template");
    }

    public static AnalyzedQuery of(SlowQuery record) {
        return new AnalyzedQuery(record, SqlNormalizer.normalize(record.getSql()));
    }

    public SlowQuery getRecord() {
        return record;
    }

    public SqlTemplate getTemplate() {
        return template;
    }

    public TemplateKey getKey() {
        return new TemplateKey(template.getNormalizedText(), template.getStatementType());
    }

    public StatementType getStatementType() {
        return template.getStatementType();
    }

    public double getQueryTime() {
        return record.getQueryTime();
    }

    @Override
    public int hashCode() {
        return 31 * record.hashCode() + template.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        AnalyzedQuery other = (AnalyzedQuery) obj;
        return record.equals(other.record) && template.equals(other.template);
    }

    @Override
    public String toString() {
        return record + " -> " + template.getNormalizedText();
    }
}
