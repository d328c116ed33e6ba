package com.slowlog.analyzer.sql;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Canonical form of a statement: literals replaced by {@code ?}, plus the statement type and referenced tables.
 */
public class SqlTemplate {

    public static final SqlTemplate EMPTY = new SqlTemplate("", StatementType.OTHER, Collections.emptySet());

    private final String normalizedText;
    private final StatementType statementType;
    private final SortedSet<String> tables;

    public SqlTemplate(String normalizedText, StatementType statementType, Collection<String> tables) {
        this.normalizedText = normalizedText == null ? "" : normalizedText;
        this.statementType = statementType == null ? StatementType.OTHER : statementType;
        this.tables = Collections.unmodifiableSortedSet(new TreeSet<>(tables));
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public StatementType getStatementType() {
        return statementType;
    }

    public SortedSet<String> getTables() {
        return tables;
    }

    public boolean isEmpty() {
        return normalizedText.isEmpty();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + normalizedText.hashCode();
        result = prime * result + statementType.hashCode();
        result = prime * result + tables.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        SqlTemplate other = (SqlTemplate) obj;
        return normalizedText.equals(other.normalizedText) && statementType == other.statementType
                && tables.equals(other.tables);
    }

    @Override
    public String toString() {
        return statementType + " " + normalizedText + " " + tables;
    }
}
