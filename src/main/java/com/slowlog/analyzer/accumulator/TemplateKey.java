package com.slowlog.analyzer.accumulator;

import com.slowlog.analyzer.sql.StatementType;

public class TemplateKey {

    private final String normalizedText;
    private final StatementType statementType;

    public TemplateKey(String normalizedText, StatementType statementType) {
        this.normalizedText = normalizedText;
        this.statementType = statementType;
    }

    public String getNormalizedText() {
        return normalizedText;
    }

    public StatementType getStatementType() {
        return statementType;
    }

    public String toString() {
        return statementType + ": " + normalizedText;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + ((normalizedText == null) ? 0 : normalizedText.hashCode());
        result = prime * result + ((statementType == null) ? 0 : statementType.hashCode());
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
        TemplateKey other = (TemplateKey) obj;
        if (normalizedText == null) {
            if (other.normalizedText != null)
                return false;
        } else if (!normalizedText.equals(other.normalizedText))
            return false;
        if (statementType != other.statementType)
            return false;
        return true;
    }
}
