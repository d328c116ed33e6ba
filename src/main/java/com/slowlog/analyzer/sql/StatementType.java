package com.slowlog.analyzer.sql;

import java.util.Locale;

public enum StatementType {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    REPLACE,
    OTHER;

    /**
     * Maps a leading SQL keyword, in any case, to its statement type. Unknown keywords map to OTHER.
     */
    public static StatementType findByKeyword(String word) {
        if (word == null) {
            return OTHER;
        }
        switch (word.toUpperCase(Locale.ROOT)) {
        case "SELECT":
            return SELECT;
        case "INSERT":
            return INSERT;
        case "UPDATE":
            return UPDATE;
        case "DELETE":
            return DELETE;
        case "REPLACE":
            return REPLACE;
        default:
            return OTHER;
        }
    }

    /**
     * Strict lookup by enum name, case-insensitive, for values coming from filters and stored artifacts.
     */
    public static StatementType fromName(String name) {
        for (StatementType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown statement type: " + name);
    }
}
