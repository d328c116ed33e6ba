package com.slowlog.analyzer;

import java.util.Objects;

/**
 * One entry of a MySQL slow query log.
 * <p>
 * Optional header values are {@code null} when the entry did not carry them. Numeric metrics default to 0,
 * in which case {@link #isIncomplete()} tells whether the default was filled in by the parser.
 */
public class SlowQuery {

    private final String sourceId;
    private final String time;
    private final Long timestamp;
    private final String user;
    private final String host;
    private final Long connectionId;
    private final Long threadId;
    private final String schema;
    private final String qcHit;
    private final double queryTime;
    private final double lockTime;
    private final long rowsSent;
    private final long rowsExamined;
    private final Long rowsAffected;
    private final Long bytesSent;
    private final String db;
    private final String sql;
    private final boolean incomplete;

    private SlowQuery(Builder b) {
        this.sourceId = Objects.requireNonNull(b.sourceId, "sourceId");
        this.time = b.time;
        this.timestamp = b.timestamp;
        this.user = b.user != null ? b.user : "";
        this.host = b.host != null ? b.host : "";
        this.connectionId = b.connectionId;
        this.threadId = b.threadId;
        this.schema = b.schema;
        this.qcHit = b.qcHit;
        this.queryTime = Math.max(0.0, b.queryTime);
        this.lockTime = Math.max(0.0, b.lockTime);
        this.rowsSent = Math.max(0L, b.rowsSent);
        this.rowsExamined = Math.max(0L, b.rowsExamined);
        this.rowsAffected = b.rowsAffected;
        this.bytesSent = b.bytesSent;
        this.db = b.db;
        this.sql = b.sql != null ? b.sql : "";
        this.incomplete = b.incomplete;
    }

    public static Builder builder(String sourceId) {
        return new Builder(sourceId);
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * Value of the {@code # Time:} header, carried forward from the previous entry when this one had none.
     */
    public String getTime() {
        return time;
    }

    /**
     * Epoch seconds from {@code SET timestamp=...;}.
     */
    public Long getTimestamp() {
        return timestamp;
    }

    public String getUser() {
        return user;
    }

    public String getHost() {
        return host;
    }

    public Long getConnectionId() {
        return connectionId;
    }

    public Long getThreadId() {
        return threadId;
    }

    public String getSchema() {
        return schema;
    }

    public String getQcHit() {
        return qcHit;
    }

    public double getQueryTime() {
        return queryTime;
    }

    public double getLockTime() {
        return lockTime;
    }

    public long getRowsSent() {
        return rowsSent;
    }

    public long getRowsExamined() {
        return rowsExamined;
    }

    public Long getRowsAffected() {
        return rowsAffected;
    }

    public Long getBytesSent() {
        return bytesSent;
    }

    public String getDb() {
        return db;
    }

    public String getSql() {
        return sql;
    }

    public boolean isIncomplete() {
        return incomplete;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, time, timestamp, user, host, connectionId, threadId, schema, qcHit,
                queryTime, lockTime, rowsSent, rowsExamined, rowsAffected, bytesSent, db, sql, incomplete);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        SlowQuery other = (SlowQuery) obj;
        return Double.compare(queryTime, other.queryTime) == 0
                && Double.compare(lockTime, other.lockTime) == 0
                && rowsSent == other.rowsSent
                && rowsExamined == other.rowsExamined
                && incomplete == other.incomplete
                && sourceId.equals(other.sourceId)
                && user.equals(other.user)
                && host.equals(other.host)
                && sql.equals(other.sql)
                && Objects.equals(time, other.time)
                && Objects.equals(timestamp, other.timestamp)
                && Objects.equals(connectionId, other.connectionId)
                && Objects.equals(threadId, other.threadId)
                && Objects.equals(schema, other.schema)
                && Objects.equals(qcHit, other.qcHit)
                && Objects.equals(rowsAffected, other.rowsAffected)
                && Objects.equals(bytesSent, other.bytesSent)
                && Objects.equals(db, other.db);
    }

    @Override
    public String toString() {
        return String.format("%s [%s@%s] %.6fs rows=%d/%d %s", sourceId, user, host, queryTime, rowsSent,
                rowsExamined, sql.length() > 80 ? sql.substring(0, 77) + "..." : sql);
    }

    public static class Builder {

        private final String sourceId;
        private String time;
        private Long timestamp;
        private String user;
        private String host;
        private Long connectionId;
        private Long threadId;
        private String schema;
        private String qcHit;
        private double queryTime;
        private double lockTime;
        private long rowsSent;
        private long rowsExamined;
        private Long rowsAffected;
        private Long bytesSent;
        private String db;
        private String sql;
        private boolean incomplete;

        private Builder(String sourceId) {
            this.sourceId = sourceId;
        }

        public Builder time(String time) {
            this.time = time;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder connectionId(Long connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder threadId(Long threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder qcHit(String qcHit) {
            this.qcHit = qcHit;
            return this;
        }

        public Builder queryTime(double queryTime) {
            this.queryTime = queryTime;
            return this;
        }

        public Builder lockTime(double lockTime) {
            this.lockTime = lockTime;
            return this;
        }

        public Builder rowsSent(long rowsSent) {
            this.rowsSent = rowsSent;
            return this;
        }

        public Builder rowsExamined(long rowsExamined) {
            this.rowsExamined = rowsExamined;
            return this;
        }

        public Builder rowsAffected(Long rowsAffected) {
            this.rowsAffected = rowsAffected;
            return this;
        }

        public Builder bytesSent(Long bytesSent) {
            this.bytesSent = bytesSent;
            return this;
        }

        public Builder db(String db) {
            this.db = db;
            return this;
        }

        public Builder sql(String sql) {
            this.sql = sql;
            return this;
        }

        public Builder incomplete(boolean incomplete) {
            this.incomplete = incomplete;
            return this;
        }

        public SlowQuery build() {
            return new SlowQuery(this);
        }
    }
}
