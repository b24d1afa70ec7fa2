/*
 * Copyright Debezium Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgjson.encoder.spi;

import java.time.OffsetDateTime;

import org.postgresql.replication.LogSequenceNumber;

import io.pgjson.annotation.Immutable;

/**
 * The decoded transaction a change or message belongs to, together with the replication slot horizons that were
 * current when it was decoded.
 */
@Immutable
public final class TransactionInfo {

    private final long xid;
    private final LogSequenceNumber firstLsn;
    private final LogSequenceNumber endLsn;
    private final LogSequenceNumber commitLsn;
    private final OffsetDateTime commitTime;
    private final long slotXmin;
    private final long slotCatalogXmin;
    private final long nextXid;
    private final long nextXidEpoch;

    private TransactionInfo(Builder builder) {
        this.xid = builder.xid;
        this.firstLsn = builder.firstLsn;
        this.endLsn = builder.endLsn;
        this.commitLsn = builder.commitLsn;
        this.commitTime = builder.commitTime;
        this.slotXmin = builder.slotXmin;
        this.slotCatalogXmin = builder.slotCatalogXmin;
        this.nextXid = builder.nextXid;
        this.nextXidEpoch = builder.nextXidEpoch;
    }

    public static Builder builder(long xid) {
        return new Builder(xid);
    }

    public long xid() {
        return xid;
    }

    /**
     * @return the location of the first record of the transaction
     */
    public LogSequenceNumber firstLsn() {
        return firstLsn;
    }

    /**
     * @return the location just past the commit record
     */
    public LogSequenceNumber endLsn() {
        return endLsn;
    }

    public LogSequenceNumber commitLsn() {
        return commitLsn;
    }

    public OffsetDateTime commitTime() {
        return commitTime;
    }

    public long slotXmin() {
        return slotXmin;
    }

    public long slotCatalogXmin() {
        return slotCatalogXmin;
    }

    public long nextXid() {
        return nextXid;
    }

    public long nextXidEpoch() {
        return nextXidEpoch;
    }

    @Override
    public String toString() {
        return "TransactionInfo [xid=" + xid + ", firstLsn=" + firstLsn.asString() + ", endLsn=" + endLsn.asString() + ", commitLsn="
                + commitLsn.asString() + ", commitTime=" + commitTime + "]";
    }

    public static final class Builder {
        private final long xid;
        private LogSequenceNumber firstLsn = LogSequenceNumber.INVALID_LSN;
        private LogSequenceNumber endLsn = LogSequenceNumber.INVALID_LSN;
        private LogSequenceNumber commitLsn = LogSequenceNumber.INVALID_LSN;
        private OffsetDateTime commitTime;
        private long slotXmin;
        private long slotCatalogXmin;
        private long nextXid;
        private long nextXidEpoch;

        private Builder(long xid) {
            this.xid = xid;
        }

        public Builder firstLsn(LogSequenceNumber firstLsn) {
            this.firstLsn = firstLsn;
            return this;
        }

        public Builder endLsn(LogSequenceNumber endLsn) {
            this.endLsn = endLsn;
            return this;
        }

        public Builder commitLsn(LogSequenceNumber commitLsn) {
            this.commitLsn = commitLsn;
            return this;
        }

        public Builder commitTime(OffsetDateTime commitTime) {
            this.commitTime = commitTime;
            return this;
        }

        public Builder slotXmins(long slotXmin, long slotCatalogXmin) {
            this.slotXmin = slotXmin;
            this.slotCatalogXmin = slotCatalogXmin;
            return this;
        }

        public Builder nextXid(long nextXid, long epoch) {
            this.nextXid = nextXid;
            this.nextXidEpoch = epoch;
            return this;
        }

        public TransactionInfo build() {
            return new TransactionInfo(this);
        }
    }
}
