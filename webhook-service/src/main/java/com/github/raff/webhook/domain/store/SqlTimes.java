package com.github.raff.webhook.domain.store;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** Instant to timestamptz conversions for DatabaseClient binds and row reads. */
final class SqlTimes {

    private SqlTimes() {
    }

    static OffsetDateTime utc(Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    static Instant instant(OffsetDateTime ts) {
        return ts == null ? null : ts.toInstant();
    }
}
