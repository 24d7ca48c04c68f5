/*
 * Copyright 2026 The FlowLedger Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.flowledger.workflow.store;

import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Binding and column helpers shared by the R2DBC stores.
 */
final class SqlSupport {

    private SqlSupport() {
    }

    static GenericExecuteSpec bindNullable(GenericExecuteSpec spec, String name, Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    static GenericExecuteSpec bindTimestamp(GenericExecuteSpec spec, String name, Instant value) {
        return value != null
                ? spec.bind(name, value.atOffset(ZoneOffset.UTC))
                : spec.bindNull(name, OffsetDateTime.class);
    }

    static Instant timestamp(Readable row, String column) {
        OffsetDateTime value = row.get(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static long longValue(Readable row, String column) {
        Number value = (Number) row.get(column);
        return value != null ? value.longValue() : 0L;
    }

    static int intValue(Readable row, String column) {
        Number value = (Number) row.get(column);
        return value != null ? value.intValue() : 0;
    }

    static boolean boolValue(Readable row, String column) {
        Boolean value = row.get(column, Boolean.class);
        return Boolean.TRUE.equals(value);
    }
}
