package me.golemcore.history.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive time range with optional pagination, as accepted by the storage
 * engine. A {@code limit} or {@code offset} that is null or not positive is
 * ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRange {

    private long start;
    private long end;
    private Integer limit;
    private Integer offset;

    public static QueryRange of(long start, long end) {
        return QueryRange.builder().start(start).end(end).build();
    }

    public static QueryRange of(TimeRange range) {
        return of(range.getStart(), range.getEnd());
    }
}
