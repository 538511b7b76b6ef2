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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Options of a plain query. Pagination is applied after filtering and sorting,
 * projection last. A {@code limit} or {@code skip} that is null or not positive
 * is ignored; a missing {@code timeRange} means everything up to now.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonPropertyOrder({ "sort", "limit", "skip", "select", "timeRange" })
public class QueryOptions {

    List<SortSpec> sort;
    Integer limit;
    Integer skip;
    List<String> select;
    TimeRange timeRange;

    public static QueryOptions none() {
        return QueryOptions.builder().build();
    }

    public List<SortSpec> sortOrEmpty() {
        return sort != null ? sort : List.of();
    }

    public List<String> selectOrEmpty() {
        return select != null ? select : List.of();
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }

    public boolean hasSkip() {
        return skip != null && skip > 0;
    }
}
