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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Estimated execution plan returned by {@code explainQuery}. Filters are
 * evaluated in input order; the planner never reorders them.
 */
@Data
@Builder
public class QueryPlan {

    private long estimatedCost;
    private List<String> indexesUsed;
    private int bucketsScan;
    private List<String> filterOrder;
    private boolean sortRequired;
    private boolean aggregationRequired;
}
