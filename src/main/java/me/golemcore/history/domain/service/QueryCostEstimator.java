package me.golemcore.history.domain.service;

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

import me.golemcore.history.domain.model.IndexSpec;
import me.golemcore.history.domain.model.QueryFilter;
import me.golemcore.history.domain.model.QueryOptions;
import me.golemcore.history.domain.model.QueryPlan;

import java.util.List;
import java.util.Map;

/**
 * Strategy that turns a query and the declared indexes into an estimated
 * {@link QueryPlan}. Estimates never touch storage.
 */
public interface QueryCostEstimator {

    QueryPlan estimate(List<QueryFilter> filters, QueryOptions options, Map<String, IndexSpec> indexes);
}
