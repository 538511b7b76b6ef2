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

/**
 * Outcome of a query engine operation that changes catalogs or settings.
 * Carries the stored value on success and the reason on failure.
 */
@Data
@Builder
public class OperationResult<T> {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private T value;
    private String error;

    public static <T> OperationResult<T> success(T value) {
        return OperationResult.<T>builder()
                .success(true)
                .value(value)
                .build();
    }

    public static <T> OperationResult<T> failure(String error) {
        return OperationResult.<T>builder()
                .success(false)
                .error(error)
                .build();
    }
}
