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
 * Outcome of a mutating storage operation. Failures are reported here rather
 * than thrown, so callers can branch without try/catch.
 */
@Data
@Builder
public class StorageOperationResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private int recordsAffected;
    private long executionTimeMs;
    private String error;
    private StorageErrorKind errorKind;

    public static StorageOperationResult success(int recordsAffected, long executionTimeMs) {
        return StorageOperationResult.builder()
                .success(true)
                .recordsAffected(recordsAffected)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static StorageOperationResult failure(StorageErrorKind kind, String error, long executionTimeMs) {
        return StorageOperationResult.builder()
                .success(false)
                .recordsAffected(0)
                .executionTimeMs(executionTimeMs)
                .error(error)
                .errorKind(kind)
                .build();
    }
}
