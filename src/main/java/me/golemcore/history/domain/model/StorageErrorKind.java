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

/**
 * Classification of storage failures surfaced through
 * {@link StorageOperationResult}.
 */
public enum StorageErrorKind {

    /**
     * A required source (e.g. a backup directory) does not exist. Missing bucket
     * files are never reported this way; they read as empty.
     */
    NOT_FOUND,

    /**
     * Permission, disk or truncated-write failures.
     */
    IO_FAILURE,

    /**
     * Malformed JSON or gzip data in a bucket or index file.
     */
    CORRUPTION,

    /**
     * Caller supplied an unusable argument.
     */
    INVALID_ARGUMENT
}
