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

import lombok.Getter;

/**
 * Unchecked failure raised inside the storage engine. Data-returning
 * operations complete exceptionally with it; mutating operations translate it
 * into a failed {@link StorageOperationResult}.
 */
@Getter
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final StorageErrorKind kind;

    public StorageException(StorageErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StorageException(StorageErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
