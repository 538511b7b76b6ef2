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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Descriptor of one physical storage unit: a time range and the file that
 * holds its points. When {@code compressionLevel > 0} the data lives in
 * {@code filePath + ".gz"} instead of {@code filePath}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "timeRange", "granularity", "filePath", "compressionLevel", "encrypted" })
public class StorageBucket {

    private TimeRange timeRange;
    private Granularity granularity;
    private String filePath;
    private int compressionLevel;

    // Capability flag only; bucket files are never encrypted.
    private boolean encrypted;

    @JsonIgnore
    public boolean isCompressed() {
        return compressionLevel > 0;
    }
}
