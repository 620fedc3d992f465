package me.golemcore.loom.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generation parameters recorded with a conversation root. Recognized options
 * are typed fields; anything else a provider needs goes into the bounded
 * {@code extra} map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelParameters {

    private Integer maxTokens;
    private Double temperature;

    @Builder.Default
    private Map<String, String> extra = new LinkedHashMap<>();

    public ModelParameters copy() {
        return new ModelParameters(maxTokens, temperature,
                extra != null ? new LinkedHashMap<>(extra) : new LinkedHashMap<>());
    }
}
