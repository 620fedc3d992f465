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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable annotations of a node.
 *
 * <p>
 * The field set is closed: {@code tags} for labels such as {@code unread}, and
 * {@code sourceModel} for the model that produced an assistant node. Unknown
 * fields found in stored records are dropped on read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeMetadata {

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String sourceModel;

    public static NodeMetadata empty() {
        return new NodeMetadata(new LinkedHashSet<>(), null);
    }

    public static NodeMetadata withTags(String... tags) {
        Set<String> values = new LinkedHashSet<>();
        for (String tag : tags) {
            values.add(tag);
        }
        return new NodeMetadata(values, null);
    }

    public boolean hasTag(String tag) {
        return tags != null && tags.contains(tag);
    }

    /**
     * Returns a copy carrying {@code tag} in addition to the current tags.
     */
    public NodeMetadata plusTag(String tag) {
        Set<String> values = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
        values.add(tag);
        return toBuilder().tags(values).build();
    }

    /**
     * Returns a copy without {@code tag}. Other fields are kept as they are.
     */
    public NodeMetadata minusTag(String tag) {
        Set<String> values = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
        values.remove(tag);
        return toBuilder().tags(values).build();
    }

    /**
     * Deep copy, so callers can never mutate a cached record's tag set.
     */
    public NodeMetadata copy() {
        return toBuilder().tags(tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>()).build();
    }
}
