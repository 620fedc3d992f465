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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One message placed at a specific point of a conversation tree.
 *
 * <p>
 * Relations are expressed only through identifiers: {@code parentId} points up
 * (null for a root-level node) and {@code childIds} lists children in creation
 * order. {@code rootId} names the {@link RootData} that owns the tree.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeData {

    private String id;
    private String rootId;
    private String parentId;
    private NodeMessage message;

    @Builder.Default
    private List<String> childIds = new ArrayList<>();

    @Builder.Default
    private NodeMetadata metadata = NodeMetadata.empty();

    @JsonIgnore
    public boolean isRootLevel() {
        return parentId == null;
    }

    /**
     * Copy that shares no mutable collections with this instance.
     */
    public NodeData copy() {
        return toBuilder()
                .childIds(childIds != null ? new ArrayList<>(childIds) : new ArrayList<>())
                .metadata(metadata != null ? metadata.copy() : NodeMetadata.empty())
                .build();
    }
}
