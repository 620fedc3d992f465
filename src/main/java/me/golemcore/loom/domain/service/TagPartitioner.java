package me.golemcore.loom.domain.service;

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

import me.golemcore.loom.domain.model.NodeData;

import java.util.ArrayList;
import java.util.List;

/**
 * Orders sibling nodes for display: nodes carrying a tag first, everything else
 * after, each group in its original order.
 */
public final class TagPartitioner {

    private TagPartitioner() {
    }

    public static List<NodeData> partitionByTag(List<NodeData> children, String tag) {
        if (children == null || children.isEmpty()) {
            return List.of();
        }
        List<NodeData> tagged = new ArrayList<>();
        List<NodeData> rest = new ArrayList<>();
        for (NodeData child : children) {
            if (child.getMetadata() != null && child.getMetadata().hasTag(tag)) {
                tagged.add(child);
            } else {
                rest.add(child);
            }
        }
        tagged.addAll(rest);
        return tagged;
    }
}
