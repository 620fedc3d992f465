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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a front end needs to draw the current position in a tree.
 */
@Value
@Builder
public class NavigationView {

    RootData root;
    NodeData node;
    List<NodeData> history;
    List<NodeData> children;
    List<String> siblingIds;

    /**
     * 1-based position of the node among its siblings.
     */
    public int getSiblingPosition() {
        return siblingIds.indexOf(node.getId()) + 1;
    }

    public boolean hasAlternatives() {
        return siblingIds.size() > 1;
    }
}
