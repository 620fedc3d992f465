package me.golemcore.loom.port.inbound;

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
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.PathResult;
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.model.RootData;

import java.util.List;
import java.util.Optional;

/**
 * Tree-aware API over the conversation store. This is the port front ends
 * (terminal, web) use to read and extend a branching conversation.
 */
public interface ForestPort {

    RootData createRoot(RootConfig config);

    Optional<RootData> getRoot(String rootId);

    List<RootData> listRoots();

    /**
     * Appends a message under {@code parentId}. A null parent creates a
     * root-level node of the only root in the store.
     */
    NodeData createMessageNode(String parentId, NodeMessage message);

    /**
     * Appends a message with caller-supplied metadata, for example an
     * {@code unread} tag on generated alternatives.
     */
    NodeData createMessageNode(String rootId, String parentId, NodeMessage message, NodeMetadata metadata);

    Optional<NodeData> getNode(String nodeId);

    List<NodeData> getChildren(String nodeId);

    /**
     * Message history between two points of the tree.
     *
     * @param from
     *            ancestor to stop at (excluded), or null to walk up to the
     *            root-level node (included)
     * @param to
     *            last node of the path (included)
     * @throws me.golemcore.loom.domain.exception.NodeNotFoundException
     *             if {@code to} is unknown
     * @throws me.golemcore.loom.domain.exception.InvalidRangeException
     *             if {@code from} is not an ancestor of {@code to}
     */
    PathResult getPath(String from, String to);

    NodeData updateNodeMetadata(String nodeId, NodeMetadata metadata);
}
