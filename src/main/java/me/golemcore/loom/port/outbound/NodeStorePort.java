package me.golemcore.loom.port.outbound;

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
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.model.RootData;

import java.util.List;
import java.util.Optional;

/**
 * Keyed, durable storage of roots and nodes.
 *
 * <p>
 * Every mutation is durable before it returns and is applied as a unit: a node
 * and the parent record listing it become visible together or not at all.
 * Returned objects are copies; mutating them does not change stored state.
 */
public interface NodeStorePort {

    RootData createRoot(RootConfig config);

    Optional<RootData> getRoot(String rootId);

    List<RootData> listRoots();

    /**
     * Creates a node under {@code parentId}, or a root-level node of
     * {@code rootId} when {@code parentId} is null.
     *
     * @throws me.golemcore.loom.domain.exception.NodeNotFoundException
     *             if the parent or root is unknown
     * @throws me.golemcore.loom.domain.exception.ValidationException
     *             if the message or metadata is malformed
     * @throws me.golemcore.loom.domain.exception.StoreIOException
     *             if persistence fails; stored state is unchanged
     */
    NodeData createNode(String rootId, String parentId, NodeMessage message, NodeMetadata metadata);

    Optional<NodeData> getNode(String nodeId);

    /**
     * Children in creation order; empty for a leaf or an unknown id.
     */
    List<NodeData> getChildren(String nodeId);

    /**
     * Root-level nodes of a root ordered by message timestamp, then id.
     */
    List<NodeData> listRootNodes(String rootId);

    /**
     * Replaces the metadata of a node with {@code metadata} as given.
     */
    NodeData updateNodeMetadata(String nodeId, NodeMetadata metadata);

    /**
     * Number of nodes in the store, used to bound ancestor walks.
     */
    int nodeCount();
}
