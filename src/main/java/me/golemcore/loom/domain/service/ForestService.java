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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.loom.domain.exception.CorruptStoreException;
import me.golemcore.loom.domain.exception.ValidationException;
import me.golemcore.loom.domain.model.NodeData;
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.PathResult;
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.model.RootData;
import me.golemcore.loom.port.inbound.ForestPort;
import me.golemcore.loom.port.outbound.NodeStorePort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Tree-aware facade over the node store. Errors from the store pass through
 * unchanged; a missing ancestor met during a path walk is reported as an
 * invalid range.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ForestService implements ForestPort {

    private final NodeStorePort nodeStore;

    @Override
    public RootData createRoot(RootConfig config) {
        return nodeStore.createRoot(config);
    }

    @Override
    public Optional<RootData> getRoot(String rootId) {
        return nodeStore.getRoot(rootId);
    }

    @Override
    public List<RootData> listRoots() {
        return nodeStore.listRoots();
    }

    @Override
    public NodeData createMessageNode(String parentId, NodeMessage message) {
        if (parentId != null) {
            return nodeStore.createNode(null, parentId, message, NodeMetadata.empty());
        }
        List<RootData> roots = nodeStore.listRoots();
        if (roots.size() != 1) {
            throw new ValidationException("A root-level node needs an explicit rootId when the store holds "
                    + roots.size() + " roots");
        }
        return nodeStore.createNode(roots.get(0).getId(), null, message, NodeMetadata.empty());
    }

    @Override
    public NodeData createMessageNode(String rootId, String parentId, NodeMessage message, NodeMetadata metadata) {
        return nodeStore.createNode(rootId, parentId, message, metadata);
    }

    @Override
    public Optional<NodeData> getNode(String nodeId) {
        return nodeStore.getNode(nodeId);
    }

    @Override
    public List<NodeData> getChildren(String nodeId) {
        return nodeStore.getChildren(nodeId);
    }

    @Override
    public PathResult getPath(String from, String to) {
        List<NodeData> path = PathResolver.resolve(nodeStore::getNode, from, to, nodeStore.nodeCount());
        NodeData target = path.isEmpty()
                ? nodeStore.getNode(to).orElseThrow()
                : path.get(path.size() - 1);
        RootData root = nodeStore.getRoot(target.getRootId())
                .orElseThrow(() -> new CorruptStoreException(
                        List.of("node " + target.getId() + " references unknown root " + target.getRootId())));
        log.debug("[Forest] Path {} -> {}: {} nodes", from, to, path.size());
        return new PathResult(root, path);
    }

    @Override
    public NodeData updateNodeMetadata(String nodeId, NodeMetadata metadata) {
        return nodeStore.updateNodeMetadata(nodeId, metadata);
    }
}
