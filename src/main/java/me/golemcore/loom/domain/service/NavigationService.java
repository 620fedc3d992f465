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
import me.golemcore.loom.domain.exception.NodeNotFoundException;
import me.golemcore.loom.domain.exception.ValidationException;
import me.golemcore.loom.domain.model.NavigationView;
import me.golemcore.loom.domain.model.NodeData;
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.PathResult;
import me.golemcore.loom.infrastructure.config.LoomProperties;
import me.golemcore.loom.port.inbound.ForestPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Session-level navigation over a conversation tree.
 *
 * <p>
 * Opening a node records it as the current position, builds its history and
 * lists its children with unread alternatives first. Visiting a node that has
 * a parent marks it read by dropping the unread tag; root-level nodes keep
 * their tags.
 *
 * <p>
 * Unread tags are applied only when a caller appends several generated
 * alternatives at once; a single reply, or a message the user typed, is read
 * by definition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavigationService {

    private final ForestPort forest;
    private final CurrentNodePointerService pointerService;
    private final LoomProperties properties;
    private final Clock clock;

    public NavigationView navigateTo(String nodeId) {
        NodeData node = forest.getNode(nodeId).orElseThrow(() -> NodeNotFoundException.node(nodeId));

        PathResult history = forest.getPath(null, nodeId);
        List<NodeData> children = TagPartitioner.partitionByTag(forest.getChildren(nodeId), unreadTag());
        List<String> siblingIds = siblingIdsOf(node);

        List<NodeData> path = history.path();
        if (node.getParentId() != null && node.getMetadata().hasTag(unreadTag())) {
            node = forest.updateNodeMetadata(nodeId, node.getMetadata().minusTag(unreadTag()));
            path = new ArrayList<>(path);
            path.set(path.size() - 1, node);
            log.debug("[Navigation] Marked node {} as read", nodeId);
        }

        pointerService.setCurrentNodeId(nodeId);
        log.debug("[Navigation] Current node: {} (depth {}, {} children)", nodeId, path.size(), children.size());
        return NavigationView.builder()
                .root(history.root())
                .node(node)
                .history(List.copyOf(path))
                .children(children)
                .siblingIds(siblingIds)
                .build();
    }

    /**
     * Reopens the node recorded by the previous session, if it still exists.
     */
    public Optional<NavigationView> resume() {
        Optional<String> pointer = pointerService.getCurrentNodeId();
        if (pointer.isEmpty()) {
            return Optional.empty();
        }
        if (forest.getNode(pointer.get()).isEmpty()) {
            log.warn("[Navigation] Stored current node {} no longer exists", pointer.get());
            return Optional.empty();
        }
        return Optional.of(navigateTo(pointer.get()));
    }

    /**
     * Parent of the node, or the node itself at root level.
     */
    public String up(String nodeId) {
        NodeData node = requireNode(nodeId);
        return node.getParentId() != null ? node.getParentId() : nodeId;
    }

    /**
     * Previous sibling, or the node itself when it is the first one.
     */
    public String left(String nodeId) {
        return stepSibling(nodeId, -1);
    }

    /**
     * Next sibling, or the node itself when it is the last one.
     */
    public String right(String nodeId) {
        return stepSibling(nodeId, 1);
    }

    public NodeData appendUserMessage(String parentId, String content) {
        return forest.createMessageNode(parentId, NodeMessage.user(content, clock.instant()));
    }

    /**
     * Appends generated alternatives under {@code parentId}. When more than one
     * alternative is given they are all tagged unread.
     */
    public List<NodeData> appendAssistantReplies(String parentId, List<String> contents, String sourceModel) {
        if (parentId == null) {
            throw new ValidationException("assistant replies need a parent node");
        }
        if (contents == null || contents.isEmpty()) {
            throw new ValidationException("at least one reply is required");
        }
        boolean markUnread = contents.size() > 1;
        List<NodeData> created = new ArrayList<>(contents.size());
        for (String content : contents) {
            NodeMetadata metadata = NodeMetadata.builder().sourceModel(sourceModel).build();
            if (markUnread) {
                metadata = metadata.plusTag(unreadTag());
            }
            created.add(forest.createMessageNode(null, parentId, NodeMessage.assistant(content, clock.instant()),
                    metadata));
        }
        log.debug("[Navigation] Appended {} replies under {}", created.size(), parentId);
        return created;
    }

    private String stepSibling(String nodeId, int offset) {
        NodeData node = requireNode(nodeId);
        List<String> siblings = siblingIdsOf(node);
        int index = siblings.indexOf(nodeId);
        int target = index + offset;
        if (index < 0 || target < 0 || target >= siblings.size()) {
            return nodeId;
        }
        return siblings.get(target);
    }

    private List<String> siblingIdsOf(NodeData node) {
        if (node.getParentId() == null) {
            return List.of(node.getId());
        }
        return forest.getNode(node.getParentId())
                .map(parent -> List.copyOf(parent.getChildIds()))
                .orElse(List.of(node.getId()));
    }

    private NodeData requireNode(String nodeId) {
        return forest.getNode(nodeId).orElseThrow(() -> NodeNotFoundException.node(nodeId));
    }

    private String unreadTag() {
        return properties.getNavigation().getUnreadTag();
    }
}
