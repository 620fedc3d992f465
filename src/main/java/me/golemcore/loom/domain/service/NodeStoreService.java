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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.loom.domain.exception.CorruptStoreException;
import me.golemcore.loom.domain.exception.NodeNotFoundException;
import me.golemcore.loom.domain.exception.StoreIOException;
import me.golemcore.loom.domain.exception.ValidationException;
import me.golemcore.loom.domain.model.NodeData;
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.model.RootData;
import me.golemcore.loom.infrastructure.config.LoomProperties;
import me.golemcore.loom.port.outbound.NodeStorePort;
import me.golemcore.loom.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * File-backed store of conversation roots and message nodes.
 *
 * <p>
 * Every record is one JSON file written atomically through {@link StoragePort}.
 * All records are loaded into an in-memory arena keyed by id when the store
 * opens; reads are served from the arena, writes go to disk first and reach
 * the arena only after they are durable.
 *
 * <p>
 * Creating a child touches two records (the node and its parent). Before
 * either is written, an undo journal holding the new node id and the previous
 * parent image is written atomically. The records are applied, then the
 * journal is deleted, and only then is the creation reported. Any failure
 * before that point is undone: the parent image is restored and the node
 * record removed. A journal left behind by a crash or a failed undo is undone
 * before the next mutation and on the next open, so a creation that was
 * reported as failed never shows up later. No mutation proceeds while a
 * journal is pending, so the restored image can never overwrite newer state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NodeStoreService implements NodeStorePort {

    static final String ROOTS_DIR = "roots";
    static final String NODES_DIR = "nodes";
    static final String JOURNAL_DIR = "journal";
    static final String JOURNAL_FILE = "pending.json";
    private static final String JSON_EXTENSION = ".json";
    private static final int MAX_ID_ATTEMPTS = 16;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final LoomProperties properties;

    private final Object lock = new Object();
    private final Map<String, RootData> roots = new ConcurrentHashMap<>();
    private final Map<String, NodeData> nodes = new ConcurrentHashMap<>();

    private volatile boolean journalPending = false;

    @PostConstruct
    public void open() {
        synchronized (lock) {
            roots.clear();
            nodes.clear();
            recoverJournalLocked();
            loadRecordsLocked();
            if (properties.getStorage().isVerifyOnOpen()) {
                verifyIntegrityLocked();
            }
            log.info("[NodeStore] Opened store: {} roots, {} nodes", roots.size(), nodes.size());
        }
    }

    // ==================== Roots ====================

    @Override
    public RootData createRoot(RootConfig config) {
        NodeRecordValidator.validateRootConfig(config, properties.getStorage().getMaxExtraParameters());
        synchronized (lock) {
            ensureNoPendingJournalLocked();
            String id = allocateId(roots::containsKey);
            RootData root = RootData.builder()
                    .id(id)
                    .config(config)
                    .createdAt(clock.instant())
                    .build();
            RootData stored = root.copy();
            await(storagePort.putTextAtomic(ROOTS_DIR, id + JSON_EXTENSION, toJson(stored)),
                    "write root " + id);
            roots.put(id, stored);
            log.info("[NodeStore] Created root {} (model: {})", id, config.getModel());
            return stored.copy();
        }
    }

    @Override
    public Optional<RootData> getRoot(String rootId) {
        if (rootId == null) {
            return Optional.empty();
        }
        RootData root = roots.get(rootId);
        return root != null ? Optional.of(root.copy()) : Optional.empty();
    }

    @Override
    public List<RootData> listRoots() {
        return roots.values().stream()
                .sorted(Comparator.comparing(RootData::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(RootData::getId))
                .map(RootData::copy)
                .toList();
    }

    // ==================== Nodes ====================

    @Override
    public NodeData createNode(String rootId, String parentId, NodeMessage message, NodeMetadata metadata) {
        NodeRecordValidator.validateMessage(message);
        NodeMetadata effectiveMetadata = metadata != null ? metadata.copy() : NodeMetadata.empty();
        NodeRecordValidator.validateMetadata(effectiveMetadata);

        synchronized (lock) {
            ensureNoPendingJournalLocked();

            NodeData parent = null;
            String effectiveRootId = rootId;
            if (parentId == null) {
                if (rootId == null) {
                    throw new ValidationException("rootId is required for a root-level node");
                }
                if (!roots.containsKey(rootId)) {
                    throw NodeNotFoundException.root(rootId);
                }
            } else {
                parent = nodes.get(parentId);
                if (parent == null) {
                    throw NodeNotFoundException.node(parentId);
                }
                if (rootId != null && !rootId.equals(parent.getRootId())) {
                    throw new ValidationException("Parent " + parentId + " belongs to root " + parent.getRootId()
                            + ", not " + rootId);
                }
                effectiveRootId = parent.getRootId();
            }

            String id = allocateId(nodes::containsKey);
            NodeMessage storedMessage = NodeMessage.builder()
                    .role(message.getRole())
                    .content(message.getContent())
                    .timestamp(message.getTimestamp() != null ? message.getTimestamp() : clock.instant())
                    .build();
            NodeData node = NodeData.builder()
                    .id(id)
                    .rootId(effectiveRootId)
                    .parentId(parentId)
                    .message(storedMessage)
                    .childIds(new ArrayList<>())
                    .metadata(effectiveMetadata)
                    .build();

            if (parent == null) {
                writeNodeRecord(node);
                nodes.put(id, node);
                log.debug("[NodeStore] Created root-level node {} in root {}", id, effectiveRootId);
            } else {
                NodeData updatedParent = parent.copy();
                updatedParent.getChildIds().add(id);
                commitPairLocked(node, updatedParent, parent);
                // child first, so a concurrent reader never sees a dangling child id
                nodes.put(id, node);
                nodes.put(updatedParent.getId(), updatedParent);
                log.debug("[NodeStore] Created node {} under {}", id, parentId);
            }
            return node.copy();
        }
    }

    @Override
    public Optional<NodeData> getNode(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        NodeData node = nodes.get(nodeId);
        return node != null ? Optional.of(node.copy()) : Optional.empty();
    }

    @Override
    public List<NodeData> getChildren(String nodeId) {
        if (nodeId == null) {
            return List.of();
        }
        NodeData node = nodes.get(nodeId);
        if (node == null) {
            return List.of();
        }
        List<NodeData> children = new ArrayList<>(node.getChildIds().size());
        for (String childId : node.getChildIds()) {
            NodeData child = nodes.get(childId);
            if (child != null) {
                children.add(child.copy());
            }
        }
        return children;
    }

    @Override
    public List<NodeData> listRootNodes(String rootId) {
        return nodes.values().stream()
                .filter(NodeData::isRootLevel)
                .filter(node -> Objects.equals(rootId, node.getRootId()))
                .sorted(Comparator.comparing((NodeData node) -> node.getMessage().getTimestamp(),
                        Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(NodeData::getId))
                .map(NodeData::copy)
                .toList();
    }

    @Override
    public NodeData updateNodeMetadata(String nodeId, NodeMetadata metadata) {
        NodeMetadata effectiveMetadata = metadata != null ? metadata.copy() : null;
        NodeRecordValidator.validateMetadata(effectiveMetadata);
        synchronized (lock) {
            ensureNoPendingJournalLocked();
            NodeData current = nodes.get(nodeId);
            if (current == null) {
                throw NodeNotFoundException.node(nodeId);
            }
            NodeData updated = current.toBuilder()
                    .childIds(new ArrayList<>(current.getChildIds()))
                    .metadata(effectiveMetadata)
                    .build();
            writeNodeRecord(updated);
            nodes.put(nodeId, updated);
            log.debug("[NodeStore] Updated metadata of node {}: tags={}", nodeId, effectiveMetadata.getTags());
            return updated.copy();
        }
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    // ==================== Transactions ====================

    private void commitPairLocked(NodeData node, NodeData updatedParent, NodeData previousParent) {
        JournalEntry entry = new JournalEntry(node.getId(), clock.instant(), node.getId(), previousParent);
        await(storagePort.putTextAtomic(JOURNAL_DIR, JOURNAL_FILE, toJson(entry)), "write journal");

        try {
            writeNodeRecord(node);
            writeNodeRecord(updatedParent);
            await(storagePort.deleteObject(JOURNAL_DIR, JOURNAL_FILE), "delete journal");
        } catch (StoreIOException e) {
            undoPairLocked(node.getId(), previousParent, e);
            throw e;
        }
    }

    private void undoPairLocked(String nodeId, NodeData previousParent, StoreIOException cause) {
        try {
            applyUndoLocked(nodeId, previousParent);
            log.warn("[NodeStore] Rolled back creation of node {} under {}: {}", nodeId, previousParent.getId(),
                    cause.getMessage());
        } catch (StoreIOException undoError) {
            // the journal still describes the undo; it runs before the next mutation or open
            journalPending = true;
            cause.addSuppressed(undoError);
            log.error("[NodeStore] Rollback of node {} failed, journal kept: {}", nodeId, undoError.getMessage());
        }
    }

    private void applyUndoLocked(String nodeId, NodeData previousParent) {
        if (previousParent != null) {
            writeNodeRecord(previousParent);
        }
        if (nodeId != null) {
            await(storagePort.deleteObject(NODES_DIR, nodeId + JSON_EXTENSION), "delete node " + nodeId);
        }
        await(storagePort.deleteObject(JOURNAL_DIR, JOURNAL_FILE), "delete journal");
    }

    private void ensureNoPendingJournalLocked() {
        if (!journalPending) {
            return;
        }
        JournalEntry undone = recoverJournalLocked();
        if (undone == null) {
            return;
        }
        if (undone.getNodeId() != null) {
            nodes.remove(undone.getNodeId());
        }
        if (undone.getPreviousParent() != null) {
            nodes.put(undone.getPreviousParent().getId(), undone.getPreviousParent());
        }
    }

    /**
     * Undoes a transaction that never reported success: restores the parent
     * image and removes the half-created node. Returns the undone entry, or
     * {@code null} when no journal was left.
     */
    private JournalEntry recoverJournalLocked() {
        String json = await(storagePort.getText(JOURNAL_DIR, JOURNAL_FILE), "read journal");
        if (json == null || json.isBlank()) {
            journalPending = false;
            return null;
        }
        JournalEntry entry = readValue(json, JournalEntry.class, "journal");
        applyUndoLocked(entry.getNodeId(), entry.getPreviousParent());
        journalPending = false;
        log.info("[NodeStore] Rolled back unfinished transaction {} (node {})", entry.getTxnId(), entry.getNodeId());
        return entry;
    }

    // ==================== Loading and integrity ====================

    private void loadRecordsLocked() {
        for (String file : listJsonFiles(ROOTS_DIR)) {
            String json = await(storagePort.getText(ROOTS_DIR, file), "read root " + file);
            if (json == null) {
                continue;
            }
            RootData root = readValue(json, RootData.class, "root " + file);
            if (!NodeRecordValidator.isValidId(root.getId()) || !file.equals(root.getId() + JSON_EXTENSION)) {
                throw new StoreIOException("Root record " + file + " carries id " + root.getId());
            }
            roots.put(root.getId(), root);
        }
        for (String file : listJsonFiles(NODES_DIR)) {
            String json = await(storagePort.getText(NODES_DIR, file), "read node " + file);
            if (json == null) {
                continue;
            }
            NodeData node = readValue(json, NodeData.class, "node " + file);
            if (!NodeRecordValidator.isValidId(node.getId()) || !file.equals(node.getId() + JSON_EXTENSION)) {
                throw new StoreIOException("Node record " + file + " carries id " + node.getId());
            }
            if (node.getChildIds() == null) {
                node.setChildIds(new ArrayList<>());
            }
            if (node.getMetadata() == null) {
                node.setMetadata(NodeMetadata.empty());
            } else if (node.getMetadata().getTags() == null) {
                node.getMetadata().setTags(new LinkedHashSet<>());
            }
            nodes.put(node.getId(), node);
        }
    }

    private void verifyIntegrityLocked() {
        List<String> problems = new ArrayList<>();
        for (NodeData node : nodes.values()) {
            String id = node.getId();
            if (node.getMessage() == null || node.getMessage().getRole() == null) {
                problems.add("node " + id + " has no valid message");
            }
            if (node.getRootId() == null || !roots.containsKey(node.getRootId())) {
                problems.add("node " + id + " references unknown root " + node.getRootId());
            }
            if (node.getParentId() != null) {
                NodeData parent = nodes.get(node.getParentId());
                if (parent == null) {
                    problems.add("node " + id + " references missing parent " + node.getParentId());
                } else {
                    int listed = Collections.frequency(parent.getChildIds(), id);
                    if (listed != 1) {
                        problems.add("parent " + parent.getId() + " lists child " + id + " " + listed + " times");
                    }
                    if (!Objects.equals(parent.getRootId(), node.getRootId())) {
                        problems.add("node " + id + " and parent " + parent.getId() + " belong to different roots");
                    }
                }
            }
            for (String childId : node.getChildIds()) {
                NodeData child = nodes.get(childId);
                if (child == null) {
                    problems.add("node " + id + " lists missing child " + childId);
                } else if (!id.equals(child.getParentId())) {
                    problems.add("node " + id + " lists child " + childId + " whose parent is "
                            + child.getParentId());
                }
            }
        }
        problems.addAll(findCycles());

        if (!problems.isEmpty()) {
            log.error("[NodeStore] Integrity check failed with {} problems", problems.size());
            throw new CorruptStoreException(problems);
        }
    }

    private List<String> findCycles() {
        List<String> problems = new ArrayList<>();
        Set<String> terminating = new HashSet<>();
        int limit = nodes.size();
        for (NodeData start : nodes.values()) {
            Set<String> walked = new HashSet<>();
            NodeData current = start;
            int steps = 0;
            while (current != null && !terminating.contains(current.getId())) {
                walked.add(current.getId());
                if (current.getParentId() == null || ++steps > limit) {
                    break;
                }
                current = nodes.get(current.getParentId());
            }
            if (steps > limit) {
                problems.add("node " + start.getId() + " has a cyclic ancestor chain");
            } else {
                terminating.addAll(walked);
            }
        }
        return problems;
    }

    // ==================== Helpers ====================

    private List<String> listJsonFiles(String directory) {
        List<String> files = await(storagePort.listObjects(directory, ""), "list " + directory);
        return files.stream()
                .filter(file -> file.endsWith(JSON_EXTENSION))
                .toList();
    }

    private void writeNodeRecord(NodeData node) {
        await(storagePort.putTextAtomic(NODES_DIR, node.getId() + JSON_EXTENSION, toJson(node)),
                "write node " + node.getId());
    }

    private String allocateId(Predicate<String> taken) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = NodeRecordValidator.newId();
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
        throw new StoreIOException("Could not allocate a unique id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreIOException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T readValue(String json, Class<T> type, String what) {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new StoreIOException("Corrupt record: " + what, e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String action) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StoreIOException("Failed to " + action + ": " + cause.getMessage(), cause);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class JournalEntry {
        private String txnId;
        private Instant createdAt;
        private String nodeId;
        private NodeData previousParent;
    }
}
