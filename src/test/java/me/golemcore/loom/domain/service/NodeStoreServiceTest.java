package me.golemcore.loom.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.loom.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.loom.domain.exception.CorruptStoreException;
import me.golemcore.loom.domain.exception.NodeNotFoundException;
import me.golemcore.loom.domain.exception.StoreBusyException;
import me.golemcore.loom.domain.exception.StoreIOException;
import me.golemcore.loom.domain.exception.ValidationException;
import me.golemcore.loom.domain.model.ModelParameters;
import me.golemcore.loom.domain.model.NodeData;
import me.golemcore.loom.domain.model.NodeMessage;
import me.golemcore.loom.domain.model.NodeMetadata;
import me.golemcore.loom.domain.model.Role;
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.model.RootData;
import me.golemcore.loom.infrastructure.config.LoomProperties;
import me.golemcore.loom.infrastructure.config.StoreConfiguration;
import me.golemcore.loom.testsupport.storage.FaultInjectingStoragePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodeStoreServiceTest {

    private static final Instant FIXED_TIME = Instant.parse("2026-01-15T10:00:00Z");
    private static final String NODES = "nodes";
    private static final String JOURNAL = "journal";
    private static final String JOURNAL_FILE = "pending.json";

    @TempDir
    Path tempDir;

    private LoomProperties properties;
    private ObjectMapper objectMapper;
    private Clock clock;
    private LocalStorageAdapter adapter;
    private FaultInjectingStoragePort storagePort;
    private NodeStoreService store;

    @BeforeEach
    void setUp() {
        properties = new LoomProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        objectMapper = StoreConfiguration.objectMapper();
        clock = Clock.fixed(FIXED_TIME, ZoneOffset.UTC);
        openStore();
    }

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.close();
        }
    }

    private void openStore() {
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        storagePort = new FaultInjectingStoragePort(adapter);
        store = new NodeStoreService(storagePort, objectMapper, clock, properties);
        store.open();
    }

    private void reopenStore() {
        adapter.close();
        openStore();
    }

    private RootData newRoot() {
        return store.createRoot(RootConfig.builder().model("gpt-4").build());
    }

    private NodeMessage user(String content) {
        return NodeMessage.user(content, null);
    }

    private NodeMessage assistant(String content) {
        return NodeMessage.assistant(content, null);
    }

    // ==================== Roots ====================

    @Test
    void shouldCreateAndReadRoot() {
        RootData root = store.createRoot(RootConfig.builder()
                .model("gpt-4")
                .systemPrompt("Be brief.")
                .parameters(ModelParameters.builder().maxTokens(256).temperature(0.7).build())
                .build());

        assertTrue(NodeRecordValidator.isValidId(root.getId()));
        assertEquals(FIXED_TIME, root.getCreatedAt());
        RootData loaded = store.getRoot(root.getId()).orElseThrow();
        assertEquals("gpt-4", loaded.getConfig().getModel());
        assertEquals("Be brief.", loaded.getConfig().getSystemPrompt());
        assertEquals(256, loaded.getConfig().getParameters().getMaxTokens());
        assertTrue(Files.exists(tempDir.resolve("roots").resolve(root.getId() + ".json")));
    }

    @Test
    void shouldRejectRootWithoutModel() {
        assertThrows(ValidationException.class, () -> store.createRoot(RootConfig.builder().model(" ").build()));
        assertTrue(store.listRoots().isEmpty());
    }

    @Test
    void shouldReturnEmptyForUnknownRoot() {
        assertTrue(store.getRoot("missing00000").isEmpty());
        assertTrue(store.getRoot(null).isEmpty());
    }

    @Test
    void returnedRootIsACopy() {
        RootData root = newRoot();
        root.getConfig().setModel("tampered");

        assertEquals("gpt-4", store.getRoot(root.getId()).orElseThrow().getConfig().getModel());
    }

    // ==================== createNode ====================

    @Test
    void shouldCreateRootLevelNode() {
        RootData root = newRoot();

        NodeData node = store.createNode(root.getId(), null, user("hi"), null);

        assertNull(node.getParentId());
        assertEquals(root.getId(), node.getRootId());
        assertEquals(Role.USER, node.getMessage().getRole());
        assertEquals(FIXED_TIME, node.getMessage().getTimestamp());
        assertTrue(node.getChildIds().isEmpty());
        assertTrue(node.getMetadata().getTags().isEmpty());
    }

    @Test
    void shouldKeepParentAndChildConsistent() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);

        NodeData child = store.createNode(null, parent.getId(), assistant("hello"), null);

        assertEquals(parent.getId(), store.getNode(child.getId()).orElseThrow().getParentId());
        assertEquals(root.getId(), child.getRootId());
        List<String> childIds = store.getNode(parent.getId()).orElseThrow().getChildIds();
        assertEquals(1, Collections.frequency(childIds, child.getId()));
        assertFalse(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));
    }

    @Test
    void shouldListChildrenInCreationOrder() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        List<String> created = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            created.add(store.createNode(null, parent.getId(), assistant("reply " + i), null).getId());
        }

        List<String> children = store.getChildren(parent.getId()).stream().map(NodeData::getId).toList();

        assertEquals(created, children);
    }

    @Test
    void shouldFailForUnknownParent() {
        newRoot();

        assertThrows(NodeNotFoundException.class,
                () -> store.createNode(null, "nosuchnode00", user("hi"), null));
        assertEquals(0, store.nodeCount());
    }

    @Test
    void shouldFailForUnknownRoot() {
        NodeNotFoundException ex = assertThrows(NodeNotFoundException.class,
                () -> store.createNode("nosuchroot00", null, user("hi"), null));
        assertEquals("nosuchroot00", ex.getId());
    }

    @Test
    void shouldRequireRootForRootLevelNode() {
        assertThrows(ValidationException.class, () -> store.createNode(null, null, user("hi"), null));
    }

    @Test
    void shouldRejectRootMismatchWithParent() {
        RootData first = newRoot();
        RootData second = newRoot();
        NodeData parent = store.createNode(first.getId(), null, user("hi"), null);

        assertThrows(ValidationException.class,
                () -> store.createNode(second.getId(), parent.getId(), assistant("hello"), null));
    }

    @Test
    void shouldRejectMalformedMessage() {
        RootData root = newRoot();

        assertThrows(ValidationException.class, () -> store.createNode(root.getId(), null, null, null));
        assertThrows(ValidationException.class,
                () -> store.createNode(root.getId(), null, new NodeMessage(null, "x", null), null));
        assertThrows(ValidationException.class,
                () -> store.createNode(root.getId(), null, new NodeMessage(Role.USER, null, null), null));
    }

    @Test
    void shouldAllocateUniqueIds() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        Set<String> ids = new HashSet<>();
        ids.add(root.getId());
        ids.add(parent.getId());
        for (int i = 0; i < 50; i++) {
            ids.add(store.createNode(null, parent.getId(), assistant("reply " + i), null).getId());
        }

        assertEquals(52, ids.size());
    }

    @Test
    void shouldStoreCallerSuppliedTags() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);

        NodeData child = store.createNode(null, parent.getId(), assistant("hello"), NodeMetadata.withTags("unread"));

        assertTrue(store.getNode(child.getId()).orElseThrow().getMetadata().hasTag("unread"));
    }

    @Test
    void returnedNodeIsACopy() {
        RootData root = newRoot();
        NodeData node = store.createNode(root.getId(), null, user("hi"), null);
        node.getChildIds().add("injected0000");
        node.getMetadata().getTags().add("injected");

        NodeData stored = store.getNode(node.getId()).orElseThrow();
        assertTrue(stored.getChildIds().isEmpty());
        assertTrue(stored.getMetadata().getTags().isEmpty());
    }

    @Test
    void shouldListRootNodesByTimestamp() {
        RootData root = newRoot();
        NodeData later = store.createNode(root.getId(), null,
                NodeMessage.user("second", FIXED_TIME.plusSeconds(10)), null);
        NodeData earlier = store.createNode(root.getId(), null,
                NodeMessage.user("first", FIXED_TIME), null);
        NodeData parent = store.createNode(root.getId(), null, NodeMessage.user("third", FIXED_TIME.plusSeconds(20)),
                null);
        store.createNode(null, parent.getId(), assistant("child"), null);

        List<String> rootNodes = store.listRootNodes(root.getId()).stream().map(NodeData::getId).toList();

        assertEquals(List.of(earlier.getId(), later.getId(), parent.getId()), rootNodes);
    }

    // ==================== getChildren / getNode ====================

    @Test
    void shouldReturnEmptyChildrenForUnknownOrLeaf() {
        RootData root = newRoot();
        NodeData leaf = store.createNode(root.getId(), null, user("hi"), null);

        assertTrue(store.getChildren("unknown00000").isEmpty());
        assertTrue(store.getChildren(leaf.getId()).isEmpty());
        assertTrue(store.getChildren(null).isEmpty());
        assertTrue(store.getNode("unknown00000").isEmpty());
    }

    // ==================== updateNodeMetadata ====================

    @Test
    void shouldReplaceMetadata() {
        RootData root = newRoot();
        NodeData node = store.createNode(root.getId(), null, user("hi"), NodeMetadata.withTags("unread", "starred"));

        NodeData updated = store.updateNodeMetadata(node.getId(), node.getMetadata().minusTag("unread"));

        assertEquals(Set.of("starred"), updated.getMetadata().getTags());
        assertEquals(Set.of("starred"), store.getNode(node.getId()).orElseThrow().getMetadata().getTags());
    }

    @Test
    void metadataUpdateIsIdempotent() throws Exception {
        RootData root = newRoot();
        NodeData node = store.createNode(root.getId(), null, user("hi"), null);
        NodeMetadata metadata = NodeMetadata.builder().tags(Set.of("read")).sourceModel("gpt-4").build();

        store.updateNodeMetadata(node.getId(), metadata);
        String afterFirst = Files.readString(tempDir.resolve(NODES).resolve(node.getId() + ".json"));
        NodeData first = store.getNode(node.getId()).orElseThrow();
        store.updateNodeMetadata(node.getId(), metadata);
        String afterSecond = Files.readString(tempDir.resolve(NODES).resolve(node.getId() + ".json"));

        assertEquals(first, store.getNode(node.getId()).orElseThrow());
        assertEquals(afterFirst, afterSecond);
    }

    @Test
    void shouldFailMetadataUpdateForUnknownNode() {
        assertThrows(NodeNotFoundException.class,
                () -> store.updateNodeMetadata("unknown00000", NodeMetadata.empty()));
    }

    @Test
    void shouldRejectBlankTags() {
        RootData root = newRoot();
        NodeData node = store.createNode(root.getId(), null, user("hi"), null);

        assertThrows(ValidationException.class,
                () -> store.updateNodeMetadata(node.getId(), NodeMetadata.withTags(" ")));
        assertThrows(ValidationException.class, () -> store.updateNodeMetadata(node.getId(), null));
    }

    @Test
    void shouldKeepMetadataWhenWriteFails() {
        RootData root = newRoot();
        NodeData node = store.createNode(root.getId(), null, user("hi"), NodeMetadata.withTags("unread"));
        storagePort.failWrites(NODES, node.getId() + ".json", 1);

        assertThrows(StoreIOException.class,
                () -> store.updateNodeMetadata(node.getId(), NodeMetadata.empty()));
        assertTrue(store.getNode(node.getId()).orElseThrow().getMetadata().hasTag("unread"));
    }

    // ==================== Persistence ====================

    @Test
    void shouldReloadEverythingAfterReopen() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        NodeData child = store.createNode(null, parent.getId(), assistant("hello"), NodeMetadata.withTags("unread"));

        reopenStore();

        assertEquals(root, store.getRoot(root.getId()).orElseThrow());
        assertEquals(List.of(child.getId()), store.getNode(parent.getId()).orElseThrow().getChildIds());
        NodeData reloaded = store.getNode(child.getId()).orElseThrow();
        assertEquals("hello", reloaded.getMessage().getContent());
        assertEquals(Role.ASSISTANT, reloaded.getMessage().getRole());
        assertTrue(reloaded.getMetadata().hasTag("unread"));
    }

    @Test
    void shouldRejectSecondStoreOnSameDirectory() {
        LocalStorageAdapter second = new LocalStorageAdapter(properties);

        assertThrows(StoreBusyException.class, second::init);
    }

    @Test
    void shouldFailOpenOnUnparseableRecord() throws Exception {
        adapter.close();
        Files.writeString(tempDir.resolve(NODES).resolve("broken000000.json"), "{not json");

        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        NodeStoreService reopened = new NodeStoreService(adapter, objectMapper, clock, properties);

        assertThrows(StoreIOException.class, reopened::open);
    }

    // ==================== Crash consistency ====================

    @Test
    void shouldRollBackWhenParentWriteFails() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        storagePort.failWrites(NODES, parent.getId() + ".json", 1);

        assertThrows(StoreIOException.class,
                () -> store.createNode(null, parent.getId(), assistant("hello"), null));

        assertTrue(store.getChildren(parent.getId()).isEmpty());
        assertEquals(1, store.nodeCount());
        assertFalse(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));

        reopenStore();
        assertEquals(1, store.nodeCount());
        assertTrue(store.getNode(parent.getId()).orElseThrow().getChildIds().isEmpty());
    }

    @Test
    void shouldLeaveStateUnchangedWhenJournalWriteFails() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        storagePort.failWrites(JOURNAL, JOURNAL_FILE, 1);

        assertThrows(StoreIOException.class,
                () -> store.createNode(null, parent.getId(), assistant("hello"), null));

        assertEquals(1, store.nodeCount());
        reopenStore();
        assertEquals(1, store.nodeCount());
    }

    @Test
    void shouldUndoTransactionLeftByCrash() throws Exception {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);

        // crash after both records were applied, before the journal was deleted
        NodeData child = NodeData.builder()
                .id("crashchild01")
                .rootId(root.getId())
                .parentId(parent.getId())
                .message(NodeMessage.assistant("hello", FIXED_TIME))
                .build();
        NodeData updatedParent = parent.copy();
        updatedParent.getChildIds().add(child.getId());
        String journal = objectMapper.writeValueAsString(Map.of(
                "txnId", child.getId(),
                "createdAt", FIXED_TIME.toString(),
                "nodeId", child.getId(),
                "previousParent", parent));
        adapter.putTextAtomic(JOURNAL, JOURNAL_FILE, journal).join();
        adapter.putTextAtomic(NODES, child.getId() + ".json", objectMapper.writeValueAsString(child)).join();
        adapter.putTextAtomic(NODES, parent.getId() + ".json", objectMapper.writeValueAsString(updatedParent)).join();

        reopenStore();

        assertTrue(store.getNode(parent.getId()).orElseThrow().getChildIds().isEmpty());
        assertTrue(store.getNode(child.getId()).isEmpty());
        assertFalse(Files.exists(tempDir.resolve(NODES).resolve(child.getId() + ".json")));
        assertFalse(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));
    }

    @Test
    void shouldReportOrphanedNodeInsteadOfAcceptingIt() throws Exception {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        adapter.close();

        NodeData orphan = NodeData.builder()
                .id("orphan000001")
                .rootId(root.getId())
                .parentId(parent.getId())
                .message(NodeMessage.assistant("hello", FIXED_TIME))
                .build();
        Files.writeString(tempDir.resolve(NODES).resolve(orphan.getId() + ".json"),
                objectMapper.writeValueAsString(orphan));

        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        NodeStoreService reopened = new NodeStoreService(adapter, objectMapper, clock, properties);

        CorruptStoreException ex = assertThrows(CorruptStoreException.class, reopened::open);
        assertTrue(ex.getProblems().stream().anyMatch(p -> p.contains("lists child orphan000001 0 times")));
    }

    @Test
    void shouldReportDanglingChildReference() throws Exception {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        adapter.close();

        NodeData tampered = parent.copy();
        tampered.getChildIds().add("ghost0000001");
        Files.writeString(tempDir.resolve(NODES).resolve(parent.getId() + ".json"),
                objectMapper.writeValueAsString(tampered));

        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        NodeStoreService reopened = new NodeStoreService(adapter, objectMapper, clock, properties);

        CorruptStoreException ex = assertThrows(CorruptStoreException.class, reopened::open);
        assertTrue(ex.getProblems().stream().anyMatch(p -> p.contains("missing child ghost0000001")));
    }

    @Test
    void shouldReportCycles() throws Exception {
        RootData root = newRoot();
        adapter.close();

        NodeData a = NodeData.builder().id("cyclenode0a1").rootId(root.getId()).parentId("cyclenode0b1")
                .message(NodeMessage.user("a", FIXED_TIME)).childIds(new ArrayList<>(List.of("cyclenode0b1")))
                .build();
        NodeData b = NodeData.builder().id("cyclenode0b1").rootId(root.getId()).parentId("cyclenode0a1")
                .message(NodeMessage.user("b", FIXED_TIME)).childIds(new ArrayList<>(List.of("cyclenode0a1")))
                .build();
        Files.writeString(tempDir.resolve(NODES).resolve(a.getId() + ".json"), objectMapper.writeValueAsString(a));
        Files.writeString(tempDir.resolve(NODES).resolve(b.getId() + ".json"), objectMapper.writeValueAsString(b));

        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        NodeStoreService reopened = new NodeStoreService(adapter, objectMapper, clock, properties);

        CorruptStoreException ex = assertThrows(CorruptStoreException.class, reopened::open);
        assertTrue(ex.getProblems().stream().anyMatch(p -> p.contains("cyclic")));
    }

    @Test
    void shouldSkipIntegrityCheckWhenDisabled() throws Exception {
        RootData root = newRoot();
        adapter.close();
        NodeData orphan = NodeData.builder()
                .id("orphan000002")
                .rootId(root.getId())
                .parentId("missingpar01")
                .message(NodeMessage.assistant("hello", FIXED_TIME))
                .build();
        Files.writeString(tempDir.resolve(NODES).resolve(orphan.getId() + ".json"),
                objectMapper.writeValueAsString(orphan));
        properties.getStorage().setVerifyOnOpen(false);

        openStore();

        assertNotNull(store.getNode(orphan.getId()).orElse(null));
    }

    @Test
    void shouldRollBackWhenJournalCleanupFails() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        storagePort.failDeletes(JOURNAL, JOURNAL_FILE, 1);

        assertThrows(StoreIOException.class,
                () -> store.createNode(null, parent.getId(), assistant("hello"), null));

        assertTrue(store.getChildren(parent.getId()).isEmpty());
        assertEquals(1, store.nodeCount());
        assertFalse(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));
        reopenStore();
        assertTrue(store.getNode(parent.getId()).orElseThrow().getChildIds().isEmpty());
        assertEquals(1, store.nodeCount());
    }

    @Test
    void failedCreationStaysFailedWhenRollbackFails() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        // the apply and the restoring write of the parent both fail
        storagePort.failWrites(NODES, parent.getId() + ".json", 2);

        assertThrows(StoreIOException.class,
                () -> store.createNode(null, parent.getId(), assistant("hello"), null));
        assertTrue(store.getChildren(parent.getId()).isEmpty());
        assertTrue(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));

        store.updateNodeMetadata(parent.getId(), NodeMetadata.withTags("seen"));
        NodeData retried = store.createNode(null, parent.getId(), assistant("hello"), null);

        NodeData storedParent = store.getNode(parent.getId()).orElseThrow();
        assertEquals(List.of(retried.getId()), storedParent.getChildIds());
        assertTrue(storedParent.getMetadata().hasTag("seen"));
        assertEquals(2, store.nodeCount());
        reopenStore();
        assertEquals(1, store.getChildren(parent.getId()).size());
        assertEquals(2, store.nodeCount());
    }

    @Test
    void failedCreationIsUndoneOnReopenWhenRollbackFails() {
        RootData root = newRoot();
        NodeData parent = store.createNode(root.getId(), null, user("hi"), null);
        storagePort.failWrites(NODES, parent.getId() + ".json", 2);

        assertThrows(StoreIOException.class,
                () -> store.createNode(null, parent.getId(), assistant("hello"), null));

        reopenStore();

        assertTrue(store.getChildren(parent.getId()).isEmpty());
        assertEquals(1, store.nodeCount());
        assertFalse(Files.exists(tempDir.resolve(JOURNAL).resolve(JOURNAL_FILE)));
    }

    @Test
    void shouldRejectRecordWithMalformedId() throws Exception {
        newRoot();
        adapter.close();
        NodeData bad = NodeData.builder()
                .id("Bad-Id")
                .rootId("whatever0000")
                .message(NodeMessage.user("hi", FIXED_TIME))
                .build();
        Files.writeString(tempDir.resolve(NODES).resolve("Bad-Id.json"), objectMapper.writeValueAsString(bad));

        adapter = new LocalStorageAdapter(properties);
        adapter.init();
        NodeStoreService reopened = new NodeStoreService(adapter, objectMapper, clock, properties);

        StoreIOException ex = assertThrows(StoreIOException.class, reopened::open);
        assertTrue(ex.getMessage().contains("Bad-Id"));
    }
}
