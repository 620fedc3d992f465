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
import me.golemcore.loom.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Remembers the last node a front end displayed, so a session can resume where
 * it stopped. The pointer is advisory: the tree API never reads it, and an
 * unreadable pointer is treated as absent.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrentNodePointerService {

    private static final String SESSION_DIR = "session";
    private static final String POINTER_FILE = "current-node-id";

    private final StoragePort storagePort;

    private final Object lock = new Object();

    private volatile boolean loaded = false;
    private volatile String currentNodeId;

    public Optional<String> getCurrentNodeId() {
        ensureLoaded();
        return Optional.ofNullable(currentNodeId);
    }

    public void setCurrentNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        ensureLoaded();

        synchronized (lock) {
            String normalized = nodeId.trim();
            if (normalized.equals(currentNodeId)) {
                return;
            }
            String previous = currentNodeId;
            currentNodeId = normalized;
            try {
                storagePort.putTextAtomic(SESSION_DIR, POINTER_FILE, normalized).join();
            } catch (RuntimeException e) {
                currentNodeId = previous;
                throw new IllegalStateException("Failed to persist current node pointer", e);
            }
        }
    }

    public void clear() {
        ensureLoaded();
        synchronized (lock) {
            if (currentNodeId == null) {
                return;
            }
            String previous = currentNodeId;
            currentNodeId = null;
            try {
                storagePort.deleteObject(SESSION_DIR, POINTER_FILE).join();
            } catch (RuntimeException e) {
                currentNodeId = previous;
                throw new IllegalStateException("Failed to clear current node pointer", e);
            }
        }
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (lock) {
            if (loaded) {
                return;
            }
            loadPointerLocked();
            loaded = true;
        }
    }

    private void loadPointerLocked() {
        try {
            String text = storagePort.getText(SESSION_DIR, POINTER_FILE).join();
            if (text == null || text.isBlank()) {
                return;
            }
            currentNodeId = text.trim();
        } catch (RuntimeException e) { // NOSONAR - fallback to no pointer
            log.warn("[Navigation] Failed to load current node pointer: {}", e.getMessage());
        }
    }
}
