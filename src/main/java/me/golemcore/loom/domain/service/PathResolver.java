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

import me.golemcore.loom.domain.exception.CorruptStoreException;
import me.golemcore.loom.domain.exception.InvalidRangeException;
import me.golemcore.loom.domain.exception.NodeNotFoundException;
import me.golemcore.loom.domain.model.NodeData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ancestor walk answering "which messages lie between A and B".
 *
 * <p>
 * Starting at {@code to}, the walk follows {@code parentId} links until it
 * reaches {@code from} (excluded) or, when {@code from} is null, a root-level
 * node (included). Cost is proportional to the depth of {@code to}.
 */
public final class PathResolver {

    private PathResolver() {
    }

    /**
     * @param lookup
     *            node lookup by id
     * @param from
     *            ancestor to stop at, or null for a full history
     * @param to
     *            last node of the path
     * @param maxSteps
     *            upper bound on the walk; exceeding it means the parent links
     *            form a cycle
     * @return nodes in root-to-leaf order
     */
    public static List<NodeData> resolve(Function<String, Optional<NodeData>> lookup, String from, String to,
            int maxSteps) {
        NodeData current = lookup.apply(to).orElseThrow(() -> NodeNotFoundException.node(to));

        List<NodeData> collected = new ArrayList<>();
        int steps = 0;
        while (true) {
            if (from != null && from.equals(current.getId())) {
                break;
            }
            collected.add(current);
            if (current.getParentId() == null) {
                if (from != null) {
                    throw new InvalidRangeException(from, to);
                }
                break;
            }
            if (++steps > maxSteps) {
                throw new CorruptStoreException(List.of("ancestor chain of " + to + " exceeds " + maxSteps
                        + " steps"));
            }
            String parentId = current.getParentId();
            current = lookup.apply(parentId).orElseThrow(() -> new InvalidRangeException(from, to));
        }

        Collections.reverse(collected);
        return collected;
    }
}
