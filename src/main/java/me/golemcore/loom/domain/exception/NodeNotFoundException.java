package me.golemcore.loom.domain.exception;

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

/**
 * A referenced node or root does not exist.
 */
public class NodeNotFoundException extends ForestException {

    private final String id;

    public NodeNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.id = id;
    }

    public static NodeNotFoundException node(String id) {
        return new NodeNotFoundException("Node", id);
    }

    public static NodeNotFoundException root(String id) {
        return new NodeNotFoundException("Root", id);
    }

    public String getId() {
        return id;
    }
}
