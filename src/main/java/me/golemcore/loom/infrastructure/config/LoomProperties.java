package me.golemcore.loom.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties of the conversation store, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code loom.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - data directory and open-time checks</li>
 * <li>{@link NavigationProperties} - tag names used by the navigation layer</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "loom")
@Data
public class LoomProperties {

    private StorageProperties storage = new StorageProperties();
    private NavigationProperties navigation = new NavigationProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private boolean verifyOnOpen = true;
        private int maxExtraParameters = 32;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.loom/data";
    }

    @Data
    public static class NavigationProperties {
        private String unreadTag = "unread";
    }
}
