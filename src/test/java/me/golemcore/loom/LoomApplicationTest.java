package me.golemcore.loom;

import me.golemcore.loom.domain.model.NavigationView;
import me.golemcore.loom.domain.model.NodeData;
import me.golemcore.loom.domain.model.RootConfig;
import me.golemcore.loom.domain.service.NavigationService;
import me.golemcore.loom.port.inbound.ForestPort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
class LoomApplicationTest {

    @Autowired
    private ForestPort forest;

    @Autowired
    private NavigationService navigation;

    @DynamicPropertySource
    static void dataDirectory(DynamicPropertyRegistry registry) throws IOException {
        String dataDir = Files.createTempDirectory("loom-context").toString();
        registry.add("loom.storage.local.base-path", () -> dataDir);
    }

    @Test
    void shouldWireStoreAndNavigation() {
        forest.createRoot(RootConfig.builder().model("gpt-4").build());
        NodeData question = navigation.appendUserMessage(null, "hi");
        List<NodeData> replies = navigation.appendAssistantReplies(question.getId(), List.of("a", "b"), "gpt-4");

        NavigationView view = navigation.navigateTo(question.getId());

        assertEquals(2, view.getChildren().size());
        assertEquals(replies.get(0).getId(), view.getChildren().get(0).getId());
    }
}
