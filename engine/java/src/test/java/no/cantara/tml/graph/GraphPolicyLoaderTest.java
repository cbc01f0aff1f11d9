package no.cantara.tml.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphPolicyLoaderTest {

    @Test
    void bundledPolicyEqualsDefaults() {
        assertEquals(GraphPolicy.defaults(), GraphPolicyLoader.loadDefault());
    }

    @Test
    void loadsPolicyFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("policy.yaml");
        Files.writeString(file, """
                target_match: exact
                blocking_keywords: [Hard Stop]
                """);

        GraphPolicy policy = GraphPolicyLoader.load(file);
        assertEquals(TargetMatchMode.EXACT, policy.targetMatch());
        assertEquals(List.of("hard stop"), policy.blockingKeywords());
        assertEquals(GraphPolicy.DEFAULT_GATING_KEYWORDS, policy.gatingKeywords());
    }

    @Test
    void emptyDocumentGivesDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "");
        assertEquals(GraphPolicy.defaults(), GraphPolicyLoader.load(file));
    }

    @Test
    void unknownMatchModeIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> GraphPolicyLoader.fromMap(Map.of("target_match", "fuzzy")));
    }

    @Test
    void keywordsMustBeAListOfStrings() {
        IllegalArgumentException notStrings = assertThrows(IllegalArgumentException.class,
                () -> GraphPolicyLoader.fromMap(Map.of("blocking_keywords", List.of(404, "must"))));
        assertTrue(notStrings.getMessage().contains("'blocking_keywords'"), notStrings.getMessage());

        IllegalArgumentException notAList = assertThrows(IllegalArgumentException.class,
                () -> GraphPolicyLoader.fromMap(Map.of("gating_keywords", "approval")));
        assertEquals("'gating_keywords' must be a list of strings", notAList.getMessage());
    }

    @Test
    void matchModeMustBeAString() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GraphPolicyLoader.fromMap(Map.of("target_match", 1)));
        assertEquals("'target_match' must be a string", e.getMessage());
    }

    @Test
    void matchModeAcceptsAnyCase() {
        assertEquals(TargetMatchMode.EXACT, GraphPolicyLoader.fromMap(Map.of("target_match", " EXACT ")).targetMatch());
    }

    @Test
    void documentRootMustBeAMapping() {
        ByteArrayInputStream yaml = new ByteArrayInputStream("- must\n- requires\n".getBytes(StandardCharsets.UTF_8));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> GraphPolicyLoader.load(yaml));
        assertTrue(e.getMessage().startsWith("Graph policy must be a mapping"), e.getMessage());
    }
}
