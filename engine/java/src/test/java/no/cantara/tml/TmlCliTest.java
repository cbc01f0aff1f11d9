package no.cantara.tml;

import com.fasterxml.jackson.databind.JsonNode;
import no.cantara.tml.io.DeclarationParser;
import no.cantara.tml.io.DeclarationWriter;
import no.cantara.tml.io.TmlJson;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.Declaration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TmlCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path finance;

    @BeforeEach
    void writeDeclaration() throws IOException {
        finance = dir.resolve("finance.json");
        DeclarationWriter.write(SampleDeclarations.finance(), finance);
    }

    private int run(String... args) {
        return TmlCli.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(TmlCliTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void noArgumentsPrintsUsage() {
        assertEquals(1, run());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("frobnicate"));
    }

    @Test
    void validateReportsValidDeclaration() {
        assertEquals(0, run("validate", finance.toString()));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("scope 'Finance'"));
    }

    @Test
    void validateFailsOnMissingFile() {
        assertEquals(1, run("validate", dir.resolve("missing.yaml").toString()));
    }

    @Test
    void statusPrintsCounts() {
        assertEquals(0, run("status", finance.toString()));
        String printed = out.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Confirmed:   0 / 6"), printed);
    }

    @Test
    void exportConvertsJsonToYaml() throws IOException {
        Path target = dir.resolve("finance.yaml");
        assertEquals(0, run("export", finance.toString(), "--out", target.toString()));
        assertEquals(DeclarationParser.parse(finance), DeclarationParser.parse(target));
    }

    @Test
    void graphCombinesDeclarations() throws Exception {
        assertEquals(0, run("graph", finance.toString(), fixture("engineering-declaration.json").toString()));
        JsonNode graph = TmlJson.mapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertEquals(1, graph.get("decision_flows").size());
        assertEquals("cap-plan", graph.get("dependency_map").get(0).get("downstream_capability_id").asText());
    }

    @Test
    void ingestWritesDraftDeclaration() throws Exception {
        Path target = dir.resolve("support.json");
        assertEquals(0, run("ingest", fixture("structured-draft.json").toString(),
                "--identity", "jane.doe@acme.test", "--out", target.toString()));
        Declaration d = DeclarationParser.parse(target);
        assertEquals("Jane Doe", d.getScope().name());
        assertEquals("jane.doe@acme.test", d.getScope().ownerIdentity().email());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Low confidence"));
    }

    @Test
    void ingestRequiresIdentity() throws Exception {
        assertEquals(1, run("ingest", fixture("structured-draft.json").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("--identity"));
    }

    @Test
    void confirmWritesBack() throws IOException {
        assertEquals(0, run("confirm", finance.toString(), "cap-budget", "corrected",
                "--actor", "alice@acme.test", "--corrected", "Approve budgets over 10k"));
        Declaration d = DeclarationParser.parse(finance);
        assertEquals(ConfirmationStatus.CORRECTED, d.getCapabilities().get(0).confirmationStatus());
        assertEquals("Alice", d.getCapabilities().get(0).confirmation().confirmedBy().displayName());
        assertEquals(1, d.getProvenance().size());
        assertTrue(Files.readString(finance).contains("\"completion_percentage\""));
    }

    @Test
    void confirmRejectsUnknownPrimitive() {
        assertEquals(1, run("confirm", finance.toString(), "cap-missing", "confirmed", "--actor", "alice@acme.test"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("cap-missing"));
    }
}
