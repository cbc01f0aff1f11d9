package no.cantara.tml;

import com.fasterxml.jackson.core.type.TypeReference;
import no.cantara.tml.confirmation.ConfirmationRequest;
import no.cantara.tml.confirmation.ConfirmationService;
import no.cantara.tml.graph.GraphComputer;
import no.cantara.tml.graph.GraphPolicy;
import no.cantara.tml.graph.GraphPolicyLoader;
import no.cantara.tml.graph.OrganizationalGraph;
import no.cantara.tml.identity.LocalIdentityProvider;
import no.cantara.tml.ingest.DraftIngestor;
import no.cantara.tml.ingest.IngestContext;
import no.cantara.tml.ingest.Ingestion;
import no.cantara.tml.io.DeclarationParser;
import no.cantara.tml.io.DeclarationWriter;
import no.cantara.tml.io.DocumentFormat;
import no.cantara.tml.io.TmlJson;
import no.cantara.tml.model.ConfirmationStatus;
import no.cantara.tml.model.Declaration;
import no.cantara.tml.model.ExtractionSource;
import no.cantara.tml.model.HumanIdentity;
import no.cantara.tml.model.IdGenerator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line interface for TML Declarations.
 * Usage: java -jar tml-engine.jar &lt;command&gt; [args...]
 */
public class TmlCli {

    private static final String USAGE = String.join("\n",
            "Usage: java -jar tml-engine.jar <command> [args...]",
            "  validate <declaration>",
            "  status   <declaration>",
            "  export   <declaration> [--format json|yaml] [--out file]",
            "  graph    <declaration>... [--format json|yaml] [--policy file] [--out file]",
            "  ingest   <structured.json> --identity <email> [--scope-name name] [--source-type type] [--out file]",
            "  confirm  <declaration> <primitive-id> <confirmed|corrected|flagged> --actor <email>",
            "           [--text original] [--corrected text] [--reason reason]");

    /** Signals bad command-line usage; reported with the usage text. */
    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs one command.
     *
     * @return the process exit status: 0 on success, 1 on usage, parse or validation errors
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE);
            return 1;
        }
        try {
            Arguments arguments = Arguments.parse(args);
            return switch (args[0]) {
                case "validate" -> validate(arguments, out, err);
                case "status" -> status(arguments, out);
                case "export" -> export(arguments, out);
                case "graph" -> graph(arguments, out);
                case "ingest" -> ingest(arguments, out, err);
                case "confirm" -> confirm(arguments, out);
                default -> throw new UsageException("Unknown command '" + args[0] + "'");
            };
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static int validate(Arguments a, PrintStream out, PrintStream err) throws IOException {
        Path path = a.file(0);
        Declaration declaration = DeclarationParser.parse(path);
        DeclarationValidator.ValidationResult result = DeclarationValidator.validate(declaration);
        if (result.hasWarnings()) {
            result.warnings().forEach(w -> err.println("  ⚠ " + w));
        }
        if (!result.isValid()) {
            err.println("Validation failed: " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> err.println("  • " + e));
            return 1;
        }
        out.printf("✓ %s is valid: scope '%s', %d primitive(s), %d provenance entries%n",
                path, declaration.getScope().name(), declaration.primitives().size(),
                declaration.getProvenance().size());
        return 0;
    }

    private static int status(Arguments a, PrintStream out) throws IOException {
        Declaration declaration = DeclarationParser.parse(a.file(0));
        declaration.computeCompletion();
        out.printf("Scope:       %s (%s)%n", declaration.getScope().name(), declaration.getScope().id());
        out.printf("Completion:  %.1f%%%n", declaration.getCompletionPercentage());
        out.printf("Confirmed:   %d / %d%n", declaration.confirmedCount(), declaration.totalConfirmable());
        out.printf("Unconfirmed: %d%n", declaration.unconfirmedCount());
        out.printf("Flagged:     %d%n", declaration.flaggedCount());
        return 0;
    }

    private static int export(Arguments a, PrintStream out) throws IOException {
        Declaration declaration = DeclarationParser.parse(a.file(0));
        emit(declaration, a, out);
        return 0;
    }

    private static int graph(Arguments a, PrintStream out) throws IOException {
        if (a.positional.isEmpty()) {
            throw new UsageException("graph needs at least one declaration");
        }
        List<Declaration> declarations = new ArrayList<>();
        for (int i = 0; i < a.positional.size(); i++) {
            declarations.add(DeclarationParser.parse(a.file(i)));
        }
        GraphPolicy policy = a.options.containsKey("policy")
                ? GraphPolicyLoader.load(Path.of(a.options.get("policy")))
                : GraphPolicyLoader.loadDefault();
        OrganizationalGraph graph = new GraphComputer(policy).compute(declarations);
        emit(graph, a, out);
        return 0;
    }

    private static int ingest(Arguments a, PrintStream out, PrintStream err) throws IOException {
        Path path = a.file(0);
        String email = a.required("identity");
        HumanIdentity owner = new LocalIdentityProvider().resolve(email);
        String sourceType = a.options.getOrDefault("source-type", "interview");
        String scopeName = a.options.getOrDefault("scope-name", owner.displayName());

        Map<String, Object> draft;
        try (InputStream is = Files.newInputStream(path)) {
            draft = DocumentFormat.fromPath(path) == DocumentFormat.YAML
                    ? DeclarationParser.loadYaml(is)
                    : TmlJson.mapper().readValue(is, new TypeReference<Map<String, Object>>() {});
        }
        Clock clock = Clock.systemUTC();
        ExtractionSource source = new ExtractionSource(sourceType, path.getFileName().toString(), clock.instant());
        Ingestion ingestion = new DraftIngestor(IdGenerator.random(), clock)
                .ingest(draft, new IngestContext(scopeName, owner, source));

        if (!ingestion.lowConfidenceIds().isEmpty()) {
            err.println("Low confidence, follow up in interview: " + ingestion.lowConfidenceIds());
        }
        emit(ingestion.declaration(), a, out);
        return 0;
    }

    private static int confirm(Arguments a, PrintStream out) throws IOException {
        Path path = a.file(0);
        String primitiveId = a.positional(1, "primitive-id");
        ConfirmationStatus status = ConfirmationStatus.fromValue(a.positional(2, "status"));
        HumanIdentity actor = new LocalIdentityProvider().resolve(a.required("actor"));
        String text = a.options.get("text");

        ConfirmationRequest request = switch (status) {
            case CONFIRMED -> ConfirmationRequest.confirm(primitiveId, actor, text);
            case CORRECTED -> ConfirmationRequest.correct(primitiveId, actor, text, a.required("corrected"));
            case FLAGGED -> ConfirmationRequest.flag(primitiveId, actor, text, a.options.get("reason"));
            case UNCONFIRMED -> throw new UsageException("status must be confirmed, corrected or flagged");
        };

        Declaration declaration = DeclarationParser.parse(path);
        new ConfirmationService(Clock.systemUTC(), IdGenerator.random()).confirm(declaration, request);
        DeclarationWriter.write(declaration, path);
        out.printf("✓ %s %s; %.1f%% complete%n", primitiveId, status.value(), declaration.getCompletionPercentage());
        return 0;
    }

    private static void emit(Object document, Arguments a, PrintStream out) throws IOException {
        String outFile = a.options.get("out");
        if (outFile != null) {
            Path target = Path.of(outFile);
            DocumentFormat format = a.options.containsKey("format")
                    ? DocumentFormat.fromName(a.options.get("format"))
                    : DocumentFormat.fromPath(target);
            Files.writeString(target, DeclarationWriter.render(document, format));
        } else {
            out.println(DeclarationWriter.render(document, DocumentFormat.fromName(a.options.getOrDefault("format", "json"))));
        }
    }

    /** Positional arguments after the command, and {@code --key value} options. */
    static final class Arguments {
        final List<String> positional = new ArrayList<>();
        final Map<String, String> options = new HashMap<>();

        static Arguments parse(String[] args) {
            Arguments a = new Arguments();
            for (int i = 1; i < args.length; i++) {
                if (args[i].startsWith("--")) {
                    if (i + 1 >= args.length) {
                        throw new UsageException("Option " + args[i] + " needs a value");
                    }
                    a.options.put(args[i].substring(2), args[++i]);
                } else {
                    a.positional.add(args[i]);
                }
            }
            return a;
        }

        String positional(int index, String name) {
            if (index >= positional.size()) {
                throw new UsageException("Missing <" + name + ">");
            }
            return positional.get(index);
        }

        Path file(int index) {
            Path path = Path.of(positional(index, "file"));
            if (!Files.exists(path)) {
                throw new UsageException("file not found: " + path);
            }
            return path;
        }

        String required(String option) {
            String value = options.get(option);
            if (value == null) {
                throw new UsageException("Missing --" + option);
            }
            return value;
        }
    }
}
