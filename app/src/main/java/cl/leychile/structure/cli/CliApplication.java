package cl.leychile.structure.cli;

import cl.leychile.structure.config.ConfigLoader;
import cl.leychile.structure.config.EngineConfig;
import cl.leychile.structure.config.SystemEnvironmentReader;
import cl.leychile.structure.engine.BatchOutcome;
import cl.leychile.structure.engine.BatchProcessor;
import cl.leychile.structure.engine.ConformanceValidator;
import cl.leychile.structure.engine.IngestionResult;
import cl.leychile.structure.engine.NormIngestionService;
import cl.leychile.structure.engine.NormStructureEngine;
import cl.leychile.structure.engine.ParsedDocument;
import cl.leychile.structure.logging.LoggingConfigurator;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.DocumentInput;
import cl.leychile.structure.model.DocumentStatistics;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyState;
import cl.leychile.structure.relation.InMemoryRelationshipStore;
import cl.leychile.structure.relation.RelationshipStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch ingestion.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final Supplier<RelationshipStore> storeFactory;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), InMemoryRelationshipStore::new,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, Supplier<RelationshipStore> storeFactory, PrintWriter out,
                   PrintWriter err) {
        this.configLoader = configLoader;
        this.storeFactory = storeFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        EngineConfig config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println("Invalid configuration: " + ex.getMessage());
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Parsing {} documents with {} workers (segmentation={})",
                config.inputs().size(), config.workerThreads(), config.segmentationPolicy());

        List<String> unreadable = new ArrayList<>();
        List<DocumentInput> inputs = readInputs(config, unreadable);

        RelationshipStore store = storeFactory.get();
        NormIngestionService ingestionService = new NormIngestionService(NormStructureEngine.create(config), store,
                new ConformanceValidator());
        BatchOutcome outcome;
        try (BatchProcessor processor = new BatchProcessor(ingestionService, config.workerThreads())) {
            outcome = processor.process(inputs);
        }

        for (IngestionResult result : outcome.results()) {
            printSummary(result, store);
        }
        out.flush();

        List<String> failures = new ArrayList<>(unreadable);
        failures.addAll(outcome.failedDocuments());
        if (!failures.isEmpty()) {
            LOGGER.warn("Documents not processed: {}", String.join(", ", failures));
            return 1;
        }
        return 0;
    }

    private List<DocumentInput> readInputs(EngineConfig config, List<String> unreadable) {
        List<DocumentInput> inputs = new ArrayList<>(config.inputs().size());
        for (Path path : config.inputs()) {
            try {
                String text = Files.readString(path, StandardCharsets.UTF_8);
                inputs.add(DocumentInput.of(documentIdOf(path), config.defaultNormType(), text));
            } catch (IOException ex) {
                LOGGER.error("Failed to read {}", path, ex);
                unreadable.add(path.toString());
            }
        }
        return inputs;
    }

    static String documentIdOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static VigencyState vigencyOf(ParsedDocument document, RelationshipStore store) {
        VigencyState state = VigencyState.VIGENTE;
        for (String id : document.canonicalIds()) {
            state = state.merge(store.vigencyOf(id));
        }
        return state;
    }

    private void printSummary(IngestionResult result, RelationshipStore store) {
        ParsedDocument document = result.document();
        DocumentStatistics statistics = document.statistics();
        out.printf("%s: type=%s number=%s articles=%d books=%d titles=%d chapters=%d paragraphs=%d sections=%d"
                        + " vigency=%s%n",
                document.documentId(),
                document.metadata().normType().orElse("-"),
                document.metadata().number().orElse("-"),
                statistics.articles(), statistics.books(), statistics.titles(), statistics.chapters(),
                statistics.paragraphDivisions(), statistics.sections(),
                vigencyOf(document, store));
        document.signatory().ifPresent(signatory -> out.printf("  firma %s%s%n", signatory.name(),
                signatory.title().isEmpty() ? "" : " (" + signatory.title() + ")"));
        for (RelationshipEdge edge : result.storedEdges()) {
            out.printf("  %s %s%s%n", edge.kind().label(), edge.targetDocumentId(),
                    edge.targetResolved() ? "" : " (unresolved)");
        }
        for (Diagnostic diagnostic : result.diagnostics()) {
            out.printf("  %s%n", diagnostic);
        }
        for (Diagnostic diagnostic : result.conformance()) {
            out.printf("  %s%n", diagnostic);
        }
    }
}
