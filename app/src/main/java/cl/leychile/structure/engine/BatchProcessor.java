package cl.leychile.structure.engine;

import cl.leychile.structure.model.DocumentInput;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingests independent documents on a fixed worker pool.
 *
 * <p>All documents are parsed first, then every parsed document is registered in the store, and
 * only then are relationships applied, so edge resolution does not depend on scheduling. A
 * document that fails is listed in the outcome and the rest of the batch continues.
 */
public class BatchProcessor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchProcessor.class);

    private final NormIngestionService ingestionService;
    private final ExecutorService pool;
    private final MdcPropagatingExecutor executor;

    public BatchProcessor(NormIngestionService ingestionService, int workerThreads) {
        this(ingestionService, Executors.newFixedThreadPool(requirePositive(workerThreads)));
    }

    BatchProcessor(NormIngestionService ingestionService, ExecutorService pool) {
        this.ingestionService = Objects.requireNonNull(ingestionService, "ingestionService");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.executor = new MdcPropagatingExecutor(pool);
    }

    public BatchOutcome process(List<DocumentInput> inputs) {
        Objects.requireNonNull(inputs, "inputs");
        List<String> failed = new ArrayList<>();

        List<Future<ParsedDocument>> parsing = new ArrayList<>(inputs.size());
        for (DocumentInput input : inputs) {
            parsing.add(executor.submit(input.documentId(), () -> ingestionService.parse(input)));
        }
        List<DocumentInput> parsedInputs = new ArrayList<>(inputs.size());
        List<ParsedDocument> parsed = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            DocumentInput input = inputs.get(i);
            ParsedDocument document = await(parsing.get(i), input.documentId(), failed);
            if (document != null) {
                parsedInputs.add(input);
                parsed.add(document);
            }
        }

        for (ParsedDocument document : parsed) {
            ingestionService.register(document);
        }

        List<Future<IngestionResult>> applying = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            ParsedDocument document = parsed.get(i);
            DocumentInput input = parsedInputs.get(i);
            applying.add(executor.submit(document.documentId(),
                    () -> ingestionService.apply(document, input.declaredTotals())));
        }
        List<IngestionResult> results = new ArrayList<>(parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            IngestionResult result = await(applying.get(i), parsed.get(i).documentId(), failed);
            if (result != null) {
                results.add(result);
            }
        }
        LOGGER.info("Batch finished: {} ingested, {} failed", results.size(), failed.size());
        return new BatchOutcome(results, failed);
    }

    private <T> T await(Future<T> future, String documentId, List<String> failed) {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            LOGGER.error("Failed to process document {}", documentId, ex.getCause());
            failed.add(documentId);
            return null;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for document " + documentId, ex);
        }
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException ex) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static int requirePositive(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        return workerThreads;
    }
}
