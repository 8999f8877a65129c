package cl.leychile.structure.engine;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.MDC;

/**
 * Submits tasks to a pool carrying the caller's MDC plus the {@code document} key of the task.
 */
final class MdcPropagatingExecutor {

    static final String DOCUMENT_KEY = "document";

    private final ExecutorService delegate;

    MdcPropagatingExecutor(ExecutorService delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    <T> Future<T> submit(String documentId, Callable<T> task) {
        Map<String, String> parent = MDC.getCopyOfContextMap();
        return delegate.submit(() -> {
            if (parent != null) {
                MDC.setContextMap(parent);
            }
            MDC.put(DOCUMENT_KEY, documentId);
            try {
                return task.call();
            } finally {
                MDC.clear();
            }
        });
    }
}
