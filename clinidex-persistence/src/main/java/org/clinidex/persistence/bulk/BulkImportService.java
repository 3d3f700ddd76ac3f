package org.clinidex.persistence.bulk;

import jakarta.annotation.PreDestroy;
import org.clinidex.core.config.ClinidexProperties;
import org.clinidex.core.document.Document;
import org.clinidex.core.exception.ClinidexException;
import org.clinidex.persistence.service.DocumentStoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes many documents in parallel, one transaction per document.
 * <p>
 * A fixed pool of {@code clinidex.bulk.parallelism} workers runs the writes. The producer
 * holds one of {@code clinidex.bulk.queue-capacity} permits per document in flight and
 * blocks when they run out. A failed document is reported and never stops the others.
 * </p>
 */
@Service
public class BulkImportService {

    private static final Logger log = LoggerFactory.getLogger(BulkImportService.class);

    private final DocumentStoreService storeService;
    private final ExecutorService workers;
    private final Semaphore inFlight;

    public BulkImportService(DocumentStoreService storeService, ClinidexProperties properties) {
        this.storeService = storeService;
        int parallelism = Math.max(1, properties.getBulk().getParallelism());
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "clinidex-bulk-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.inFlight = new Semaphore(Math.max(1, properties.getBulk().getQueueCapacity()));
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down bulk import workers");
        workers.shutdown();
    }

    /**
     * Import documents, waiting until every write has finished.
     *
     * @return the written versions in input order and one failure per rejected document
     */
    public BulkImportResult importAll(List<BulkDocument> documents) {
        long started = System.currentTimeMillis();
        List<CompletableFuture<Document>> pending = new ArrayList<>(documents.size());

        for (BulkDocument document : documents) {
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(future -> future.cancel(false));
                throw new ClinidexException("Bulk import interrupted after " + pending.size() + " documents",
                        "exception", null, e);
            }
            CompletableFuture<Document> future;
            try {
                future = CompletableFuture.supplyAsync(() -> write(document), workers);
            } catch (RejectedExecutionException e) {
                inFlight.release();
                pending.forEach(submitted -> submitted.cancel(false));
                throw new ClinidexException("Bulk import workers are shut down", "exception", null, e);
            }
            // Completion includes cancellation, so a task cancelled before it ran still returns its permit
            future.whenComplete((result, failure) -> inFlight.release());
            pending.add(future);
        }

        List<Document> written = new ArrayList<>();
        List<BulkFailure> failures = new ArrayList<>();
        for (int i = 0; i < pending.size(); i++) {
            BulkDocument document = documents.get(i);
            try {
                written.add(pending.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String issueCode = cause instanceof ClinidexException ce ? ce.getIssueCode() : "exception";
                failures.add(new BulkFailure(i, document.type(), document.id(), issueCode, cause.getMessage()));
            }
        }

        log.info("Bulk import of {} documents finished in {}ms: {} written, {} failed",
                documents.size(), System.currentTimeMillis() - started, written.size(), failures.size());
        return new BulkImportResult(written, failures);
    }

    private Document write(BulkDocument document) {
        try {
            return storeService.write(document.type(), document.id(), document.body(), document.expectedVersion());
        } catch (RuntimeException e) {
            log.debug("Bulk write of {}/{} failed: {}", document.type(), document.id(), e.getMessage());
            throw e;
        }
    }

    int availablePermits() {
        return inFlight.availablePermits();
    }
}
