package com.example.menuimport.worker;

import com.example.menuimport.model.ImportRequest;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Background execution context for import runs. Each worker owns one thread; {@link #process}
 * hands a run to it and every message of that run is emitted from that thread, in order.
 * {@link #cancel()} may be called from any thread and is observed at the next chunk boundary.
 */
@Slf4j
public class CsvImportWorker {

    private final ExecutorService context;
    private final CsvImportPipeline pipeline;
    private final int idPoolSize;

    private volatile ImportSession session;

    public CsvImportWorker(ThreadFactory threadFactory, int chunkSize, int idPoolSize) {
        this.context = Executors.newSingleThreadExecutor(threadFactory);
        this.pipeline = new CsvImportPipeline(chunkSize);
        this.idPoolSize = idPoolSize;
    }

    /**
     * Starts a run. The returned future completes when the worker thread leaves the run, normally
     * after the terminal message, exceptionally if the run escaped its own error handling.
     */
    public CompletableFuture<Void> process(ImportRequest request, ImportMessageListener listener) {
        ImportSession current = new ImportSession(new IdentifierPool(idPoolSize));
        session = current;
        return CompletableFuture.runAsync(() -> execute(request, current, listener), context);
    }

    public void cancel() {
        ImportSession current = session;
        if (current != null) {
            current.cancel();
        }
    }

    /**
     * Lets the current run finish, then releases the worker thread.
     */
    public void shutdown() {
        context.shutdown();
    }

    /**
     * Stops the worker thread without waiting for the run to acknowledge anything.
     */
    public void terminate() {
        context.shutdownNow();
    }

    public boolean isTerminated() {
        return context.isShutdown();
    }

    protected void execute(ImportRequest request, ImportSession current, ImportMessageListener listener) {
        try {
            pipeline.run(request, current, listener);
        } catch (RuntimeException ex) {
            log.error("Import run failed: {}", ex.getMessage(), ex);
            String message = ex.getMessage() != null ? ex.getMessage() : "Unknown error";
            listener.onMessage(ImportMessage.error(message));
        }
    }
}
