package com.example.menuimport.worker;

import com.example.menuimport.model.DestinationDescriptor;
import com.example.menuimport.model.ImportMode;
import com.example.menuimport.model.ImportProgress;
import com.example.menuimport.model.ImportRequest;
import com.example.menuimport.model.ImportResult;
import com.example.menuimport.support.ImportCancelledException;
import com.example.menuimport.support.ImportProcessingException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the import worker's lifecycle and turns its message stream into a future.
 *
 * <p>At most one run is active at a time. A worker is spawned lazily for each run and torn down
 * when the run settles, whether by completion, error, cancellation or {@link #close()}. After
 * {@link #cancel()} the worker gets a grace period to acknowledge; once it expires the worker is
 * terminated and the run's future fails with {@link ImportCancelledException} regardless.
 */
@Slf4j
public class CsvImportWorkerHost implements AutoCloseable {

    private final Supplier<CsvImportWorker> workerFactory;
    private final ScheduledExecutorService scheduler;
    private final Duration cancelGracePeriod;
    private final Object lock = new Object();

    private ActiveRun activeRun;
    private boolean closed;
    private volatile ImportProgress progress;
    private volatile String lastError;

    public CsvImportWorkerHost(Supplier<CsvImportWorker> workerFactory,
            ScheduledExecutorService scheduler,
            Duration cancelGracePeriod) {
        this.workerFactory = workerFactory;
        this.scheduler = scheduler;
        this.cancelGracePeriod = cancelGracePeriod;
    }

    public CompletableFuture<ImportResult> start(List<Map<String, String>> rows,
            Map<String, String> columnMapping,
            ImportMode mode,
            List<DestinationDescriptor> existingDestinations,
            boolean allowCreateDestinations) {
        return start(new ImportRequest(rows, columnMapping, mode, existingDestinations, allowCreateDestinations));
    }

    /**
     * Launches a run. The returned future always settles: with the result, with
     * {@link ImportCancelledException} when cancelled, or with {@link ImportProcessingException}.
     *
     * @throws ImportProcessingException if a run is already active or the host is closed
     */
    public CompletableFuture<ImportResult> start(ImportRequest request) {
        ActiveRun run;
        synchronized (lock) {
            if (closed) {
                throw new ImportProcessingException("Import worker host has been closed");
            }
            if (activeRun != null) {
                log.warn("Rejecting import request because another run is in progress");
                throw new ImportProcessingException("An import is already running. Please wait for it to finish.");
            }

            CsvImportWorker worker;
            try {
                worker = workerFactory.get();
            } catch (RuntimeException ex) {
                log.error("Failed to spawn import worker: {}", ex.getMessage(), ex);
                lastError = ex.getMessage();
                return CompletableFuture.failedFuture(
                        new ImportProcessingException("Failed to start import worker", ex));
            }

            run = new ActiveRun(worker);
            activeRun = run;
            progress = ImportProgress.initializing(request.rows().size());
            lastError = null;
        }

        try {
            run.worker.process(request, message -> onMessage(run, message))
                    .whenComplete((ignored, failure) -> onWorkerExit(run, failure));
        } catch (RuntimeException ex) {
            fail(run, new ImportProcessingException("Failed to start import worker", ex), true);
        }
        return run.result;
    }

    /**
     * Requests cancellation of the active run, if any, and arms the forced-termination deadline.
     */
    public void cancel() {
        ActiveRun run;
        synchronized (lock) {
            run = activeRun;
            if (run == null || run.cancelRequested) {
                return;
            }
            run.cancelRequested = true;
        }

        log.info("Cancelling import run, forced termination in {} ms", cancelGracePeriod.toMillis());
        run.worker.cancel();
        ScheduledFuture<?> deadline = scheduler.schedule(
                () -> forceTerminate(run), cancelGracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        synchronized (lock) {
            if (activeRun == run) {
                run.deadline = deadline;
                return;
            }
        }
        deadline.cancel(false);
    }

    public boolean isProcessing() {
        synchronized (lock) {
            return activeRun != null;
        }
    }

    /**
     * Latest progress of the active run, empty when idle.
     */
    public Optional<ImportProgress> progress() {
        return Optional.ofNullable(progress);
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public void close() {
        ActiveRun run;
        synchronized (lock) {
            closed = true;
            run = activeRun;
        }
        if (run != null) {
            log.info("Closing import worker host with a run in progress");
            fail(run, new ImportCancelledException(ImportMessage.CANCELLED_MESSAGE), true);
        }
    }

    private void onMessage(ActiveRun run, ImportMessage message) {
        if (message instanceof ImportMessage.Progress update) {
            synchronized (lock) {
                if (activeRun == run) {
                    progress = update.progress();
                }
            }
        } else if (message instanceof ImportMessage.Complete complete) {
            if (detach(run)) {
                run.result.complete(complete.result());
                teardown(run, false);
            }
        } else if (message instanceof ImportMessage.Error error) {
            fail(run, error.cancelled()
                    ? new ImportCancelledException(error.message())
                    : new ImportProcessingException(error.message()), false);
        }
    }

    private void onWorkerExit(ActiveRun run, Throwable failure) {
        if (failure == null) {
            fail(run, new ImportProcessingException("Import worker exited without a result"), false);
            return;
        }
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
        fail(run, new ImportProcessingException("Import worker crashed: " + cause.getMessage(), cause), false);
    }

    private void forceTerminate(ActiveRun run) {
        if (fail(run, new ImportCancelledException(ImportMessage.CANCELLED_MESSAGE), true)) {
            log.warn("Import worker did not acknowledge cancellation within {} ms, terminated",
                    cancelGracePeriod.toMillis());
        }
    }

    private boolean fail(ActiveRun run, ImportProcessingException failure, boolean force) {
        if (!detach(run)) {
            return false;
        }
        if (!(failure instanceof ImportCancelledException)) {
            lastError = failure.getMessage();
            log.warn("Import run failed: {}", failure.getMessage());
        }
        run.result.completeExceptionally(failure);
        teardown(run, force);
        return true;
    }

    /**
     * Detaches the run from the host. Only the first caller for a run gets {@code true}; later
     * messages or deadlines for the same run are ignored.
     */
    private boolean detach(ActiveRun run) {
        synchronized (lock) {
            if (activeRun != run) {
                return false;
            }
            activeRun = null;
            progress = null;
        }
        ScheduledFuture<?> deadline = run.deadline;
        if (deadline != null) {
            deadline.cancel(false);
        }
        return true;
    }

    private static void teardown(ActiveRun run, boolean force) {
        if (force) {
            run.worker.terminate();
        } else {
            run.worker.shutdown();
        }
    }

    private static final class ActiveRun {
        private final CsvImportWorker worker;
        private final CompletableFuture<ImportResult> result = new CompletableFuture<>();
        private boolean cancelRequested;
        private volatile ScheduledFuture<?> deadline;

        private ActiveRun(CsvImportWorker worker) {
            this.worker = worker;
        }
    }
}
