package com.catdb.execution;

import com.catdb.config.CatdbSettings;
import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.ConnectionValidationException;
import com.catdb.registry.LiveConnection;
import com.catdb.util.DeadlineRunner;
import com.catdb.util.StatementSplitter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs SQL off the caller's thread and keeps each run pollable by id until it has been finished
 * for longer than the retention period.
 */
@Slf4j
@Service
public class ExecutionService {

    private final ConnectionRegistry registry;
    private final ExecutionEngine engine;
    private final int defaultRowLimit;
    private final Duration retention;

    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final ExecutorService runners = Executors.newCachedThreadPool(DeadlineRunner.daemonThreads("catdb-run"));
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(DeadlineRunner.daemonThreads("catdb-run-cleanup"));

    public ExecutionService(ConnectionRegistry registry, ExecutionEngine engine, CatdbSettings settings) {
        this.registry = registry;
        this.engine = engine;
        this.defaultRowLimit = settings.defaultRowLimit();
        this.retention = settings.executionRetention();
        scheduler.scheduleAtFixedRate(this::purgeFinished, 1, 1, TimeUnit.MINUTES);
    }

    /**
     * Start running SQL text. A leading {@code -- connection: NAME} or {@code USE CONNECTION NAME;}
     * line overrides the connection name and is stripped before execution.
     *
     * @param connectionName connection to use when the text names none
     * @param sqlText sql text
     * @param rowLimit row limit, or null for the default
     * @param listener per-statement listener (may be null)
     * @return the running execution
     */
    public Execution submit(String connectionName, String sqlText, Integer rowLimit, ExecutionListener listener) {
        StatementSplitter.ConnectionDirective directive = StatementSplitter.extractConnectionDirective(sqlText);
        String target = directive.hasOverride() ? directive.connectionName() : connectionName;
        if (target == null || target.isBlank()) {
            throw new ConnectionValidationException("No connection selected");
        }
        int limit = rowLimit != null ? rowLimit : defaultRowLimit;
        if (limit < 0) {
            throw new ConnectionValidationException("Row limit must not be negative");
        }

        Execution execution = new Execution(UUID.randomUUID().toString(), target, directive.sql(), limit);
        executions.put(execution.getId(), execution);
        log.info("Execution submitted (id={}, connection={}, override={})", execution.getId(), target, directive.hasOverride());
        runners.execute(() -> runExecution(execution, listener));
        return execution;
    }

    /**
     * Look up an execution.
     *
     * @param id execution id
     * @return execution, if still retained
     */
    public Optional<Execution> find(String id) {
        return Optional.ofNullable(executions.get(id));
    }

    /**
     * Signal cancellation. The execution stops before its next statement, or interrupts the
     * current one where the driver allows it.
     *
     * @param id execution id
     * @return false if the id is unknown
     */
    public boolean cancel(String id) {
        Execution execution = executions.get(id);
        if (execution == null) {
            return false;
        }
        execution.cancelToken().cancel();
        log.info("Execution cancel requested (id={}, state={})", id, execution.getState());
        return true;
    }

    @PreDestroy
    public void shutdown() {
        executions.values().forEach(e -> e.cancelToken().cancel());
        scheduler.shutdownNow();
        runners.shutdownNow();
    }

    private void runExecution(Execution execution, ExecutionListener listener) {
        try {
            LiveConnection connection = registry.get(execution.getConnectionName());
            engine.run(connection, execution.getSql(), execution.getRowLimit(), execution.cancelToken(),
                    (index, statement, result) -> {
                        execution.addResult(result);
                        if (listener != null) {
                            listener.onResult(index, statement, result);
                        }
                    });
            execution.finish(Execution.State.SUCCEEDED, null, null);
        } catch (ExecutionCanceledException e) {
            execution.finish(Execution.State.CANCELED, e.getMessage(), e.getStatement());
        } catch (ExecutionTimeoutException e) {
            execution.finish(Execution.State.TIMED_OUT, e.getMessage(), e.getStatement());
        } catch (StatementFailedException e) {
            execution.finish(Execution.State.FAILED, e.getMessage(), e.getStatement());
        } catch (RuntimeException e) {
            log.warn("Execution failed (id={}, connection={}, error={})", execution.getId(), execution.getConnectionName(), e.getMessage());
            execution.finish(Execution.State.FAILED, e.getMessage(), null);
        }
        log.info("Execution finished (id={}, state={}, results={})", execution.getId(), execution.getState(), execution.getResults().size());
        if (listener != null) {
            listener.onFinished(execution);
        }
    }

    private void purgeFinished() {
        Instant cutoff = Instant.now().minus(retention);
        executions.values().removeIf(e -> e.isFinished() && e.getFinishedAt() != null && e.getFinishedAt().isBefore(cutoff));
    }
}
