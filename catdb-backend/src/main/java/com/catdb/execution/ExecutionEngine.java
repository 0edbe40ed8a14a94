package com.catdb.execution;

import com.catdb.config.CatdbSettings;
import com.catdb.model.ExecutionResult;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.LiveConnection;
import com.catdb.util.DeadlineRunner;
import com.catdb.util.JdbcValues;
import com.catdb.util.StatementSplitter;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the statements of a SQL text, in order, on one physical connection.
 *
 * <p>Each statement executes on a worker thread while the calling thread waits for whichever
 * comes first: completion, the cancel signal, or the statement timeout. On cancel or timeout the
 * in-flight statement is cancelled and its connection evicted from the pool. Whether the driver
 * actually stops the statement is up to the driver.
 */
@Slf4j
@Service
public class ExecutionEngine {

    private final Duration statementTimeout;
    private final ExecutorService workers = Executors.newCachedThreadPool(DeadlineRunner.daemonThreads("catdb-exec"));

    @Autowired
    public ExecutionEngine(CatdbSettings settings) {
        this(settings.statementTimeout());
    }

    /**
     * Create an engine with an explicit statement timeout.
     *
     * @param statementTimeout ceiling for one statement
     */
    public ExecutionEngine(Duration statementTimeout) {
        this.statementTimeout = statementTimeout;
    }

    /**
     * Run SQL text.
     *
     * @param connection borrowed handle
     * @param sqlText one or more statements separated by {@code ;}
     * @param rowLimit maximum rows kept per row set
     * @param cancelToken cancel signal (may be null)
     * @return one result per statement, in order
     * @throws ExecutionCanceledException when canceled
     * @throws ExecutionTimeoutException when a statement exceeds the timeout
     * @throws StatementFailedException when the driver rejects a statement
     */
    public List<ExecutionResult> run(LiveConnection connection, String sqlText, int rowLimit, CancelToken cancelToken) {
        return run(connection, sqlText, rowLimit, cancelToken, null);
    }

    /**
     * Run SQL text, reporting each result to a listener as it completes.
     *
     * @param connection borrowed handle
     * @param sqlText one or more statements separated by {@code ;}
     * @param rowLimit maximum rows kept per row set
     * @param cancelToken cancel signal (may be null)
     * @param listener per-statement listener (may be null)
     * @return one result per statement, in order
     */
    public List<ExecutionResult> run(
            LiveConnection connection,
            String sqlText,
            int rowLimit,
            CancelToken cancelToken,
            ExecutionListener listener
    ) {
        if (rowLimit < 0) {
            throw new IllegalArgumentException("rowLimit must not be negative: " + rowLimit);
        }
        CancelToken token = cancelToken != null ? cancelToken : new CancelToken();
        List<String> statements = StatementSplitter.split(sqlText);
        if (statements.isEmpty()) {
            return List.of();
        }
        if (token.isCancelled()) {
            throw new ExecutionCanceledException(statements.get(0));
        }

        Connection conn = acquire(connection, token, statements.get(0));
        List<ExecutionResult> results = new ArrayList<>(statements.size());
        try {
            for (int i = 0; i < statements.size(); i++) {
                String sql = statements.get(i);
                if (token.isCancelled()) {
                    throw new ExecutionCanceledException(sql);
                }
                ExecutionResult result = runOne(connection, conn, sql, rowLimit, token);
                results.add(result);
                if (listener != null) {
                    try {
                        listener.onResult(i, sql, result);
                    } catch (RuntimeException e) {
                        log.warn("Execution listener failed (connection={}, index={}, error={})", connection.getName(), i, e.getMessage());
                    }
                }
            }
        } finally {
            closeQuietly(conn);
        }
        return Collections.unmodifiableList(results);
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    private Connection acquire(LiveConnection connection, CancelToken token, String firstStatement) {
        CompletableFuture<Connection> acquiring = CompletableFuture.supplyAsync(() -> {
            try {
                return connection.getConnection();
            } catch (SQLException e) {
                throw new CompletionException(e);
            }
        }, workers);

        Outcome outcome = await(acquiring, token);
        if (outcome == Outcome.DONE) {
            try {
                return acquiring.join();
            } catch (CompletionException e) {
                Throwable cause = unwrap(e);
                throw new ConnectionUnavailableException(connection.getName(), String.valueOf(cause.getMessage()), cause);
            }
        }
        // hand the connection back whenever the pool eventually delivers it
        acquiring.thenAccept(ExecutionEngine::closeQuietly);
        if (outcome == Outcome.CANCELED) {
            throw new ExecutionCanceledException(firstStatement);
        }
        throw new ConnectionUnavailableException(connection.getName(),
                "no pooled connection within " + statementTimeout.toSeconds() + " seconds", null);
    }

    private ExecutionResult runOne(LiveConnection connection, Connection conn, String sql, int rowLimit, CancelToken token) {
        AtomicReference<Statement> inFlight = new AtomicReference<>();
        CompletableFuture<ExecutionResult> task = CompletableFuture.supplyAsync(
                () -> execute(conn, sql, rowLimit, inFlight), workers);

        Outcome outcome = await(task, token);
        if (outcome == Outcome.DONE) {
            try {
                return task.join();
            } catch (CompletionException e) {
                throw new StatementFailedException(sql, unwrap(e));
            }
        }

        interrupt(connection, conn, inFlight.get());
        if (outcome == Outcome.CANCELED) {
            log.info("Statement canceled (connection={})", connection.getName());
            throw new ExecutionCanceledException(sql);
        }
        log.warn("Statement timed out (connection={}, timeout_ms={})", connection.getName(), statementTimeout.toMillis());
        throw new ExecutionTimeoutException(sql, statementTimeout);
    }

    private ExecutionResult execute(Connection conn, String sql, int rowLimit, AtomicReference<Statement> inFlight) {
        long started = System.nanoTime();
        try (Statement st = conn.createStatement()) {
            inFlight.set(st);
            if (rowLimit < Integer.MAX_VALUE) {
                st.setMaxRows(rowLimit + 1);
            }
            boolean hasResultSet = st.execute(sql);
            if (hasResultSet) {
                try (ResultSet rs = st.getResultSet()) {
                    return readRows(rs, rowLimit, started);
                }
            }
            int count = st.getUpdateCount();
            return ExecutionResult.affectedRows(Math.max(count, 0), elapsedSeconds(started));
        } catch (SQLException e) {
            throw new CompletionException(e);
        }
    }

    private static ExecutionResult readRows(ResultSet rs, int rowLimit, long started) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(md.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        boolean truncated = false;
        while (rs.next()) {
            if (rows.size() >= rowLimit) {
                truncated = true;
                break;
            }
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(JdbcValues.read(rs, i));
            }
            rows.add(Collections.unmodifiableList(row));
        }
        return ExecutionResult.builder()
                .columns(Collections.unmodifiableList(columns))
                .rows(Collections.unmodifiableList(rows))
                .elapsedSeconds(elapsedSeconds(started))
                .truncated(truncated)
                .build();
    }

    private enum Outcome {
        DONE,
        CANCELED,
        TIMED_OUT
    }

    private Outcome await(CompletableFuture<?> task, CancelToken token) {
        CompletableFuture<Object> race = CompletableFuture.anyOf(task, token.whenCancelled());
        try {
            race.get(statementTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return task.isDone() ? Outcome.DONE : Outcome.TIMED_OUT;
        } catch (ExecutionException e) {
            // task failed; reported through task.join()
            return Outcome.DONE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return task.isDone() ? Outcome.DONE : Outcome.CANCELED;
        }
        return task.isDone() ? Outcome.DONE : Outcome.CANCELED;
    }

    private void interrupt(LiveConnection connection, Connection conn, Statement statement) {
        if (statement != null) {
            try {
                statement.cancel();
            } catch (SQLException | RuntimeException e) {
                log.debug("Statement cancel not honored (connection={}, error={})", connection.getName(), e.getMessage());
            }
        }
        connection.evict(conn);
        try {
            conn.abort(workers);
        } catch (SQLException | RuntimeException e) {
            log.debug("Connection abort not honored (connection={}, error={})", connection.getName(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static double elapsedSeconds(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }

    private static void closeQuietly(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException | RuntimeException e) {
            log.debug("Closing connection failed (error={})", e.getMessage());
        }
    }
}
