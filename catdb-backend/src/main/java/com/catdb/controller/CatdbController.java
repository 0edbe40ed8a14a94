package com.catdb.controller;

import com.catdb.api.AiGenerateRequest;
import com.catdb.api.AiGenerateResponse;
import com.catdb.api.ConnectionRequest;
import com.catdb.api.ConnectionResponse;
import com.catdb.api.ConnectionsResponse;
import com.catdb.api.CsvExportRequest;
import com.catdb.api.CsvExportResponse;
import com.catdb.api.ErrorResponse;
import com.catdb.api.ExecutionRequest;
import com.catdb.api.ExecutionResponse;
import com.catdb.api.FileConnectionRequest;
import com.catdb.api.MutationResponse;
import com.catdb.api.PrimaryKeyResponse;
import com.catdb.api.RowDeleteRequest;
import com.catdb.api.RowUpdatesRequest;
import com.catdb.api.SchemaChangeRequest;
import com.catdb.api.StatementResultEvent;
import com.catdb.api.TableColumnsResponse;
import com.catdb.api.TextResponse;
import com.catdb.config.CatdbSettings;
import com.catdb.execution.CancelToken;
import com.catdb.execution.Execution;
import com.catdb.execution.ExecutionListener;
import com.catdb.execution.ExecutionNotFoundException;
import com.catdb.execution.ExecutionService;
import com.catdb.model.AppState;
import com.catdb.model.ConnectionConfig;
import com.catdb.model.ExecutionResult;
import com.catdb.mutation.MutationApplier;
import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.LiveConnection;
import com.catdb.schema.SchemaIntrospector;
import com.catdb.service.AiClientException;
import com.catdb.service.AiSqlGenerateService;
import com.catdb.service.AppStateStore;
import com.catdb.service.CsvExportService;
import com.catdb.util.DeadlineRunner;
import jakarta.annotation.PreDestroy;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@RestController
@RequestMapping("/v1")
public class CatdbController {

    private static final Logger log = LoggerFactory.getLogger(CatdbController.class);
    private static final String TRACE_ID = "trace_id";
    private static final long STREAM_TIMEOUT_MS = 600_000L;

    private final ConnectionRegistry registry;
    private final ExecutionService executionService;
    private final SchemaIntrospector introspector;
    private final MutationApplier mutationApplier;
    private final AiSqlGenerateService aiSqlGenerateService;
    private final CsvExportService csvExportService;
    private final AppStateStore appStateStore;
    private final CatdbSettings settings;
    private final ExecutorService streamWorkers = Executors.newCachedThreadPool(DeadlineRunner.daemonThreads("catdb-stream"));

    public CatdbController(
            ConnectionRegistry registry,
            ExecutionService executionService,
            SchemaIntrospector introspector,
            MutationApplier mutationApplier,
            AiSqlGenerateService aiSqlGenerateService,
            CsvExportService csvExportService,
            AppStateStore appStateStore,
            CatdbSettings settings
    ) {
        this.registry = registry;
        this.executionService = executionService;
        this.introspector = introspector;
        this.mutationApplier = mutationApplier;
        this.aiSqlGenerateService = aiSqlGenerateService;
        this.csvExportService = csvExportService;
        this.appStateStore = appStateStore;
        this.settings = settings;
    }

    /**
     * List every configured or live connection.
     *
     * GET /v1/connections
     */
    @GetMapping("/connections")
    public ConnectionsResponse listConnections() {
        List<String> liveNames = registry.liveNames();
        List<ConnectionResponse> out = new ArrayList<>();
        for (String name : registry.list()) {
            Optional<ConnectionConfig> config = registry.config(name);
            out.add(ConnectionResponse.builder()
                    .name(name)
                    .kind(config.map(ConnectionConfig::getKind).orElse(null))
                    .live(liveNames.contains(name))
                    .build());
        }
        return ConnectionsResponse.builder().connections(out).traceId(MDC.get(TRACE_ID)).build();
    }

    /**
     * Register a network (or file, when kind is sqlite) connection.
     *
     * POST /v1/connections
     */
    @PostMapping("/connections")
    public ResponseEntity<ConnectionResponse> addConnection(@RequestBody ConnectionRequest request) {
        String name = registry.add(request.getName(), request.getKind(), request.getFields());
        return ResponseEntity.status(HttpStatus.CREATED).body(describeConnection(name));
    }

    /**
     * Register an existing database file.
     *
     * POST /v1/connections/file
     */
    @PostMapping("/connections/file")
    public ResponseEntity<ConnectionResponse> addFileConnection(@Valid @RequestBody FileConnectionRequest request) {
        String name = registry.addFile(request.getName(), request.getPath());
        return ResponseEntity.status(HttpStatus.CREATED).body(describeConnection(name));
    }

    /**
     * GET /v1/connections/{name}
     */
    @GetMapping("/connections/{name}")
    public ResponseEntity<?> getConnection(@PathVariable("name") String name) {
        if (registry.config(name).isEmpty()) {
            return notFound("No connection named '" + name + "'");
        }
        return ResponseEntity.ok(describeConnection(name));
    }

    /**
     * Edit a connection; blank fields keep their values.
     *
     * PUT /v1/connections/{name}
     */
    @PutMapping("/connections/{name}")
    public ConnectionResponse editConnection(@PathVariable("name") String name, @RequestBody ConnectionRequest request) {
        String finalName = registry.edit(name, request.getNewName(), request.getKind(), request.getFields());
        return describeConnection(finalName);
    }

    /**
     * DELETE /v1/connections/{name}
     */
    @DeleteMapping("/connections/{name}")
    public ResponseEntity<Void> removeConnection(@PathVariable("name") String name) {
        registry.remove(name);
        return ResponseEntity.noContent().build();
    }

    /**
     * Open the connection if needed and check it responds.
     *
     * POST /v1/connections/{name}/probe
     */
    @PostMapping("/connections/{name}/probe")
    public ConnectionResponse probeConnection(@PathVariable("name") String name) {
        LiveConnection live = registry.get(name);
        try {
            live.probe((int) Math.max(1, settings.probeTimeout().toSeconds()));
        } catch (SQLException e) {
            throw new ConnectionUnavailableException(name, e.getMessage(), e);
        }
        log.info("Connection probed (name={}, trace_id={})", name, MDC.get(TRACE_ID));
        return describeConnection(name);
    }

    /**
     * PUT /v1/connections/{name}/schema
     */
    @PutMapping("/connections/{name}/schema")
    public ConnectionResponse changeSchema(@PathVariable("name") String name, @Valid @RequestBody SchemaChangeRequest request) {
        registry.changeSchema(name, request.getSchema());
        return describeConnection(name);
    }

    /**
     * Start running SQL text; poll the returned id for results.
     *
     * POST /v1/executions
     */
    @PostMapping("/executions")
    public ResponseEntity<ExecutionResponse> submitExecution(@Valid @RequestBody ExecutionRequest request) {
        Execution execution = executionService.submit(request.getConnection(), request.getSql(), request.getRowLimit(), null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExecutionResponse.from(execution, MDC.get(TRACE_ID)));
    }

    /**
     * Run SQL text and push each statement's result as a server-sent event.
     * Events: {@code result} per statement, then one {@code done} carrying the final state.
     * Closing the stream cancels the execution.
     *
     * POST /v1/executions/stream
     */
    @PostMapping(value = "/executions/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamExecution(@Valid @RequestBody ExecutionRequest request) {
        String traceId = MDC.get(TRACE_ID);
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        Execution execution = executionService.submit(request.getConnection(), request.getSql(), request.getRowLimit(),
                new ExecutionListener() {
                    @Override
                    public void onResult(int index, String statement, ExecutionResult result) {
                        StatementResultEvent event = StatementResultEvent.builder()
                                .index(index)
                                .statement(statement)
                                .result(result)
                                .build();
                        send(emitter, "result", event);
                    }

                    @Override
                    public void onFinished(Execution finished) {
                        send(emitter, "done", ExecutionResponse.from(finished, traceId));
                        emitter.complete();
                    }
                });
        emitter.onTimeout(() -> executionService.cancel(execution.getId()));
        emitter.onError(e -> executionService.cancel(execution.getId()));
        return emitter;
    }

    /**
     * GET /v1/executions/{id}
     */
    @GetMapping("/executions/{id}")
    public ExecutionResponse getExecution(@PathVariable("id") String id) {
        Execution execution = executionService.find(id).orElseThrow(() -> new ExecutionNotFoundException(id));
        return ExecutionResponse.from(execution, MDC.get(TRACE_ID));
    }

    /**
     * POST /v1/executions/{id}/cancel
     */
    @PostMapping("/executions/{id}/cancel")
    public ResponseEntity<ExecutionResponse> cancelExecution(@PathVariable("id") String id) {
        if (!executionService.cancel(id)) {
            throw new ExecutionNotFoundException(id);
        }
        Execution execution = executionService.find(id).orElseThrow(() -> new ExecutionNotFoundException(id));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ExecutionResponse.from(execution, MDC.get(TRACE_ID)));
    }

    /**
     * GET /v1/connections/{name}/schema
     */
    @GetMapping("/connections/{name}/schema")
    public TextResponse describeSchema(@PathVariable("name") String name) {
        String text = introspector.describe(registry.get(name));
        return TextResponse.builder().connection(name).text(text).traceId(MDC.get(TRACE_ID)).build();
    }

    /**
     * GET /v1/connections/{name}/tables
     */
    @GetMapping("/connections/{name}/tables")
    public TableColumnsResponse tableColumns(@PathVariable("name") String name) {
        return TableColumnsResponse.builder()
                .connection(name)
                .tables(introspector.tableColumns(registry.get(name)))
                .traceId(MDC.get(TRACE_ID))
                .build();
    }

    /**
     * GET /v1/connections/{name}/tables/{table}/ddl
     */
    @GetMapping("/connections/{name}/tables/{table}/ddl")
    public TextResponse tableDdl(@PathVariable("name") String name, @PathVariable("table") String table) {
        String ddl = introspector.createStatement(registry.get(name), table);
        return TextResponse.builder().connection(name).table(table).text(ddl).traceId(MDC.get(TRACE_ID)).build();
    }

    /**
     * GET /v1/connections/{name}/tables/{table}/primary-key
     */
    @GetMapping("/connections/{name}/tables/{table}/primary-key")
    public PrimaryKeyResponse primaryKey(@PathVariable("name") String name, @PathVariable("table") String table) {
        return PrimaryKeyResponse.builder()
                .connection(name)
                .table(table)
                .columns(introspector.primaryKeyColumns(registry.get(name), table))
                .traceId(MDC.get(TRACE_ID))
                .build();
    }

    /**
     * Apply grid edits in one transaction.
     *
     * POST /v1/connections/{name}/tables/{table}/updates
     */
    @PostMapping("/connections/{name}/tables/{table}/updates")
    public MutationResponse applyUpdates(
            @PathVariable("name") String name,
            @PathVariable("table") String table,
            @Valid @RequestBody RowUpdatesRequest request
    ) {
        int affected = mutationApplier.applyUpdates(registry.get(name), table, request.getEdits());
        return MutationResponse.builder().connection(name).table(table).affectedRows(affected).traceId(MDC.get(TRACE_ID)).build();
    }

    /**
     * POST /v1/connections/{name}/tables/{table}/delete
     */
    @PostMapping("/connections/{name}/tables/{table}/delete")
    public MutationResponse deleteRow(
            @PathVariable("name") String name,
            @PathVariable("table") String table,
            @Valid @RequestBody RowDeleteRequest request
    ) {
        int affected = mutationApplier.deleteRow(registry.get(name), table, request.getPrimaryKeyValues());
        return MutationResponse.builder().connection(name).table(table).affectedRows(affected).traceId(MDC.get(TRACE_ID)).build();
    }

    /**
     * Generate SQL from natural language.
     *
     * POST /v1/ai/generate
     */
    @PostMapping("/ai/generate")
    public AiGenerateResponse generateSql(@Valid @RequestBody AiGenerateRequest request) {
        AiSqlGenerateService.GeneratedSqlResult result = aiSqlGenerateService.generate(request.getPrompt(), request.getConnection());
        return AiGenerateResponse.builder()
                .sql(result.getSql())
                .enabled(result.isEnabled())
                .schemaConnection(result.getSchemaConnection())
                .warnings(result.getWarnings())
                .traceId(MDC.get(TRACE_ID))
                .build();
    }

    /**
     * Generate SQL and push the model's output as server-sent events while it streams.
     * Events: {@code reasoning}, {@code content}, {@code usage} and {@code preview} pieces, then
     * {@code result} with the final SQL, or {@code error}. Closing the stream cancels the request.
     *
     * POST /v1/ai/generate/stream
     */
    @PostMapping(value = "/ai/generate/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamGenerateSql(@Valid @RequestBody AiGenerateRequest request) {
        String traceId = MDC.get(TRACE_ID);
        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        CancelToken token = new CancelToken();
        emitter.onTimeout(token::cancel);
        emitter.onError(e -> token.cancel());
        streamWorkers.execute(() -> {
            MDC.put(TRACE_ID, traceId);
            try {
                AiSqlGenerateService.GeneratedSqlResult result = aiSqlGenerateService.generate(
                        request.getPrompt(),
                        request.getConnection(),
                        (kind, text) -> {
                            if (!send(emitter, kind.name().toLowerCase(Locale.ROOT), text)) {
                                token.cancel();
                            }
                        },
                        token);
                send(emitter, "result", AiGenerateResponse.builder()
                        .sql(result.getSql())
                        .enabled(result.isEnabled())
                        .schemaConnection(result.getSchemaConnection())
                        .warnings(result.getWarnings())
                        .traceId(traceId)
                        .build());
            } catch (AiClientException e) {
                log.warn("Streaming generation failed (error={})", e.getMessage());
                send(emitter, "error", streamError("AI_REQUEST_FAILED", e.getMessage(), traceId));
            } catch (IllegalArgumentException e) {
                send(emitter, "error", streamError("INVALID_ARGUMENT", e.getMessage(), traceId));
            } catch (RuntimeException e) {
                log.error("Streaming generation failed unexpectedly", e);
                send(emitter, "error", streamError("INTERNAL_SERVER_ERROR", "An unexpected error occurred", traceId));
            } finally {
                emitter.complete();
                MDC.remove(TRACE_ID);
            }
        });
        return emitter;
    }

    @PreDestroy
    public void shutdown() {
        streamWorkers.shutdownNow();
    }

    /**
     * POST /v1/export/csv
     */
    @PostMapping("/export/csv")
    public CsvExportResponse exportCsv(@Valid @RequestBody CsvExportRequest request) {
        Path written = csvExportService.export(
                request.getColumns(),
                request.getRows(),
                request.getPath(),
                request.isIncludeHeader(),
                request.getDelimiter().charAt(0),
                request.isUtf8Bom()
        );
        return CsvExportResponse.builder()
                .path(written.toString())
                .rows(request.getRows() != null ? request.getRows().size() : 0)
                .traceId(MDC.get(TRACE_ID))
                .build();
    }

    /**
     * GET /v1/app-state
     */
    @GetMapping("/app-state")
    public AppState getAppState() {
        return appStateStore.load();
    }

    /**
     * PUT /v1/app-state
     */
    @PutMapping("/app-state")
    public AppState saveAppState(@RequestBody AppState state) {
        appStateStore.save(state);
        return state;
    }

    private ConnectionResponse describeConnection(String name) {
        ConnectionConfig config = registry.config(name).map(ConnectionConfig::redacted).orElse(null);
        return ConnectionResponse.builder()
                .name(name)
                .kind(config != null ? config.getKind() : null)
                .live(registry.liveNames().contains(name))
                .config(config)
                .traceId(MDC.get(TRACE_ID))
                .build();
    }

    private static ResponseEntity<ErrorResponse> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                .code("NOT_FOUND")
                .message(message)
                .traceId(MDC.get(TRACE_ID))
                .build());
    }

    private static boolean send(SseEmitter emitter, String event, Object data) {
        try {
            emitter.send(SseEmitter.event().name(event).data(data));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Stream client went away (event={}, error={})", event, e.getMessage());
            return false;
        }
    }

    private static ErrorResponse streamError(String code, String message, String traceId) {
        return ErrorResponse.builder().code(code).message(message).traceId(traceId).build();
    }
}
