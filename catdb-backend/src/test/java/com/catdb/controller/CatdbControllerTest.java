package com.catdb.controller;

import com.catdb.config.CatdbSettings;
import com.catdb.execution.CancelToken;
import com.catdb.execution.Execution;
import com.catdb.execution.ExecutionListener;
import com.catdb.execution.ExecutionService;
import com.catdb.execution.StatementFailedException;
import com.catdb.model.AppState;
import com.catdb.model.ConnectionConfig;
import com.catdb.model.ExecutionResult;
import com.catdb.mutation.MutationApplier;
import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.DatabaseFileNotFoundException;
import com.catdb.registry.LiveConnection;
import com.catdb.schema.SchemaIntrospector;
import com.catdb.service.AiClientException;
import com.catdb.service.AiProgressListener;
import com.catdb.service.AiSqlGenerateService;
import com.catdb.service.AppStateStore;
import com.catdb.service.CsvExportService;
import com.catdb.web.GlobalExceptionHandler;
import com.catdb.web.TraceIdFilter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyChar;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CatdbControllerTest {

    private ConnectionRegistry registry;
    private ExecutionService executionService;
    private SchemaIntrospector introspector;
    private MutationApplier mutationApplier;
    private AiSqlGenerateService aiSqlGenerateService;
    private CsvExportService csvExportService;
    private AppStateStore appStateStore;
    private CatdbController controller;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = mock(ConnectionRegistry.class);
        executionService = mock(ExecutionService.class);
        introspector = mock(SchemaIntrospector.class);
        mutationApplier = mock(MutationApplier.class);
        aiSqlGenerateService = mock(AiSqlGenerateService.class);
        csvExportService = mock(CsvExportService.class);
        appStateStore = mock(AppStateStore.class);

        controller = new CatdbController(registry, executionService, introspector, mutationApplier,
                aiSqlGenerateService, csvExportService, appStateStore, CatdbSettings.defaults());
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .build();

        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
                .addFilters(new TraceIdFilter())
                .build();
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
    }

    @Test
    void listsConnectionsWithLiveFlag() throws Exception {
        when(registry.list()).thenReturn(List.of("local", "warehouse"));
        when(registry.liveNames()).thenReturn(List.of("warehouse"));
        when(registry.config("local")).thenReturn(Optional.of(ConnectionConfig.builder().kind("sqlite").path("/a.db").build()));
        when(registry.config("warehouse")).thenReturn(Optional.of(ConnectionConfig.builder().kind("postgresql").build()));

        mockMvc.perform(get("/v1/connections").header("X-Request-Id", "req-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-1"))
                .andExpect(jsonPath("$.connections", hasSize(2)))
                .andExpect(jsonPath("$.connections[0].name").value("local"))
                .andExpect(jsonPath("$.connections[0].live").value(false))
                .andExpect(jsonPath("$.connections[1].kind").value("postgresql"))
                .andExpect(jsonPath("$.connections[1].live").value(true))
                .andExpect(jsonPath("$.trace_id").value("req-1"));
    }

    @Test
    void addsConnectionFromFieldsAndHidesPassword() throws Exception {
        when(registry.add(eq("pg"), eq("postgresql"), any())).thenReturn("pg");
        when(registry.config("pg")).thenReturn(Optional.of(ConnectionConfig.builder()
                .kind("postgresql").host("h").port(5432).user("u").password("secret").build()));
        when(registry.liveNames()).thenReturn(List.of("pg"));

        mockMvc.perform(post("/v1/connections")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"pg\",\"kind\":\"postgresql\",\"fields\":{\"host\":\"h\",\"password\":\"secret\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("pg"))
                .andExpect(jsonPath("$.live").value(true))
                .andExpect(jsonPath("$.config.host").value("h"))
                .andExpect(jsonPath("$.config.type").value("postgresql"))
                .andExpect(jsonPath("$.config.password").doesNotExist());

        verify(registry).add("pg", "postgresql", Map.of("host", "h", "password", "secret"));
    }

    @Test
    void fileConnectionRequiresPath() throws Exception {
        mockMvc.perform(post("/v1/connections/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.trace_id").isNotEmpty());
    }

    @Test
    void missingDatabaseFileIsNotFound() throws Exception {
        when(registry.addFile(isNull(), eq("/nope.db"))).thenThrow(new DatabaseFileNotFoundException("/nope.db"));

        mockMvc.perform(post("/v1/connections/file")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/nope.db\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details").value("/nope.db"));
    }

    @Test
    void unknownConnectionIsNotFound() throws Exception {
        when(registry.config("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/connections/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void removesConnection() throws Exception {
        mockMvc.perform(delete("/v1/connections/old"))
                .andExpect(status().isNoContent());

        verify(registry).remove("old");
    }

    @Test
    void submitsExecution() throws Exception {
        Execution execution = mock(Execution.class);
        when(execution.getId()).thenReturn("exec-1");
        when(execution.getConnectionName()).thenReturn("local");
        when(execution.getState()).thenReturn(Execution.State.RUNNING);
        when(execution.getResults()).thenReturn(List.of());
        when(execution.getStartedAt()).thenReturn(Instant.parse("2024-05-01T10:00:00Z"));
        when(executionService.submit("local", "SELECT 1", 10, null)).thenReturn(execution);

        mockMvc.perform(post("/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connection\":\"local\",\"sql\":\"SELECT 1\",\"row_limit\":10}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value("exec-1"))
                .andExpect(jsonPath("$.state").value("RUNNING"))
                .andExpect(jsonPath("$.started_at").value("2024-05-01T10:00:00Z"))
                .andExpect(jsonPath("$.finished_at").value(nullValue()));
    }

    @Test
    void streamsStatementResultsThenFinalState() throws Exception {
        Execution execution = mock(Execution.class);
        when(execution.getId()).thenReturn("exec-2");
        when(execution.getConnectionName()).thenReturn("local");
        when(execution.getState()).thenReturn(Execution.State.SUCCEEDED);
        when(execution.getResults()).thenReturn(List.of());
        when(executionService.submit(eq("local"), eq("SELECT 1; DELETE FROM t"), isNull(), any(ExecutionListener.class)))
                .thenAnswer(invocation -> {
                    ExecutionListener listener = invocation.getArgument(3);
                    listener.onResult(0, "SELECT 1", ExecutionResult.builder()
                            .columns(List.of("1"))
                            .rows(List.of(List.of(1)))
                            .build());
                    listener.onResult(1, "DELETE FROM t", ExecutionResult.affectedRows(3, 0.01));
                    listener.onFinished(execution);
                    return execution;
                });

        MvcResult result = mockMvc.perform(post("/v1/executions/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connection\":\"local\",\"sql\":\"SELECT 1; DELETE FROM t\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5000);

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:result", "\"statement\":\"SELECT 1\"", "Affected rows: 3", "event:done",
                "\"state\":\"SUCCEEDED\"");
        assertThat(body.indexOf("\"index\":1")).isLessThan(body.indexOf("event:done"));
    }

    @Test
    void executionRequestRejectsNegativeRowLimit() throws Exception {
        mockMvc.perform(post("/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"connection\":\"local\",\"sql\":\"SELECT 1\",\"row_limit\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void unknownExecutionIsNotFound() throws Exception {
        when(executionService.find("missing")).thenReturn(Optional.empty());
        when(executionService.cancel("missing")).thenReturn(false);

        mockMvc.perform(get("/v1/executions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details").value("missing"));
        mockMvc.perform(post("/v1/executions/missing/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unavailableConnectionMapsTo503() throws Exception {
        when(registry.get("down")).thenThrow(new ConnectionUnavailableException("down", "refused", null));

        mockMvc.perform(get("/v1/connections/down/schema"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("CONNECTION_UNAVAILABLE"));
    }

    @Test
    void describesSchemaAndDdl() throws Exception {
        LiveConnection live = mock(LiveConnection.class);
        when(registry.get("local")).thenReturn(live);
        when(introspector.describe(live)).thenReturn("Tables:\n- t\n");
        when(introspector.createStatement(live, "t")).thenReturn("CREATE TABLE \"t\" (\n  \"id\" INTEGER\n);");
        when(introspector.primaryKeyColumns(live, "t")).thenReturn(List.of("id"));

        mockMvc.perform(get("/v1/connections/local/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("Tables:\n- t\n"));
        mockMvc.perform(get("/v1/connections/local/tables/t/ddl"))
                .andExpect(jsonPath("$.table").value("t"))
                .andExpect(jsonPath("$.text").value("CREATE TABLE \"t\" (\n  \"id\" INTEGER\n);"));
        mockMvc.perform(get("/v1/connections/local/tables/t/primary-key"))
                .andExpect(jsonPath("$.columns[0]").value("id"));
    }

    @Test
    void failedUpdateMapsTo422WithStatement() throws Exception {
        LiveConnection live = mock(LiveConnection.class);
        when(registry.get("local")).thenReturn(live);
        when(mutationApplier.applyUpdates(eq(live), eq("items"), anyList()))
                .thenThrow(new StatementFailedException("UPDATE \"items\" SET \"name\" = ? WHERE \"id\" = ?", null));

        mockMvc.perform(post("/v1/connections/local/tables/items/updates")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"edits\":[{\"primary_key_values\":{\"id\":1},\"changed_values\":{\"name\":null}}]}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("STATEMENT_FAILED"))
                .andExpect(jsonPath("$.details").value("UPDATE \"items\" SET \"name\" = ? WHERE \"id\" = ?"));
    }

    @Test
    void deletesRow() throws Exception {
        LiveConnection live = mock(LiveConnection.class);
        when(registry.get("local")).thenReturn(live);
        when(mutationApplier.deleteRow(live, "items", Map.of("id", 2))).thenReturn(1);

        mockMvc.perform(post("/v1/connections/local/tables/items/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"primary_key_values\":{\"id\":2}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.affected_rows").value(1));
    }

    @Test
    void generatesSql() throws Exception {
        when(aiSqlGenerateService.generate("all users", null))
                .thenReturn(AiSqlGenerateService.GeneratedSqlResult.success("SELECT * FROM users", "local"));

        mockMvc.perform(post("/v1/ai/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"all users\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sql").value("SELECT * FROM users"))
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.schema_connection").value("local"));
    }

    @Test
    void streamsGenerationChunksThenResult() throws Exception {
        when(aiSqlGenerateService.generate(eq("top customers"), eq("local"), any(AiProgressListener.class), any(CancelToken.class)))
                .thenAnswer(invocation -> {
                    AiProgressListener listener = invocation.getArgument(2);
                    listener.onChunk(AiProgressListener.ChunkKind.REASONING, "thinking");
                    listener.onChunk(AiProgressListener.ChunkKind.CONTENT, "SELECT name");
                    return AiSqlGenerateService.GeneratedSqlResult.success("SELECT name FROM customers", "local");
                });

        MvcResult result = mockMvc.perform(post("/v1/ai/generate/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"top customers\",\"connection\":\"local\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5000);

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("event:reasoning", "data:thinking", "event:content", "data:SELECT name",
                "event:result", "\"sql\":\"SELECT name FROM customers\"");
        assertThat(body.indexOf("event:reasoning")).isLessThan(body.indexOf("event:content"));
        assertThat(body.indexOf("event:content")).isLessThan(body.indexOf("event:result"));
    }

    @Test
    void streamedGenerationFailureIsReportedAsErrorEvent() throws Exception {
        when(aiSqlGenerateService.generate(anyString(), any(), any(AiProgressListener.class), any(CancelToken.class)))
                .thenThrow(new AiClientException("HTTP error from AI endpoint: 500; body="));

        MvcResult result = mockMvc.perform(post("/v1/ai/generate/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"x\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();
        result.getAsyncResult(5000);

        assertThat(result.getResponse().getContentAsString())
                .contains("event:error", "\"code\":\"AI_REQUEST_FAILED\"")
                .doesNotContain("event:result");
    }

    @Test
    void aiEndpointFailureMapsTo502() throws Exception {
        when(aiSqlGenerateService.generate(anyString(), any())).thenThrow(new AiClientException("HTTP error from AI endpoint: 500; body="));

        mockMvc.perform(post("/v1/ai/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"prompt\":\"x\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("AI_REQUEST_FAILED"));
    }

    @Test
    void exportsCsvWithRequestedDelimiter() throws Exception {
        when(csvExportService.export(anyList(), anyList(), eq("/tmp/out"), anyBoolean(), anyChar(), anyBoolean()))
                .thenReturn(Paths.get("/tmp/out.csv"));

        mockMvc.perform(post("/v1/export/csv")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"columns\":[\"id\"],\"rows\":[[1],[2]],\"path\":\"/tmp/out\",\"delimiter\":\";\",\"utf8_bom\":false}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.path").value("/tmp/out.csv"))
                .andExpect(jsonPath("$.rows").value(2));

        verify(csvExportService).export(List.of("id"), List.of(List.of(1), List.of(2)), "/tmp/out", true, ';', false);
    }

    @Test
    void csvExportRejectsMultiCharacterDelimiter() throws Exception {
        mockMvc.perform(post("/v1/export/csv")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\":\"/tmp/out\",\"delimiter\":\";;\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void roundTripsAppState() throws Exception {
        when(appStateStore.load()).thenReturn(new AppState("SELECT 1", true));

        mockMvc.perform(get("/v1/app-state"))
                .andExpect(jsonPath("$.last_sql").value("SELECT 1"))
                .andExpect(jsonPath("$.dark_mode").value(true));
        mockMvc.perform(put("/v1/app-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"last_sql\":\"SELECT 2\",\"dark_mode\":false}"))
                .andExpect(status().isOk());

        verify(appStateStore).save(new AppState("SELECT 2", false));
    }
}
