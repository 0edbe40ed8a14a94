package com.catdb.service;

import com.catdb.execution.CancelToken;
import com.catdb.service.AiProgressListener.ChunkKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Turns a natural-language request into SQL through an OpenAI-compatible chat/completions API.
 *
 * <p>Plain HTTP via {@link HttpClient}; no vendor SDK. When a progress listener is given the
 * request is streamed and partial output is forwarded as it arrives.
 */
@Service
public class AiSqlGenerateService {

    private static final Logger log = LoggerFactory.getLogger(AiSqlGenerateService.class);

    private static final String DEFAULT_BASE_URL = "https://ark.cn-beijing.volces.com/api/v3";
    private static final String DEFAULT_MODEL = "doubao-seed-1-6-250615";
    private static final String DEFAULT_API_KEY_SETTING = "ARK_API_KEY";
    private static final int DEFAULT_TIMEOUT_MS = 60000;
    private static final int MAX_ATTEMPTS = 3;
    private static final long RETRY_BACKOFF_MS = 500;
    private static final int MAX_TOKENS = 1024;
    private static final Pattern ENV_NAME = Pattern.compile("[A-Z_][A-Z0-9_]*");

    private static final String INSTRUCTION =
            "You are a helpful assistant that converts a developer's natural language request into a single valid SQL query. "
                    + "Return only the SQL statement, do not wrap it in markdown or explain it. "
                    + "If the request is ambiguous, return a commented SQL with a short clarifying comment. "
                    + "Answer in the language of the user input.\n\n";

    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;
    private final Environment environment;
    private final SchemaContextProvider schemaContextProvider;

    /**
     * Create the service.
     *
     * @param objectMapper Jackson object mapper
     * @param environment Spring environment for configuration
     * @param schemaContextProvider source of schema descriptions for prompts
     */
    public AiSqlGenerateService(ObjectMapper objectMapper, Environment environment, SchemaContextProvider schemaContextProvider) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.schemaContextProvider = schemaContextProvider;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether generation is enabled. Never logs the key itself.
     */
    @PostConstruct
    public void logAiConfigStatus() {
        AiConfig config = AiConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("AI SQL generation is ENABLED (endpoint={}, model={}, include_schema={})",
                    config.endpoint(), config.model(), config.includeSchema());
            return;
        }
        log.warn("AI SQL generation is DISABLED (endpoint={}, api_key_setting={})", config.endpoint(), config.apiKeySetting());
    }

    /**
     * Generate SQL without streaming.
     *
     * @param prompt natural-language request
     * @param connectionName connection whose schema enriches the prompt, or null to pick one
     * @return result
     */
    public GeneratedSqlResult generate(String prompt, String connectionName) {
        return generate(prompt, connectionName, null, null);
    }

    /**
     * Generate SQL.
     *
     * @param prompt natural-language request
     * @param connectionName connection whose schema enriches the prompt, or null to pick one
     * @param listener streaming listener; when null the request is not streamed
     * @param cancelToken cancel signal (may be null)
     * @return result; disabled when no API key is configured
     * @throws IllegalArgumentException when the prompt is blank
     * @throws AiClientException when the endpoint fails or the request is canceled
     */
    public GeneratedSqlResult generate(String prompt, String connectionName, AiProgressListener listener, CancelToken cancelToken) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Empty prompt");
        }
        AiConfig config = AiConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            return GeneratedSqlResult.disabled(config.disabledWarnings());
        }
        CancelToken token = cancelToken != null ? cancelToken : new CancelToken();

        String schemaConnection = null;
        String schemaText = "";
        if (config.includeSchema()) {
            Optional<SchemaContextProvider.SchemaContext> ctx = schemaContextProvider.resolve(connectionName);
            if (ctx.isPresent()) {
                schemaConnection = ctx.get().connectionName();
                schemaText = ctx.get().text();
                log.debug("Including schema in prompt (connection={}, length={})", schemaConnection, schemaText.length());
            }
        }

        String body = buildPayload(config, buildPrompt(prompt.trim(), schemaText), listener != null);
        String text = listener != null
                ? sendStreaming(config, body, listener, token)
                : sendBlocking(config, body, token);
        return GeneratedSqlResult.success(stripFences(text), schemaConnection);
    }

    static String buildPrompt(String request, String schemaText) {
        String tail = INSTRUCTION + "UserInput: ```" + request + "```\n\nSQL:";
        if (schemaText == null || schemaText.isBlank()) {
            return tail;
        }
        return "Current DB schema:\n```" + schemaText + "```\n\n" + tail;
    }

    static String stripFences(String content) {
        String s = content == null ? "" : content.trim();
        if (s.startsWith("```") && s.endsWith("```") && s.length() >= 6) {
            List<String> lines = new ArrayList<>(List.of(s.split("\\R", -1)));
            lines.remove(0);
            if (!lines.isEmpty() && lines.get(lines.size() - 1).trim().startsWith("```")) {
                lines.remove(lines.size() - 1);
            }
            s = String.join("\n", lines).trim();
        }
        return s;
    }

    private String buildPayload(AiConfig config, String prompt, boolean stream) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        payload.put("temperature", 0.0);
        payload.put("max_tokens", MAX_TOKENS);
        if (stream) {
            payload.put("stream", true);
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AiClientException("Failed to encode AI request", e);
        }
    }

    private String sendBlocking(AiConfig config, String body, CancelToken token) {
        HttpResponse<String> response = send(config, body, HttpResponse.BodyHandlers.ofString(), token);
        if (response.statusCode() >= 400) {
            throw httpError(config, response.statusCode(), response.body());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AiClientException("AI response is not valid JSON", e);
        }
        JsonNode first = root.path("choices").path(0);
        String text = firstText(first.path("message").path("content"), first.path("text"), root.path("result"), root.path("data"));
        return text != null ? text : response.body();
    }

    private String sendStreaming(AiConfig config, String body, AiProgressListener listener, CancelToken token) {
        HttpResponse<Stream<String>> response = send(config, body, HttpResponse.BodyHandlers.ofLines(), token);
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() >= 400) {
                throw httpError(config, response.statusCode(), String.join("\n", (Iterable<String>) lines::iterator));
            }
            StreamCollector collector = new StreamCollector(listener);
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (token.isCancelled()) {
                    throw new AiClientException("AI generation canceled");
                }
                if (!collector.accept(it.next())) {
                    break;
                }
            }
            return collector.text();
        }
    }

    private <T> HttpResponse<T> send(AiConfig config, String body, HttpResponse.BodyHandler<T> handler, CancelToken token) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(config.endpoint()))
                .timeout(Duration.ofMillis(config.timeoutMs()))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        for (int attempt = 1; ; attempt++) {
            HttpResponse<T> response = await(httpClient.sendAsync(request, handler), token);
            if (response.statusCode() < 500 || attempt >= MAX_ATTEMPTS) {
                return response;
            }
            log.warn("AI endpoint returned server error, retrying (status_code={}, attempt={})", response.statusCode(), attempt);
            if (response.body() instanceof Stream) {
                ((Stream<?>) response.body()).close();
            }
            sleepBackoff(attempt, token);
        }
    }

    private <T> HttpResponse<T> await(CompletableFuture<HttpResponse<T>> call, CancelToken token) {
        try {
            CompletableFuture.anyOf(call, token.whenCancelled()).get();
            if (!call.isDone()) {
                call.cancel(true);
                throw new AiClientException("AI generation canceled");
            }
            return call.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            throw new AiClientException("AI request interrupted", e);
        } catch (ExecutionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AiClientException("AI request failed: " + cause.getMessage(), cause);
        }
    }

    private static void sleepBackoff(int attempt, CancelToken token) {
        try {
            Thread.sleep(RETRY_BACKOFF_MS * (1L << (attempt - 1)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiClientException("AI request interrupted", e);
        }
        if (token.isCancelled()) {
            throw new AiClientException("AI generation canceled");
        }
    }

    private static AiClientException httpError(AiConfig config, int status, String body) {
        log.warn("AI endpoint request failed (status_code={}, endpoint={}, model={})", status, config.endpoint(), config.model());
        return new AiClientException("HTTP error from AI endpoint: " + status + "; body=" + body);
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode n : candidates) {
            if (n.isTextual() && !n.asText().isEmpty()) {
                return n.asText();
            }
        }
        return null;
    }

    /**
     * Accumulates a chat/completions event stream and forwards pieces to the listener.
     */
    final class StreamCollector {

        private final AiProgressListener listener;
        private final StringBuilder content = new StringBuilder();
        private final StringBuilder previews = new StringBuilder();

        StreamCollector(AiProgressListener listener) {
            this.listener = listener;
        }

        /**
         * @param rawLine one line of the response body
         * @return false once the stream signalled its end
         */
        boolean accept(String rawLine) {
            String line = rawLine == null ? "" : rawLine.trim();
            if (line.isEmpty()) {
                return true;
            }
            String data = line.startsWith("data:") ? line.substring("data:".length()).trim() : line;
            if ("[DONE]".equals(data)) {
                return false;
            }
            List<String> parts = data.startsWith("{") && data.contains("}{")
                    ? List.of(data.replace("}{", "}\n{").split("\n"))
                    : List.of(data);
            boolean more = true;
            for (String part : parts) {
                more &= acceptJson(part.trim());
            }
            return more;
        }

        String text() {
            return content.length() > 0 ? content.toString() : previews.toString();
        }

        private boolean acceptJson(String part) {
            if (part.isEmpty()) {
                return true;
            }
            JsonNode obj;
            try {
                obj = objectMapper.readTree(part);
            } catch (JsonProcessingException e) {
                emit(ChunkKind.PREVIEW, part);
                previews.append(part);
                return true;
            }
            if (obj.hasNonNull("usage") && !obj.get("usage").isEmpty()) {
                emit(ChunkKind.USAGE, obj.get("usage").toString());
            }
            boolean stop = false;
            for (JsonNode choice : obj.path("choices")) {
                JsonNode delta = choice.path("delta");
                String reasoning = firstText(delta.path("reasoning_content"), delta.path("reasoning"));
                if (reasoning != null) {
                    emit(ChunkKind.REASONING, reasoning);
                }
                String piece = firstText(delta.path("content"), delta.path("text"), choice.path("message").path("content"), choice.path("text"));
                if (piece != null) {
                    emit(ChunkKind.CONTENT, piece);
                    content.append(piece);
                }
                if ("stop".equals(choice.path("finish_reason").asText(null))) {
                    stop = true;
                }
            }
            return !stop;
        }

        private void emit(ChunkKind kind, String text) {
            try {
                listener.onChunk(kind, text);
            } catch (RuntimeException e) {
                log.debug("AI progress listener failed (kind={}, error={})", kind, e.getMessage());
            }
        }
    }

    /**
     * Endpoint settings resolved from {@code catdb.ai.*} properties or {@code CATDB_AI_*} variables.
     *
     * @param endpoint full chat/completions URL
     * @param model model name
     * @param apiKeySetting configured key value or variable name
     * @param apiKey resolved key, or empty
     * @param includeSchema whether to append a schema description
     * @param timeoutMs request timeout
     */
    record AiConfig(
            String endpoint,
            String model,
            String apiKeySetting,
            String apiKey,
            boolean includeSchema,
            int timeoutMs
    ) {
        static AiConfig fromEnvironment(Environment environment) {
            String baseUrl = getTrimmed(environment, "catdb.ai.base-url", "CATDB_AI_BASE_URL");
            String model = getTrimmed(environment, "catdb.ai.model", "CATDB_AI_MODEL");
            String keySetting = getTrimmed(environment, "catdb.ai.api-key", "CATDB_AI_API_KEY");
            String includeRaw = getTrimmed(environment, "catdb.ai.include-schema", "CATDB_AI_INCLUDE_SCHEMA");
            String timeoutRaw = getTrimmed(environment, "catdb.ai.timeout-ms", "CATDB_AI_TIMEOUT_MS");

            if (keySetting == null || keySetting.isBlank()) {
                keySetting = DEFAULT_API_KEY_SETTING;
            }
            int timeoutMs = DEFAULT_TIMEOUT_MS;
            if (timeoutRaw != null && !timeoutRaw.isBlank()) {
                try {
                    timeoutMs = Integer.parseInt(timeoutRaw);
                } catch (NumberFormatException e) {
                    log.warn("Ignoring non-numeric AI timeout (value={}, default={})", timeoutRaw, DEFAULT_TIMEOUT_MS);
                }
            }
            return new AiConfig(
                    endpointFor(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl),
                    model == null || model.isBlank() ? DEFAULT_MODEL : model,
                    keySetting,
                    resolveKey(environment, keySetting),
                    includeRaw == null || includeRaw.isBlank() || Boolean.parseBoolean(includeRaw),
                    timeoutMs
            );
        }

        boolean isEnabled() {
            return apiKey != null && !apiKey.isBlank();
        }

        List<String> disabledWarnings() {
            return List.of(
                    "AI generation is disabled - no API key configured",
                    "Set catdb.ai.api-key (or CATDB_AI_API_KEY) to a key, or to the name of an environment variable holding it (default "
                            + DEFAULT_API_KEY_SETTING + ")"
            );
        }

        static String endpointFor(String baseUrl) {
            String url = baseUrl.trim().replaceAll("/+$", "");
            if (!url.contains("/chat") && !url.contains("/completions")) {
                url = url + "/chat/completions";
            }
            return url;
        }

        private static String resolveKey(Environment environment, String setting) {
            if (!ENV_NAME.matcher(setting).matches()) {
                return setting;
            }
            String fromEnv = environment != null ? environment.getProperty(setting) : null;
            return fromEnv != null ? fromEnv.trim() : "";
        }

        private static String getTrimmed(Environment environment, String propKey, String envKey) {
            String v = null;
            if (environment != null) {
                v = environment.getProperty(propKey);
                if (v == null || v.isBlank()) {
                    v = environment.getProperty(envKey);
                }
            }
            return v != null ? v.trim() : null;
        }
    }

    /**
     * Result wrapper for SQL generation.
     */
    public static class GeneratedSqlResult {
        private final String sql;
        private final boolean enabled;
        private final String schemaConnection;
        private final List<String> warnings;

        /**
         * Create a result.
         *
         * @param sql generated sql
         * @param enabled whether AI is enabled
         * @param schemaConnection connection whose schema was sent, if any
         * @param warnings warning messages
         */
        public GeneratedSqlResult(String sql, boolean enabled, String schemaConnection, List<String> warnings) {
            this.sql = sql;
            this.enabled = enabled;
            this.schemaConnection = schemaConnection;
            this.warnings = warnings;
        }

        public static GeneratedSqlResult success(String sql, String schemaConnection) {
            return new GeneratedSqlResult(sql, true, schemaConnection, List.of());
        }

        public static GeneratedSqlResult disabled(List<String> warnings) {
            return new GeneratedSqlResult("", false, null, warnings);
        }

        public String getSql() {
            return sql;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public String getSchemaConnection() {
            return schemaConnection;
        }

        public List<String> getWarnings() {
            return warnings;
        }
    }
}
