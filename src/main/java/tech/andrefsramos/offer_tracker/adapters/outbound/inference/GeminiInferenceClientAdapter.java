package tech.andrefsramos.offer_tracker.adapters.outbound.inference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.offer_tracker.core.domain.ModelPreference;
import tech.andrefsramos.offer_tracker.core.ports.InferenceClientPort;
import tech.andrefsramos.offer_tracker.core.ports.InferenceException;
import tech.andrefsramos.offer_tracker.core.ports.RateLimitedException;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * GeminiInferenceClientAdapter

 * Finalidade

 * Adapter de saída para um serviço de geração de texto no formato da API Gemini
 * (generateContent). Uma chamada = um POST; NÃO há retry aqui: o HTTP 429 é convertido
 * em {@link RateLimitedException} e a política de espera fica com quem chama.

 * Funcionamento dos métodos

 * - generate(prompt):
 *     1) Resolve o modelo (uma vez por instância) via {@link #resolveModel()}.
 *     2) POST {baseUrl}/v1beta/models/{model}:generateContent com o prompt.
 *     3) 429 -> RateLimitedException; outro status não-2xx -> InferenceException.
 *     4) Concatena as partes de texto do primeiro candidato.

 * - resolveModel():
 *     1) GET {baseUrl}/v1beta/models e filtra os que suportam generateContent.
 *     2) Aplica a {@link ModelPreference} configurada sobre a lista anunciada.
 *     3) Falha na listagem -> modelo padrão da preferência (sem cache, tenta de novo na próxima).
 */
public class GeminiInferenceClientAdapter implements InferenceClientPort {

    private static final Logger log = LoggerFactory.getLogger(GeminiInferenceClientAdapter.class);

    private static final String GENERATE_METHOD = "generateContent";

    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final ModelPreference modelPreference;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    private volatile String resolvedModel;

    public GeminiInferenceClientAdapter(
            ObjectMapper objectMapper,
            String baseUrl,
            String apiKey,
            ModelPreference modelPreference,
            int connectTimeoutMs,
            int readTimeoutMs
    ) {
        this.objectMapper = objectMapper;
        this.baseUrl = stripSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.modelPreference = modelPreference;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    @Override
    public String generate(String prompt) {
        if (apiKey.isEmpty()) {
            throw new InferenceException("Chave do serviço de inferência não configurada (app.inference.apiKey)");
        }
        String model = resolveModel();
        String endpoint = baseUrl + "/v1beta/models/" + model + ":" + GENERATE_METHOD + "?key=" + encode(apiKey);

        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(requestBody(prompt));
        } catch (IOException e) {
            throw new InferenceException("Falha ao serializar requisição de inferência", e);
        }

        final long t0 = System.nanoTime();
        HttpURLConnection con = null;
        try {
            con = open(endpoint, "POST");
            con.setDoOutput(true);
            con.setRequestProperty("Content-Type", "application/json; charset=utf-8");
            try (var os = con.getOutputStream()) {
                os.write(payload);
            }

            int code = con.getResponseCode();
            long tookMs = (System.nanoTime() - t0) / 1_000_000;

            if (code == 429) {
                log.warn("[Gemini] 429 Too Many Requests model={} tookMs={}", model, tookMs);
                throw new RateLimitedException("Serviço de inferência sinalizou limite de taxa (HTTP 429)");
            }
            if (code < 200 || code >= 300) {
                String err = readAll(con.getErrorStream());
                log.error("[Gemini] HTTP {} model={} bytes={} bodyErr='{}'", code, model, payload.length, abbreviate(err));
                throw new InferenceException("Serviço de inferência respondeu HTTP " + code);
            }

            String body = readAll(con.getInputStream());
            String text = candidateText(objectMapper.readTree(body));
            log.info("[Gemini] Resposta OK model={} bytes={} respChars={} tookMs={}", model, payload.length, text.length(), tookMs);
            return text;

        } catch (InferenceException e) {
            throw e;
        } catch (IOException e) {
            throw new InferenceException("Falha de I/O no serviço de inferência: " + e.getMessage(), e);
        } finally {
            if (con != null) con.disconnect();
        }
    }

    String resolveModel() {
        String cached = resolvedModel;
        if (cached != null) return cached;

        List<String> available;
        try {
            available = listModels();
        } catch (IOException | RuntimeException e) {
            log.warn("[Gemini] Falha ao listar modelos; usando padrão '{}'. Causa={}", modelPreference.fallbackModel(), e.getMessage());
            return modelPreference.fallbackModel();
        }

        String model = modelPreference.resolve(available);
        log.info("[Gemini] Modelo resolvido='{}' (disponíveis={}, preferências={})", model, available.size(), modelPreference.fragments());
        resolvedModel = model;
        return model;
    }

    private List<String> listModels() throws IOException {
        HttpURLConnection con = open(baseUrl + "/v1beta/models?key=" + encode(apiKey), "GET");
        try {
            int code = con.getResponseCode();
            if (code < 200 || code >= 300) {
                throw new IOException("HTTP " + code + " ao listar modelos");
            }
            JsonNode root = objectMapper.readTree(readAll(con.getInputStream()));
            List<String> names = new ArrayList<>();
            for (JsonNode m : root.path("models")) {
                if (!supportsGenerate(m)) continue;
                String name = m.path("name").asText("");
                if (name.startsWith("models/")) name = name.substring("models/".length());
                if (!name.isBlank()) names.add(name);
            }
            return names;
        } finally {
            con.disconnect();
        }
    }

    private static boolean supportsGenerate(JsonNode model) {
        JsonNode methods = model.path("supportedGenerationMethods");
        if (!methods.isArray()) return true;
        for (JsonNode m : methods) {
            if (GENERATE_METHOD.equals(m.asText())) return true;
        }
        return false;
    }

    private ObjectNode requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode contents = body.putArray("contents");
        ObjectNode content = contents.addObject();
        content.putArray("parts").addObject().put("text", prompt);
        return body;
    }

    static String candidateText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        StringBuilder sb = new StringBuilder();
        for (JsonNode p : parts) {
            sb.append(p.path("text").asText(""));
        }
        if (sb.length() == 0) {
            throw new InferenceException("Resposta de inferência sem texto no primeiro candidato");
        }
        return sb.toString();
    }

    private HttpURLConnection open(String endpoint, String method) throws IOException {
        HttpURLConnection con = (HttpURLConnection) new URL(endpoint).openConnection();
        con.setRequestMethod(method);
        con.setConnectTimeout(connectTimeoutMs);
        con.setReadTimeout(readTimeoutMs);
        con.setRequestProperty("Accept", "application/json");
        return con;
    }

    private static String readAll(InputStream in) throws IOException {
        if (in == null) return "";
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static String encode(String v) {
        return URLEncoder.encode(v, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 500 ? s.substring(0, 500) + "..." : s;
    }

    private static String stripSlash(String url) {
        if (url == null || url.isBlank()) return "https://generativelanguage.googleapis.com";
        String u = url.trim();
        return u.endsWith("/") ? u.substring(0, u.length() - 1) : u;
    }
}
