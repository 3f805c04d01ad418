package com.shelf.assistant.core.vision;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Base64;

/**
 * Google Gemini generateContent 视觉客户端
 * <p>
 * 单次调用的超时由 OkHttpClient 的 callTimeout 控制；重试由调用方负责。
 */
public class GeminiVisionClient implements VisionClient {
    private static final Logger logger = LoggerFactory.getLogger(GeminiVisionClient.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final VisionResponseParser parser;
    private final HttpUrl endpoint;
    private final String apiKey;

    public GeminiVisionClient(OkHttpClient httpClient, ObjectMapper objectMapper, VisionResponseParser parser,
                              String baseUrl, String model, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Vision API key is not configured (GOOGLE_API_KEY)");
        }
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalStateException("Invalid vision base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.parser = parser;
        this.apiKey = apiKey;
        this.endpoint = base.newBuilder()
                .addPathSegment("models")
                .addPathSegment(model + ":generateContent")
                .build();
    }

    @Override
    public VisionResult analyze(VisionRequest request) throws VisionException {
        long start = System.currentTimeMillis();
        String text = generate(request);
        logger.debug("[{}] Model response in {} ms:\n{}", request.getMode(),
                System.currentTimeMillis() - start, text);
        return parser.parse(request.getMode(), text);
    }

    private String generate(VisionRequest request) throws VisionException {
        Request httpRequest = new Request.Builder()
                .url(endpoint.newBuilder().addQueryParameter("key", apiKey).build())
                .post(RequestBody.create(buildPayload(request), JSON))
                .build();

        try (Response response = httpClient.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            if (!response.isSuccessful()) {
                throw failureFor(response.code(), content);
            }
            return extractText(content);
        } catch (InterruptedIOException e) {
            throw new VisionUnavailableException("Vision call timed out (" + request.getMode() + ")", e);
        } catch (IOException e) {
            throw new VisionUnavailableException("Vision call failed: " + e.getMessage(), e);
        }
    }

    private String buildPayload(VisionRequest request) throws VisionParseException {
        ObjectNode payload = objectMapper.createObjectNode();

        ObjectNode systemInstruction = payload.putObject("systemInstruction");
        systemInstruction.putArray("parts").addObject().put("text", VisionPrompts.promptFor(request));

        ArrayNode parts = payload.putArray("contents").addObject()
                .put("role", "user")
                .putArray("parts");
        parts.addObject().put("text", VisionPrompts.userMessageFor(request));
        parts.addObject().putObject("inlineData")
                .put("mimeType", request.getMimeType())
                .put("data", Base64.getEncoder().encodeToString(request.getImage()));

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new VisionParseException("Failed to build vision request", e);
        }
    }

    private String extractText(String content) throws VisionParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new VisionParseException("Vision response is not JSON", e);
        }
        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            throw new VisionParseException("No valid response from vision model"
                    + (blockReason.isEmpty() ? "" : " (blocked: " + blockReason + ")"));
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidates.get(0).path("content").path("parts")) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        if (text.length() == 0) {
            throw new VisionParseException("Vision response has no text part");
        }
        return text.toString();
    }

    private static VisionUnavailableException failureFor(int code, String body) {
        String snippet = body.length() > 300 ? body.substring(0, 300) + "..." : body;
        boolean transientFailure = code == 408 || code == 429 || code >= 500;
        if (code == 401 || code == 403) {
            logger.error("Vision API rejected the credentials (HTTP {})", code);
        }
        return new VisionUnavailableException("Vision API returned HTTP " + code + ": " + snippet, transientFailure);
    }
}
