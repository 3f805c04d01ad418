package com.shelf.assistant.core.audio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ElevenLabs 文字转语音
 * <p>
 * 合成在单线程上按顺序执行，MP3 写入输出目录，由穿戴设备拉取播放。
 */
public class ElevenLabsAudioFeedbackEmitter implements AudioFeedbackEmitter, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ElevenLabsAudioFeedbackEmitter.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final HttpUrl endpoint;
    private final String apiKey;
    private final String modelId;
    private final Path outputDir;
    private final ExecutorService executor;
    private final AtomicLong sequence = new AtomicLong();

    public ElevenLabsAudioFeedbackEmitter(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                          String apiKey, String voiceId, String modelId, Path outputDir) {
        this(httpClient, objectMapper, baseUrl, apiKey, voiceId, modelId, outputDir,
                Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "tts-worker");
                    t.setDaemon(true);
                    return t;
                }));
    }

    ElevenLabsAudioFeedbackEmitter(OkHttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                   String apiKey, String voiceId, String modelId, Path outputDir,
                                   ExecutorService executor) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("ElevenLabs API key is not configured (ELEVENLABS_API_KEY)");
        }
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            throw new IllegalStateException("Invalid TTS base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.modelId = modelId;
        this.outputDir = outputDir;
        this.executor = executor;
        this.endpoint = base.newBuilder()
                .addPathSegment("text-to-speech")
                .addPathSegment(voiceId)
                .build();
    }

    @Override
    public void speak(String phrase) {
        long index = sequence.incrementAndGet();
        try {
            executor.execute(() -> synthesize(index, phrase));
        } catch (RejectedExecutionException e) {
            logger.warn("TTS worker stopped, phrase dropped: {}", phrase);
        }
    }

    void synthesize(long index, String phrase) {
        try {
            byte[] audio = requestSpeech(phrase);
            Files.createDirectories(outputDir);
            Path file = outputDir.resolve(String.format("speech_%d_%06d.mp3", System.currentTimeMillis(), index));
            Files.write(file, audio);
            logger.info("Speech #{} written to {} ({} bytes)", index, file, audio.length);
        } catch (IOException e) {
            logger.error("Speech synthesis failed for \"{}\": {}", phrase, e.getMessage());
        }
    }

    private byte[] requestSpeech(String phrase) throws IOException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", phrase);
        payload.put("model_id", modelId);
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to encode TTS request", e);
        }

        Request request = new Request.Builder()
                .url(endpoint)
                .header("xi-api-key", apiKey)
                .header("Accept", "audio/mpeg")
                .post(RequestBody.create(json, JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("TTS failed with code: " + response.code());
            }
            return body.bytes();
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
