package com.shelf.assistant.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductCatalogCodec;
import com.shelf.assistant.model.CatalogSummary;
import com.shelf.assistant.model.UserChoice;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.UUID;

/**
 * 后端 REST 客户端：商品清单上传、用户选择查询与确认
 */
public class BackendStoreClient {
    private static final Logger logger = LoggerFactory.getLogger(BackendStoreClient.class);

    private static final MediaType CSV = MediaType.parse("text/csv");
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final DateTimeFormatter FILENAME_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProductCatalogCodec codec;
    private final HttpUrl baseUrl;

    public BackendStoreClient(OkHttpClient httpClient, ObjectMapper objectMapper,
                              ProductCatalogCodec codec, String baseUrl) {
        HttpUrl parsed = HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalStateException("Invalid backend base URL: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.codec = codec;
        this.baseUrl = parsed;
    }

    /**
     * 上传文件名：shelf_items_yyyyMMdd_HHmmss.csv（本地时区）
     */
    public static String catalogFilename(Instant version) {
        return "shelf_items_" + FILENAME_TIME.format(version.atZone(ZoneId.systemDefault())) + ".csv";
    }

    /**
     * 上传商品清单
     * @return 后端分配的清单 ID
     */
    public String publishCatalog(ProductCatalog catalog) throws StoreException {
        return publishCatalog(catalogFilename(catalog.getVersion()), codec.encode(catalog));
    }

    /**
     * 上传已编码的 CSV（本地待上传记录重试时使用）
     */
    public String publishCatalog(String filename, String csv) throws StoreException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", filename,
                        RequestBody.create(csv.getBytes(StandardCharsets.UTF_8), CSV))
                .build();
        Request request = new Request.Builder()
                .url(url("csv", "upload"))
                .post(body)
                .build();

        JsonNode json = readJson(execute(request, "publish catalog"), "publish catalog");
        String id = json.path("id").asText("");
        if (id.isEmpty()) {
            throw new StoreRejectedException("Upload response carries no id", -1);
        }
        logger.info("Catalog {} uploaded as {}", filename, id);
        return id;
    }

    /**
     * 查询最新一条未处理的用户选择
     */
    public Optional<UserChoice> pollLatestChoice() throws StoreException {
        HttpUrl url = url("user-choice", "latest").newBuilder()
                .addQueryParameter("unprocessed_only", "true")
                .build();
        String content = execute(new Request.Builder().url(url).get().build(), "poll choice");
        if (content.isBlank() || "null".equals(content.trim())) {
            return Optional.empty();
        }
        JsonNode json = readJson(content, "poll choice");
        if (json.isNull()) {
            return Optional.empty();
        }
        String name = json.path("item_name").asText("");
        if (name.isBlank()) {
            throw new StoreRejectedException("User choice without item_name: " + content, -1);
        }
        try {
            UUID id = UUID.fromString(json.path("id").asText(""));
            JsonNode location = json.get("item_location");
            return Optional.of(new UserChoice(id, name,
                    location == null || location.isNull() ? null : location.asText(),
                    json.path("processed").asBoolean(false)));
        } catch (IllegalArgumentException e) {
            throw new StoreRejectedException("User choice has an invalid id", e);
        }
    }

    /**
     * 标记用户选择已处理，重复调用无副作用
     */
    public void acknowledgeChoice(UUID choiceId) throws StoreException {
        Request request = new Request.Builder()
                .url(url("user-choice", choiceId.toString(), "processed"))
                .patch(RequestBody.create(new byte[0], null))
                .build();
        execute(request, "acknowledge choice");
        logger.debug("Choice {} acknowledged", choiceId);
    }

    /**
     * 手动提交用户选择
     * @return 后端分配的选择 ID
     */
    public String submitChoice(String itemName, String itemLocation) throws StoreException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("item_name", itemName);
        if (itemLocation == null) {
            payload.putNull("item_location");
        } else {
            payload.put("item_location", itemLocation);
        }
        Request request;
        try {
            request = new Request.Builder()
                    .url(url("user-choice"))
                    .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (JsonProcessingException e) {
            throw new StoreRejectedException("Failed to encode user choice", e);
        }
        JsonNode json = readJson(execute(request, "submit choice"), "submit choice");
        return json.path("id").asText("");
    }

    /**
     * 获取后端最新的商品清单，不存在时返回空
     */
    public Optional<CatalogSummary> fetchLatestCatalog() throws StoreException {
        Request request = new Request.Builder().url(url("csv", "get-summary")).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            String content = bodyOf(response);
            if (!response.isSuccessful()) {
                throw failureFor("fetch catalog", response.code(), content);
            }
            return Optional.of(objectMapper.readValue(content, CatalogSummary.class));
        } catch (JsonProcessingException e) {
            throw new StoreRejectedException("Malformed catalog summary", e);
        } catch (IOException e) {
            throw new StoreUnavailableException("Backend unreachable (fetch catalog): " + e.getMessage(), e);
        }
    }

    public ProductCatalogCodec getCodec() {
        return codec;
    }

    private String execute(Request request, String operation) throws StoreException {
        try (Response response = httpClient.newCall(request).execute()) {
            String content = bodyOf(response);
            if (!response.isSuccessful()) {
                throw failureFor(operation, response.code(), content);
            }
            return content;
        } catch (IOException e) {
            throw new StoreUnavailableException("Backend unreachable (" + operation + "): " + e.getMessage(), e);
        }
    }

    private JsonNode readJson(String content, String operation) throws StoreRejectedException {
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new StoreRejectedException("Malformed response (" + operation + ")", e);
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private static String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static StoreException failureFor(String operation, int code, String body) {
        String snippet = body.length() > 200 ? body.substring(0, 200) + "..." : body;
        String message = "Backend " + operation + " failed with HTTP " + code + ": " + snippet;
        if (code == 408 || code == 429 || code >= 500) {
            return new StoreUnavailableException(message);
        }
        return new StoreRejectedException(message, code);
    }
}
