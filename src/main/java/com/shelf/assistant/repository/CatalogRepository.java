package com.shelf.assistant.repository;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.shelf.assistant.config.YamlConfig;
import com.shelf.assistant.model.CatalogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 商品清单上传记录（JSON Lines，按日期分文件: catalogs/2024-01-15.jsonl）
 * <p>
 * 更新以追加新行的方式写入，读取时同一 ID 以最后一行为准。
 */
@Repository
public class CatalogRepository {
    private static final Logger logger = LoggerFactory.getLogger(CatalogRepository.class);
    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Gson gson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, (JsonSerializer<LocalDateTime>) (src, type, context) ->
                    new JsonPrimitive(src.format(ISO_FORMATTER)))
            .registerTypeAdapter(LocalDateTime.class, (JsonDeserializer<LocalDateTime>) (json, type, context) ->
                    LocalDateTime.parse(json.getAsString(), ISO_FORMATTER))
            .registerTypeAdapter(Instant.class, (JsonSerializer<Instant>) (src, type, context) ->
                    new JsonPrimitive(src.toString()))
            .registerTypeAdapter(Instant.class, (JsonDeserializer<Instant>) (json, type, context) ->
                    Instant.parse(json.getAsString()))
            .create();

    private final boolean saveLocal;
    private final Path catalogsDir;

    @Autowired
    public CatalogRepository(YamlConfig config) {
        this(Paths.get(config.getSystem().getDataDir()), config.getSystem().isSaveLocal());
    }

    public CatalogRepository(Path dataDir, boolean saveLocal) {
        this.saveLocal = saveLocal;
        this.catalogsDir = dataDir.resolve("catalogs");
        if (saveLocal) {
            try {
                Files.createDirectories(catalogsDir);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to initialize catalog store", e);
            }
        }
    }

    /**
     * 插入记录
     */
    public void insert(CatalogRecord record) {
        if (record.getId() == null) {
            record.setId(UUID.randomUUID().toString());
        }
        if (record.getCreatedAt() == null) {
            record.setCreatedAt(LocalDateTime.now());
        }
        append(record);
    }

    /**
     * 更新记录（追加新版本）
     */
    public void update(CatalogRecord record) {
        if (record.getId() == null) {
            throw new IllegalArgumentException("Record ID cannot be null");
        }
        append(record);
    }

    public Optional<CatalogRecord> findById(String id) {
        return Optional.ofNullable(latestById(listFiles()).get(id));
    }

    /**
     * 最近的记录，最新的在前
     */
    public List<CatalogRecord> findAll(int limit) {
        List<CatalogRecord> results = new ArrayList<>();
        for (Path file : listFiles()) {
            List<CatalogRecord> batch = new ArrayList<>(latestById(List.of(file)).values());
            batch.sort(Comparator.comparing(CatalogRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .reversed());
            for (CatalogRecord record : batch) {
                if (limit > 0 && results.size() >= limit) {
                    return results;
                }
                results.add(record);
            }
        }
        return results;
    }

    /**
     * 需要重传的记录，按创建时间先后
     */
    public List<CatalogRecord> findPending() {
        List<CatalogRecord> pending = latestById(listFiles()).values().stream()
                .filter(CatalogRecord::isPending)
                .collect(Collectors.toList());
        pending.sort(Comparator.comparing(CatalogRecord::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return pending;
    }

    private synchronized void append(CatalogRecord record) {
        if (!saveLocal) {
            return;
        }
        LocalDate date = record.getCreatedAt() != null ? record.getCreatedAt().toLocalDate() : LocalDate.now();
        Path targetFile = catalogsDir.resolve(date + ".jsonl");
        try (BufferedWriter writer = Files.newBufferedWriter(targetFile,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            writer.write(gson.toJson(record));
            writer.newLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write catalog record " + record.getId(), e);
        }
    }

    /**
     * 日期文件，按日期倒序
     */
    private List<Path> listFiles() {
        if (!saveLocal || !Files.exists(catalogsDir)) {
            return Collections.emptyList();
        }
        try (Stream<Path> files = Files.list(catalogsDir)) {
            return files
                    .filter(p -> p.toString().endsWith(".jsonl"))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list catalog records: {}", e.getMessage());
            return Collections.emptyList();
        }
    }

    private synchronized Map<String, CatalogRecord> latestById(List<Path> files) {
        Map<String, CatalogRecord> latest = new LinkedHashMap<>();
        for (Path file : files) {
            try (Stream<String> lines = Files.lines(file)) {
                lines.filter(line -> !line.trim().isEmpty())
                        .map(this::parse)
                        .filter(record -> record != null && record.getId() != null)
                        .forEach(record -> latest.put(record.getId(), record));
            } catch (IOException e) {
                logger.warn("Skipping unreadable catalog file {}: {}", file, e.getMessage());
            }
        }
        return latest;
    }

    private CatalogRecord parse(String line) {
        try {
            return gson.fromJson(line, CatalogRecord.class);
        } catch (RuntimeException e) {
            logger.warn("Skipping malformed catalog record line: {}", e.getMessage());
            return null;
        }
    }
}
