package com.shelf.assistant.core.photo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 监听本地目录中新出现的照片（WatchService）
 * <p>
 * 同一批次内的文件按创建时间、文件名排序；OVERFLOW 时重新扫描整个目录，
 * 重复的文件名由 {@link PhotoWatcher} 去重。
 */
public class DirectoryPhotoSource implements PhotoSource {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryPhotoSource.class);

    private final Path directory;
    private final boolean includeExisting;
    private WatchService watchService;
    private final List<Path> pending = new ArrayList<>();

    public DirectoryPhotoSource(Path directory, boolean includeExisting) {
        this.directory = directory.toAbsolutePath().normalize();
        this.includeExisting = includeExisting;
    }

    @Override
    public void open() throws SourceUnavailableException {
        close();
        if (!Files.isDirectory(directory)) {
            throw new SourceUnavailableException("Watch directory does not exist: " + directory);
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            close();
            throw new SourceUnavailableException("Failed to watch directory " + directory, e);
        }

        if (includeExisting) {
            List<Path> existing = scanDirectory();
            logger.info("Found {} existing file(s) in {}", existing.size(), directory);
            pending.addAll(existing);
        }
        logger.info("Watching photos in {}", directory);
    }

    @Override
    public List<Path> poll(Duration timeout) throws SourceUnavailableException, InterruptedException {
        if (watchService == null) {
            throw new SourceUnavailableException("Photo source is not open: " + directory);
        }
        if (!pending.isEmpty()) {
            List<Path> drained = sortByCreation(new ArrayList<>(pending));
            pending.clear();
            return drained;
        }

        WatchKey key;
        try {
            key = watchService.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ClosedWatchServiceException e) {
            throw new SourceUnavailableException("Watch service closed for " + directory, e);
        }
        if (key == null) {
            return List.of();
        }

        Set<Path> batch = new LinkedHashSet<>();
        boolean overflow = false;
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                overflow = true;
                continue;
            }
            Path child = directory.resolve((Path) event.context());
            if (Files.isRegularFile(child)) {
                batch.add(child);
            }
        }
        boolean valid = key.reset();

        if (overflow) {
            logger.warn("Watch events overflowed for {}, rescanning directory", directory);
            batch.addAll(scanDirectory());
        }
        if (!valid) {
            throw new SourceUnavailableException("Watch directory is no longer accessible: " + directory);
        }
        return sortByCreation(new ArrayList<>(batch));
    }

    @Override
    public void close() {
        pending.clear();
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("Failed to close watch service for {}: {}", directory, e.getMessage());
            }
            watchService = null;
        }
    }

    @Override
    public String describe() {
        return "directory:" + directory;
    }

    public Path getDirectory() {
        return directory;
    }

    private List<Path> scanDirectory() throws SourceUnavailableException {
        try (Stream<Path> files = Files.list(directory)) {
            return sortByCreation(files.filter(Files::isRegularFile).collect(Collectors.toList()));
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to list directory " + directory, e);
        }
    }

    private static List<Path> sortByCreation(List<Path> files) {
        files.sort(Comparator.comparing(DirectoryPhotoSource::creationTime)
                .thenComparing(p -> p.getFileName().toString()));
        return files;
    }

    private static FileTime creationTime(Path path) {
        try {
            return Files.readAttributes(path, BasicFileAttributes.class).creationTime();
        } catch (IOException e) {
            // 文件可能已被删除，排在最后
            return FileTime.fromMillis(Long.MAX_VALUE);
        }
    }
}
