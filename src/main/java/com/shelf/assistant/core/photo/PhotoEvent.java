package com.shelf.assistant.core.photo;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

public final class PhotoEvent {
    private final Path path;
    private final CaptureFlag flag;
    private final Instant observedAt;

    public PhotoEvent(Path path, CaptureFlag flag, Instant observedAt) {
        this.path = Objects.requireNonNull(path, "path");
        this.flag = Objects.requireNonNull(flag, "flag");
        this.observedAt = Objects.requireNonNull(observedAt, "observedAt");
    }

    public Path getPath() { return path; }
    public CaptureFlag getFlag() { return flag; }
    public Instant getObservedAt() { return observedAt; }

    public String getFilename() {
        return path.getFileName().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhotoEvent)) return false;
        PhotoEvent that = (PhotoEvent) o;
        return path.equals(that.path) && flag == that.flag && observedAt.equals(that.observedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, flag, observedAt);
    }

    @Override
    public String toString() {
        return "PhotoEvent{" + getFilename() + ", flag=" + flag + ", observedAt=" + observedAt + '}';
    }
}
