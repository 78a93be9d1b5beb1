package com.github.rudygunawan.rendercache.model;

import java.util.Objects;

/**
 * A filesystem change notification pushed by the file watcher.
 *
 * <p>{@code newModifiedAt} is the file's modification time after the change, in milliseconds, or
 * {@code null} when the file no longer exists.
 */
public final class FileChangeEvent {
    private final String path;
    private final FileChangeKind kind;
    private final Long newModifiedAt;

    public FileChangeEvent(String path, FileChangeKind kind, Long newModifiedAt) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.newModifiedAt = newModifiedAt;
    }

    public static FileChangeEvent changed(String path, long newModifiedAt) {
        return new FileChangeEvent(path, FileChangeKind.CHANGE, newModifiedAt);
    }

    public static FileChangeEvent unlinked(String path) {
        return new FileChangeEvent(path, FileChangeKind.UNLINK, null);
    }

    public static FileChangeEvent added(String path, long modifiedAt) {
        return new FileChangeEvent(path, FileChangeKind.ADD, modifiedAt);
    }

    public String getPath() {
        return path;
    }

    public FileChangeKind getKind() {
        return kind;
    }

    public Long getNewModifiedAt() {
        return newModifiedAt;
    }

    @Override
    public String toString() {
        return "FileChangeEvent{path=" + path + ", kind=" + kind + ", newModifiedAt=" + newModifiedAt + '}';
    }
}
