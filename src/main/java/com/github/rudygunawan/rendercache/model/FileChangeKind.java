package com.github.rudygunawan.rendercache.model;

/**
 * Kind of filesystem change reported by the file watcher.
 */
public enum FileChangeKind {
    ADD,
    CHANGE,
    UNLINK;

    /**
     * Returns {@code true} if this change can make a cached render stale. A newly added file cannot
     * have been cached yet.
     */
    public boolean canInvalidate() {
        return this != ADD;
    }
}
