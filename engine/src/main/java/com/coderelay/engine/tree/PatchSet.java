package com.coderelay.engine.tree;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The files that differ between two revisions.
 *
 * Renames contribute both their old and their new path to {@link #paths()},
 * since either side can collide with another change.
 */
public record PatchSet(String baseRevision, String headRevision, List<FileChange> changes) {

    public enum ChangeType { ADD, MODIFY, DELETE, RENAME, COPY }

    public record FileChange(ChangeType type, String oldPath, String newPath) {

        /** The path a reviewer would recognise this change by. */
        public String path() {
            return type == ChangeType.DELETE ? oldPath : newPath;
        }
    }

    public PatchSet {
        changes = List.copyOf(changes);
    }

    /** Every path touched on either side of the diff, sorted. */
    public Set<String> paths() {
        Set<String> paths = new TreeSet<>();
        for (FileChange c : changes) {
            if (c.oldPath() != null && c.type() != ChangeType.ADD)    paths.add(c.oldPath());
            if (c.newPath() != null && c.type() != ChangeType.DELETE) paths.add(c.newPath());
        }
        return paths;
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
