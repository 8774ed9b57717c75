package com.flagship.tool_ledger.store;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Arrays;

/**
 * Address of a single document in the store.
 *
 * A path alternates collection and document segments, e.g. {@code tools/{id}}, {@code tools/{id}/history/10-2025}
 * or {@code global_history/2025/10/20}. The store treats the path as an opaque
 * key; only the parent path is used for listing and change subscriptions.
 */
@Getter
@EqualsAndHashCode
public final class DocumentRef {

    private static final String SEPARATOR = "/";

    private final String path;

    private DocumentRef(String path) {
        this.path = path;
    }

    /**
     * Builds a reference from path segments. At least a collection and an id are required.
     */
    public static DocumentRef of(String... segments) {
        if (segments == null || segments.length < 2) {
            throw new IllegalArgumentException("A document path needs a collection and an id");
        }
        for (String segment : segments) {
            if (segment == null || segment.isBlank()) {
                throw new IllegalArgumentException("Blank path segment in " + Arrays.toString(segments));
            }
            if (segment.contains(SEPARATOR)) {
                throw new IllegalArgumentException("Path segment must not contain '/': " + segment);
            }
        }
        return new DocumentRef(String.join(SEPARATOR, segments));
    }

    /**
     * Parses a full slash-separated path.
     */
    public static DocumentRef parse(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path is required");
        }
        return of(path.split(SEPARATOR));
    }

    /**
     * Reference to a document nested below this one.
     */
    public DocumentRef child(String... segments) {
        String[] own = path.split(SEPARATOR);
        String[] all = Arrays.copyOf(own, own.length + segments.length);
        System.arraycopy(segments, 0, all, own.length, segments.length);
        return of(all);
    }

    public String getId() {
        return path.substring(path.lastIndexOf(SEPARATOR) + 1);
    }

    public String getParentPath() {
        return path.substring(0, path.lastIndexOf(SEPARATOR));
    }

    @Override
    public String toString() {
        return path;
    }
}
