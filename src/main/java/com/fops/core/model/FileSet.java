package com.fops.core.model;

import com.fops.core.util.Hashes;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of generated files keyed by forward-slash relative path.
 *
 * <p>Paths are checked on construction: absolute paths, backslashes and any
 * {@code ..} segment are rejected, so a FileSet can always be materialized
 * below a sandbox root without escaping it.
 */
public final class FileSet implements Serializable {

    private static final FileSet EMPTY = new FileSet(Map.of());

    private final Map<String, String> files;

    private FileSet(Map<String, String> files) {
        var copy = new LinkedHashMap<String, String>();
        files.forEach((path, content) -> {
            checkPath(path);
            copy.put(path, content == null ? "" : content);
        });
        this.files = Collections.unmodifiableMap(copy);
    }

    public static FileSet of(Map<String, String> files) {
        if (files == null || files.isEmpty()) {
            return EMPTY;
        }
        return new FileSet(files);
    }

    public static FileSet empty() {
        return EMPTY;
    }

    public Map<String, String> asMap() {
        return files;
    }

    public Set<String> paths() {
        return files.keySet();
    }

    public String content(String path) {
        return files.get(path);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * SHA-256 over paths and contents in path order. Equal file sets have equal
     * fingerprints regardless of insertion order.
     */
    public String fingerprint() {
        var sb = new StringBuilder();
        new TreeMap<>(files).forEach((path, content) ->
                sb.append(path).append('\n').append(content.length()).append('\n').append(content).append('\n'));
        return Hashes.sha256Hex(sb.toString());
    }

    /**
     * Returns a copy with every path re-rooted under {@code prefix}
     * (e.g. {@code infra/}).
     */
    public FileSet prefixed(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return this;
        }
        String root = prefix.endsWith("/") ? prefix : prefix + "/";
        var moved = new LinkedHashMap<String, String>();
        files.forEach((path, content) -> moved.put(root + path, content));
        return new FileSet(moved);
    }

    /**
     * Returns a FileSet holding this set's files followed by {@code other}'s.
     * Later entries win on duplicate paths.
     */
    public FileSet merge(FileSet other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        var merged = new LinkedHashMap<>(files);
        merged.putAll(other.files);
        return new FileSet(merged);
    }

    static void checkPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("File path must not be blank");
        }
        if (path.startsWith("/") || path.contains("\\") || path.contains(":")) {
            throw new IllegalArgumentException("File path must be a relative forward-slash path: " + path);
        }
        for (String segment : path.split("/")) {
            if (segment.equals("..")) {
                throw new IllegalArgumentException("Path traversal is not allowed: " + path);
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FileSet other && files.equals(other.files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return "FileSet" + files.keySet();
    }
}
