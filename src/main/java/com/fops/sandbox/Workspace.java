package com.fops.sandbox;

import com.fops.core.model.FileSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;

/**
 * An exclusively owned temporary directory holding one {@link FileSet}.
 * Closing it removes the directory and everything below it.
 */
public final class Workspace implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Workspace.class);

    private final Path root;
    private boolean closed;

    private Workspace(Path root) {
        this.root = root;
    }

    /**
     * Creates a fresh directory and writes {@code files} into it. If writing fails
     * the directory is removed before the exception propagates.
     */
    public static Workspace create(String prefix, FileSet files) throws IOException {
        var workspace = new Workspace(Files.createTempDirectory(prefix));
        try {
            workspace.write(files);
            return workspace;
        } catch (IOException | RuntimeException e) {
            workspace.close();
            throw e;
        }
    }

    public Path root() {
        return root;
    }

    /**
     * Writes additional files below the workspace root, creating parent directories.
     */
    public void write(FileSet files) throws IOException {
        for (Map.Entry<String, String> entry : files.asMap().entrySet()) {
            Path target = root.resolve(entry.getKey()).normalize();
            if (!target.startsWith(root)) {
                throw new IOException("Path escapes workspace: " + entry.getKey());
            }
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
        }
    }

    public boolean exists() {
        return Files.exists(root);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Failed to clean up sandbox workspace {}: {}", root, e.getMessage());
        }
    }
}
