package com.veriheal.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Access to the shared source tree. Every path is resolved relative to the
 * workspace root and rejected if it escapes it.
 *
 * Writes go to a sibling temp file and are moved into place, so concurrent
 * readers (sandbox snapshots, the classifier) see either the old or the new
 * content of a file, never a half-written one. Callers that need
 * read-modify-write exclusivity take a lock through the patch engine's
 * FileLockManager; this class does no locking of its own.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path workspaceRoot;

    public FileSystemManager(
            @Value("${veriheal.workspace.path}") String workspacePath
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {}", workspaceRoot);
    }

    public String getWorkspacePath() {
        return workspaceRoot.toString();
    }

    // ================================================================
    // Snapshot
    // ================================================================

    /**
     * Copies the content of every managed file accepted by {@code predicate}
     * (tested against the workspace-relative path) into memory.
     */
    public WorkspaceSnapshot snapshotWorkspace(Predicate<Path> predicate)
            throws FileSystemException {

        Map<String, byte[]> files = new TreeMap<>();

        try (Stream<Path> paths = Files.walk(workspaceRoot)) {
            List<Path> toSnapshot = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !isIgnoredFile(workspaceRoot.relativize(p)))
                    .filter(p -> predicate.test(workspaceRoot.relativize(p)))
                    .collect(Collectors.toList());

            for (Path absolute : toSnapshot) {
                String relative = toKey(workspaceRoot.relativize(absolute));
                long fileSize = Files.size(absolute);
                if (fileSize > MAX_FILE_SIZE) {
                    throw new FileSystemException(
                            "Snapshot aborted, file too large: " + relative +
                            " (" + fileSize + " bytes, max: " + MAX_FILE_SIZE + ")"
                    );
                }
                files.put(relative, Files.readAllBytes(absolute));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new FileSystemException("Failed to snapshot workspace", e);
        }

        log.debug("[FileSystem] Snapshot taken: {} files", files.size());
        return new WorkspaceSnapshot(Collections.unmodifiableMap(files));
    }

    public WorkspaceSnapshot snapshotWorkspace() throws FileSystemException {
        return snapshotWorkspace(p -> true);
    }

    // ================================================================
    // Standard File Operations
    // ================================================================

    public String readFile(String relativePath) throws FileSystemException {
        return new String(readBytes(relativePath), StandardCharsets.UTF_8);
    }

    public byte[] readBytes(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        try {
            long fileSize = Files.size(targetPath);
            if (fileSize > MAX_FILE_SIZE)
                throw new FileSystemException("File too large: " + fileSize + " bytes");
            byte[] content = Files.readAllBytes(targetPath);
            log.debug("[FileSystem] Read {} bytes from {}", content.length, relativePath);
            return content;
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public void writeFile(String relativePath, String content) throws FileSystemException {
        writeBytes(relativePath, content.getBytes(StandardCharsets.UTF_8));
    }

    public void writeBytes(String relativePath, byte[] content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.debug("[FileSystem] Writing {} bytes to {}", content.length, relativePath);
        Path temp = null;
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            temp = Files.createTempFile(parent, ".veriheal-", ".tmp");
            Files.write(temp, content);
            moveIntoPlace(temp, targetPath);
            temp = null;
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("[FileSystem] Could not remove temp file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    public void deleteFile(String relativePath) throws FileSystemException {
        try {
            Files.deleteIfExists(resolveSafePath(relativePath));
        } catch (IOException e) {
            throw new FileSystemException("Failed to delete file: " + relativePath, e);
        }
    }

    public boolean fileExists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    /**
     * Normalised workspace-relative key for a path; used as the lock key and
     * the snapshot key so that "a/./b.py" and "a/b.py" name the same file.
     */
    public String normalize(String relativePath) throws FileSystemException {
        return toKey(workspaceRoot.relativize(resolveSafePath(relativePath)));
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot) || resolved.equals(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String toKey(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    private boolean isIgnoredFile(Path relative) {
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || name.equals("__pycache__") || name.equals("node_modules")
                    || name.equals("target") || name.endsWith(".pyc") || name.endsWith(".class")) {
                return true;
            }
        }
        return false;
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static final class WorkspaceSnapshot {
        private final Map<String, byte[]> files;

        private WorkspaceSnapshot(Map<String, byte[]> files) {
            this.files = files;
        }

        public Map<String, byte[]> getFiles() { return files; }
        public int                 size()     { return files.size(); }

        @Override public String toString() { return "WorkspaceSnapshot{files=" + files.size() + "}"; }
    }

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
