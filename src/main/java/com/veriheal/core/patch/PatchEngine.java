package com.veriheal.core.patch;

import com.veriheal.communication.EventBus;
import com.veriheal.core.checklist.PatchRecord;
import com.veriheal.core.checklist.TestCase;
import com.veriheal.core.event.Event;
import com.veriheal.core.event.EventType;
import com.veriheal.core.filesystem.FileSystemManager;
import com.veriheal.core.filesystem.FileSystemManager.FileSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;

/**
 * Validates, applies and rolls back patches against the source tree.
 *
 * Apply and rollback run entirely under the target file's lock: snapshot,
 * validate, write, verify, and on any failure restore the snapshot byte for
 * byte. A second patch to the same file cannot start validating until the
 * first one has been applied or restored.
 */
@Component
public class PatchEngine {

    private static final Logger log = LoggerFactory.getLogger(PatchEngine.class);

    private final FileSystemManager fileSystem;
    private final FileLockManager   locks;
    private final EventBus          eventBus;
    private final int               fuzzLines;

    public PatchEngine(
            FileSystemManager fileSystem,
            FileLockManager locks,
            EventBus eventBus,
            @Value("${veriheal.patch.fuzz-lines:3}") int fuzzLines
    ) {
        this.fileSystem = fileSystem;
        this.locks      = locks;
        this.eventBus   = eventBus;
        this.fuzzLines  = fuzzLines;
    }

    // ================================================================
    // Validation
    // ================================================================

    /**
     * Checks that {@code patch} applies cleanly to {@code content}. A null
     * content means the target file does not exist yet.
     */
    public ValidationResult validate(Patch patch, String content) {
        PatchKind kind = patch.getKind();
        switch (kind) {
            case TARGETED_REPLACE: {
                if (content == null) {
                    return ValidationResult.rejected(kind, "target file does not exist: " + patch.getTargetFile(), 0);
                }
                String oldText = patch.getOldText();
                if (oldText == null || oldText.isEmpty()) {
                    return ValidationResult.rejected(kind, "old text is empty");
                }
                if (patch.getNewText() == null) {
                    return ValidationResult.rejected(kind, "new text is missing");
                }
                if (oldText.equals(patch.getNewText())) {
                    return ValidationResult.rejected(kind, "old and new text are identical");
                }
                int occurrences = countOccurrences(content, oldText);
                if (occurrences == 0) {
                    return ValidationResult.rejected(kind, "old text not found in " + patch.getTargetFile(), 0);
                }
                if (occurrences > 1) {
                    return ValidationResult.rejected(kind, "old text is ambiguous: "
                            + occurrences + " occurrences in " + patch.getTargetFile(), occurrences);
                }
                return ValidationResult.ok(kind, 1);
            }
            case UNIFIED_DIFF: {
                try {
                    UnifiedDiff.parse(patch.getDiffBody()).applyTo(content, fuzzLines);
                    return ValidationResult.ok(kind);
                } catch (IllegalArgumentException e) {
                    return ValidationResult.rejected(kind, e.getMessage());
                }
            }
            case FULL_REWRITE: {
                if (patch.getContent() == null || patch.getContent().isBlank()) {
                    return ValidationResult.rejected(kind, "replacement content is empty");
                }
                return ValidationResult.ok(kind);
            }
            default:
                return ValidationResult.rejected(kind, "unsupported patch kind");
        }
    }

    /**
     * Content of the target file after applying {@code patch} to
     * {@code content}.
     *
     * @throws IllegalArgumentException if the patch does not validate
     */
    public String render(Patch patch, String content) {
        ValidationResult result = validate(patch, content);
        if (!result.isValid()) {
            throw new IllegalArgumentException(result.getReason());
        }
        switch (patch.getKind()) {
            case TARGETED_REPLACE:
                return content.replace(patch.getOldText(), patch.getNewText());
            case UNIFIED_DIFF:
                return UnifiedDiff.parse(patch.getDiffBody()).applyTo(content, fuzzLines);
            case FULL_REWRITE:
            default:
                return patch.getContent();
        }
    }

    // ================================================================
    // Apply
    // ================================================================

    public AppliedPatch apply(Patch patch, TestCase owner) throws PatchException {
        return apply(patch, owner, PostApplyCheck.NONE);
    }

    /**
     * Applies {@code patch} on behalf of {@code owner}. On success the patch id
     * is appended to the owner's applied patches.
     *
     * @throws PatchValidationException if the patch does not validate; nothing was written
     * @throws PatchLockTimeoutException if the file lock could not be obtained
     * @throws PatchException if writing or the post-apply check failed; the
     *         file has been restored to its previous bytes
     */
    public AppliedPatch apply(Patch patch, TestCase owner, PostApplyCheck check) throws PatchException {
        String key = normalize(patch);
        Patch identified = patch.getId() != null
                ? patch
                : patch.withId(owner.getId() + "-p" + (owner.getPatchesApplied().size() + 1));

        AppliedPatch applied;
        try (FileLockManager.Lease lease = locks.acquire(key)) {
            byte[] preImage = fileSystem.fileExists(key) ? readBytes(key) : null;
            String current  = preImage == null ? null : new String(preImage, StandardCharsets.UTF_8);

            ValidationResult validation = validate(identified, current);
            if (!validation.isValid()) {
                log.info("[PatchEngine] {} rejected for {}: {}", identified.getKind(), key, validation.getReason());
                throw new PatchValidationException(validation);
            }

            String expected  = render(identified, current);
            byte[] postImage = expected.getBytes(StandardCharsets.UTF_8);

            try {
                fileSystem.writeBytes(key, postImage);
                byte[] reread = fileSystem.readBytes(key);
                if (!Arrays.equals(reread, postImage)) {
                    throw new PatchException("Content on disk differs from the rendered patch for " + key);
                }
                check.verify(key, expected);
            } catch (PatchException | FileSystemException | RuntimeException e) {
                log.warn("[PatchEngine] Apply of {} to {} failed, restoring snapshot: {}",
                        identified.getId(), key, e.getMessage());
                restore(key, preImage);
                if (e instanceof PatchException) throw (PatchException) e;
                throw new PatchException("Failed to apply " + identified.getId() + " to " + key, e);
            }

            applied = new AppliedPatch(identified, owner.getId(), key,
                    preImage, postImage, Instant.now(), null);
            owner.appendPatch(new PatchRecord(identified.getId(), identified.getKind(), key,
                    identified.getConfidence(), identified.getOrigin(), applied.getAppliedAt(), null));
        }

        log.info("[PatchEngine] Applied {} ({}) to {} for {}",
                identified.getId(), identified.getKind(), key, owner.getId());
        eventBus.publish(new Event(EventType.PATCH_APPLIED, "PatchEngine", owner.getRunId(), applied));
        return applied;
    }

    // ================================================================
    // Rollback
    // ================================================================

    /**
     * Undoes {@code applied}. If the file still holds exactly the bytes the
     * apply wrote, the pre-apply bytes are restored. If other patches have
     * touched the file since, only this patch's own line changes are reversed
     * and everything else is kept.
     *
     * @throws PatchRollbackConflictException if this patch's lines were edited
     *         again since the apply; the file is left untouched
     * @throws PatchException if the patch was already rolled back or the file
     *         could not be written
     */
    public AppliedPatch rollback(AppliedPatch applied, TestCase owner) throws PatchException {
        if (applied.isRolledBack()) {
            throw new PatchException("Patch " + applied.getPatchId() + " is already rolled back");
        }
        String key = applied.getTargetKey();
        AppliedPatch rolledBack;

        try (FileLockManager.Lease lease = locks.acquire(key)) {
            byte[] current = fileSystem.fileExists(key) ? readBytes(key) : null;
            try {
                if (current != null && Arrays.equals(current, applied.getPostImage())) {
                    if (applied.createdFile()) {
                        fileSystem.deleteFile(key);
                    } else {
                        fileSystem.writeBytes(key, applied.getPreImage());
                    }
                } else {
                    String reverted = reverseApply(applied, current);
                    fileSystem.writeBytes(key, reverted.getBytes(StandardCharsets.UTF_8));
                    log.info("[PatchEngine] {} changed since {}; reversed only its own lines",
                            key, applied.getPatchId());
                }
            } catch (FileSystemException e) {
                throw new PatchException("Failed to roll back " + applied.getPatchId(), e);
            }
            rolledBack = applied.rolledBack(Instant.now());
            owner.markPatchRolledBack(applied.getPatchId(), rolledBack.getRolledBackAt());
        }

        log.info("[PatchEngine] Rolled back {} on {}", applied.getPatchId(), key);
        eventBus.publish(new Event(EventType.PATCH_ROLLED_BACK, "PatchEngine", owner.getRunId(), rolledBack));
        return rolledBack;
    }

    private String reverseApply(AppliedPatch applied, byte[] current) throws PatchRollbackConflictException {
        String key = applied.getTargetKey();
        if (current == null) {
            throw new PatchRollbackConflictException(applied.getPatchId(),
                    key + " was deleted after " + applied.getPatchId() + " was applied", null);
        }
        if (applied.createdFile()) {
            throw new PatchRollbackConflictException(applied.getPatchId(),
                    key + " was created by " + applied.getPatchId() + " and edited since", null);
        }
        String post = new String(applied.getPostImage(), StandardCharsets.UTF_8);
        String pre  = new String(applied.getPreImage(), StandardCharsets.UTF_8);
        try {
            return UnifiedDiff.between(post, pre).applyTo(new String(current, StandardCharsets.UTF_8), fuzzLines);
        } catch (IllegalArgumentException e) {
            throw new PatchRollbackConflictException(applied.getPatchId(),
                    "Cannot reverse " + applied.getPatchId() + " on " + key + ": " + e.getMessage(), e);
        }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private String normalize(Patch patch) throws PatchException {
        try {
            return fileSystem.normalize(patch.getTargetFile());
        } catch (FileSystemException e) {
            throw new PatchValidationException(ValidationResult.rejected(patch.getKind(), e.getMessage()));
        }
    }

    private byte[] readBytes(String key) throws PatchException {
        try {
            return fileSystem.readBytes(key);
        } catch (FileSystemException e) {
            throw new PatchException("Failed to snapshot " + key, e);
        }
    }

    private void restore(String key, byte[] preImage) throws PatchException {
        try {
            if (preImage == null) {
                fileSystem.deleteFile(key);
            } else {
                fileSystem.writeBytes(key, preImage);
            }
        } catch (FileSystemException e) {
            log.error("[PatchEngine] Could not restore {} after failed apply", key, e);
            throw new PatchException("Failed to restore " + key + " after failed apply", e);
        }
    }

    static int countOccurrences(String content, String needle) {
        int count = 0;
        int from = 0;
        while (true) {
            int at = content.indexOf(needle, from);
            if (at < 0) return count;
            count++;
            from = at + 1;
        }
    }
}
