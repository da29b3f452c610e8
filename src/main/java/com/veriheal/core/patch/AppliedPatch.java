package com.veriheal.core.patch;

import java.time.Instant;
import java.util.Arrays;

/**
 * Result of a successful {@link PatchEngine#apply}. Holds the byte-exact
 * pre-apply snapshot so the change can be reverted.
 *
 * An instance is either applied ({@code rolledBackAt == null}) or rolled back;
 * rollback produces a new instance.
 */
public final class AppliedPatch {

    private final Patch   patch;
    private final String  caseId;
    private final String  targetKey;
    private final byte[]  preImage;    // null when the file did not exist before
    private final byte[]  postImage;
    private final Instant appliedAt;
    private final Instant rolledBackAt;

    AppliedPatch(Patch patch, String caseId, String targetKey,
                 byte[] preImage, byte[] postImage, Instant appliedAt, Instant rolledBackAt) {
        this.patch        = patch;
        this.caseId       = caseId;
        this.targetKey    = targetKey;
        this.preImage     = preImage;
        this.postImage    = postImage;
        this.appliedAt    = appliedAt;
        this.rolledBackAt = rolledBackAt;
    }

    AppliedPatch rolledBack(Instant at) {
        return new AppliedPatch(patch, caseId, targetKey, preImage, postImage, appliedAt, at);
    }

    public Patch   getPatch()        { return patch; }
    public String  getPatchId()      { return patch.getId(); }
    public String  getCaseId()       { return caseId; }
    public String  getTargetKey()    { return targetKey; }
    public Instant getAppliedAt()    { return appliedAt; }
    public Instant getRolledBackAt() { return rolledBackAt; }
    public boolean isRolledBack()    { return rolledBackAt != null; }
    public boolean createdFile()     { return preImage == null; }

    public byte[] getPreImage() {
        return preImage == null ? null : Arrays.copyOf(preImage, preImage.length);
    }

    public byte[] getPostImage() {
        return Arrays.copyOf(postImage, postImage.length);
    }

    @Override
    public String toString() {
        return "AppliedPatch{" + patch.getId() + ", case=" + caseId + ", file=" + targetKey
                + (isRolledBack() ? ", rolledBack" : "") + "}";
    }
}
