package com.veriheal.core.patch;

/**
 * Hook run after the new content is on disk and before the file lock is
 * released. Throwing makes the engine restore the pre-apply snapshot.
 */
@FunctionalInterface
public interface PostApplyCheck {

    PostApplyCheck NONE = (targetFile, content) -> { };

    void verify(String targetFile, String content) throws PatchException;
}
