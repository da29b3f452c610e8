package com.veriheal.core.sandbox;

import com.veriheal.core.filesystem.FileSystemManager.WorkspaceSnapshot;

import java.time.Duration;

/**
 * Runs one test selector against an isolated copy of the source tree.
 *
 * Implementations must not touch the shared tree; every invocation gets its
 * own materialised copy of {@code snapshot}. A test that exceeds
 * {@code timeout} is killed and reported with {@code timedOut = true}.
 */
public interface SandboxRunner {

    SandboxResult run(String selector, WorkspaceSnapshot snapshot, Duration timeout) throws SandboxException;

    Duration defaultTimeout();
}
