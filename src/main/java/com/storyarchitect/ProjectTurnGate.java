package com.storyarchitect;

import com.storyarchitect.pipeline.ProjectBusyException;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Enforces one writer per project: a command on a project id is rejected
 * while another holds its turn, distinct projects proceed in parallel.
 */
public class ProjectTurnGate {

    private final ConcurrentHashMap<String, Semaphore> permits = new ConcurrentHashMap<>();

    /**
     * Take the project's turn; callers must {@link #leave} in a finally block.
     */
    public void enter(String projectId) {
        Semaphore semaphore = permits.computeIfAbsent(projectId, id -> new Semaphore(1));
        if (!semaphore.tryAcquire()) {
            throw new ProjectBusyException(projectId);
        }
    }

    public void leave(String projectId) {
        Semaphore semaphore = permits.get(projectId);
        if (semaphore != null) {
            semaphore.release();
        }
    }

    public boolean isBusy(String projectId) {
        Semaphore semaphore = permits.get(projectId);
        return semaphore != null && semaphore.availablePermits() == 0;
    }

    /**
     * Leave the turn of a deleted project and drop its permit. The permit is
     * unmapped while still held, so no caller can acquire a stale semaphore.
     */
    public void retire(String projectId) {
        Semaphore semaphore = permits.remove(projectId);
        if (semaphore != null) {
            semaphore.release();
        }
    }
}
