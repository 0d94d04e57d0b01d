package com.phillippitts.saleshud.service.orchestration;

import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe record of which meeting owns the audio pipeline.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * FREE → OWNED (via acquire)
 * OWNED → FREE (via release by the owner, or forceRelease)
 * </pre>
 */
public final class PipelineOwnership {

    private final Lock lock = new ReentrantLock();
    private UUID owner;

    /**
     * @return {@code true} if the meeting now owns the pipeline (including when it already did),
     *         {@code false} if another meeting owns it
     * @throws NullPointerException if meetingId is null
     */
    public boolean acquire(UUID meetingId) {
        if (meetingId == null) {
            throw new NullPointerException("meetingId cannot be null");
        }
        lock.lock();
        try {
            if (owner != null && !owner.equals(meetingId)) {
                return false;
            }
            owner = meetingId;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the meeting owned the pipeline and released it
     */
    public boolean release(UUID meetingId) {
        lock.lock();
        try {
            if (owner == null || !owner.equals(meetingId)) {
                return false;
            }
            owner = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears ownership regardless of owner.
     *
     * @return the previous owner, or {@code null}
     */
    public UUID forceRelease() {
        lock.lock();
        try {
            UUID previous = owner;
            owner = null;
            return previous;
        } finally {
            lock.unlock();
        }
    }

    public UUID owner() {
        lock.lock();
        try {
            return owner;
        } finally {
            lock.unlock();
        }
    }

    public boolean isOwnedBy(UUID meetingId) {
        if (meetingId == null) {
            return false;
        }
        lock.lock();
        try {
            return meetingId.equals(owner);
        } finally {
            lock.unlock();
        }
    }
}
