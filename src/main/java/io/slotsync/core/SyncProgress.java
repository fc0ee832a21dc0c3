package io.slotsync.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * How far the local node is from being caught up with the network.
 */
@Getter
@EqualsAndHashCode
public final class SyncProgress {

    public enum Status {

        /**
         * The local tip is within the sync tolerance of the current time.
         */
        READY,

        /**
         * Still catching up, see {@link #getProgress()}.
         */
        SYNCING,

        /**
         * The node did not answer. Decided by callers, never by the estimator.
         */
        NOT_RESPONDING
    }

    private static final SyncProgress READY = new SyncProgress(Status.READY, null);
    private static final SyncProgress NOT_RESPONDING = new SyncProgress(Status.NOT_RESPONDING, null);

    private final Status status;

    /**
     * Only set when {@link Status#SYNCING}.
     */
    private final Percentage progress;

    private SyncProgress(Status status, Percentage progress) {
        this.status = status;
        this.progress = progress;
    }

    public static SyncProgress ready() {
        return READY;
    }

    public static SyncProgress syncing(Percentage progress) {
        if (progress == null) {
            throw new IllegalArgumentException("Syncing progress can not be null");
        }
        return new SyncProgress(Status.SYNCING, progress);
    }

    public static SyncProgress notResponding() {
        return NOT_RESPONDING;
    }

    public boolean isReady() {
        return status == Status.READY;
    }

    public boolean isSyncing() {
        return status == Status.SYNCING;
    }

    @Override
    public String toString() {
        switch (status) {
            case SYNCING:
                return "Syncing " + progress.toPercentString();
            case READY:
                return "Ready";
            default:
                return "Not responding";
        }
    }
}
