package com.example.jobsync.service.sync;

import com.example.jobsync.client.ClientModels.SchedulerJob;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Objects;

/**
 * How the job spec pushed to the scheduler is seeded.
 * <p>
 * Fields this service manages always overwrite the seed; fields it does not manage
 * (scheduler-side state) survive only when the seed carries them.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class MergeMode {

    public enum Kind {
        /**
         * Push the managed fields only
         */
        REPLACE,

        /**
         * Fetch the remote job first and push it back with the managed fields applied
         */
        FETCH_AND_MERGE,

        /**
         * Apply the managed fields onto a remote snapshot the caller already holds
         */
        MERGE_WITH
    }

    private static final MergeMode REPLACE = new MergeMode(Kind.REPLACE, null);
    private static final MergeMode FETCH_AND_MERGE = new MergeMode(Kind.FETCH_AND_MERGE, null);

    private final Kind kind;
    private final SchedulerJob snapshot;

    public static MergeMode replace() {
        return REPLACE;
    }

    public static MergeMode fetchAndMerge() {
        return FETCH_AND_MERGE;
    }

    public static MergeMode mergeWith(SchedulerJob snapshot) {
        return new MergeMode(Kind.MERGE_WITH, Objects.requireNonNull(snapshot, "snapshot"));
    }
}
