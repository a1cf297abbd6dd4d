package com.example.jobsync.service.sync;

import com.example.jobsync.domain.entity.Job;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Jobs in an order where every parent precedes its children, plus the jobs that could
 * not be placed because their parent is missing or part of a cycle.
 */
@Value
public class DependencyOrder {

    List<Job> ordered;

    /**
     * Missing (or cyclic) parent name to the jobs waiting on it
     */
    Map<String, List<Job>> unresolved;

    public boolean isComplete() {
        return unresolved.isEmpty();
    }

    public List<Job> getUnresolvedJobs() {
        return unresolved.values().stream().flatMap(List::stream).toList();
    }
}
