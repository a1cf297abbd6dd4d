package com.example.jobsync.service.sync;

import com.example.jobsync.domain.entity.Job;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orders jobs so that a job scheduled with {@code @parent X} always comes after X.
 * <p>
 * Jobs are grouped by parent name. Root jobs go first; then any group whose parent has
 * already been emitted is released, until no group can make progress. Groups left over
 * reference a job that does not exist or sit on a cycle; they are reported, never
 * silently dropped, and never cause the loop to spin.
 * <p>
 * Within a group the input order is kept. Which of several eligible groups goes first
 * is unspecified.
 */
@Slf4j
@Component
public class JobDependencyGrapher {

    /**
     * Group key for jobs without a parent. Job names are never empty, so it cannot clash.
     */
    private static final String NO_PARENT = "";

    public DependencyOrder order(Collection<Job> jobs) {
        Map<String, List<Job>> graph = new LinkedHashMap<>();
        for (var job : jobs) {
            graph.computeIfAbsent(job.getParentName(), k -> new ArrayList<>()).add(job);
        }

        var ordered = new ArrayList<Job>(jobs.size());
        var processed = new HashSet<String>();
        var next = graph.containsKey(NO_PARENT) ? NO_PARENT : null;

        while (next != null) {
            for (var job : graph.remove(next)) {
                processed.add(job.getName());
                ordered.add(job);
            }
            next = graph.keySet().stream()
                    .filter(processed::contains)
                    .findFirst()
                    .orElse(null);
        }

        if (!graph.isEmpty()) {
            log.error("Dependency graph stuck, unresolved parents: {} (jobs: {})",
                    String.join(",", graph.keySet()),
                    graph.values().stream()
                            .flatMap(List::stream)
                            .map(Job::getName)
                            .collect(Collectors.joining(",")));
        }

        return new DependencyOrder(ordered, graph);
    }
}
