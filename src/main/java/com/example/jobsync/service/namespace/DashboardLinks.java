package com.example.jobsync.service.namespace;

import com.example.jobsync.config.SchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds links into the scheduler dashboard
 */
@Component
@RequiredArgsConstructor
public class DashboardLinks {

    private final SchedulerProperties properties;
    private final NamespaceCodec namespaceCodec;

    /**
     * Execution history page of a job, relative to the dashboard path as configured
     */
    public String executions(String jobName) {
        var dashboard = properties.getDashboardPath() == null ? "" : properties.getDashboardPath();
        return dashboard + "#/jobs/" + namespaceCodec.addNamespace(jobName) + "/show/executions";
    }

    /**
     * Same as {@link #executions(String)}, resolved against {@code baseUrl} when the
     * dashboard path is not already absolute
     */
    public String absoluteExecutions(String baseUrl, String jobName) {
        var link = executions(jobName);
        if (link.startsWith("http://") || link.startsWith("https://") || baseUrl == null) {
            return link;
        }
        var base = baseUrl.replaceAll("/+$", "");
        return link.startsWith("/") ? base + link : base + "/" + link;
    }
}
