package com.example.jobsync.service.namespace;

import com.example.jobsync.config.SchedulerProperties;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps local job names to the names the scheduler sees, and back.
 * <p>
 * Several deployments can share one scheduler instance by each prefixing their jobs
 * with {@code "<namespace>_"}. Without a namespace both directions are identity.
 * The prefix is normalized once at construction and never changes afterwards.
 */
@Component
public class NamespaceCodec {

    /**
     * {@code "<namespace>_"}, or empty when no namespace is configured
     */
    @Getter
    private final String prefix;

    @Autowired
    public NamespaceCodec(SchedulerProperties properties) {
        this(properties.getNamespace());
    }

    public NamespaceCodec(String namespace) {
        this.prefix = normalize(namespace);
    }

    /**
     * Local name to wire name. Empty input yields an empty string.
     */
    public String addNamespace(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        return prefix + name;
    }

    /**
     * Wire name to local name.
     *
     * @return the local name, or an empty string when the wire name belongs to another namespace
     */
    public String trimNamespace(String wireName) {
        if (wireName == null || wireName.isEmpty()) {
            return "";
        }
        if (prefix.isEmpty()) {
            return wireName;
        }
        if (wireName.startsWith(prefix)) {
            return wireName.substring(prefix.length());
        }
        return "";
    }

    public boolean isNamespaced() {
        return !prefix.isEmpty();
    }

    private static String normalize(String namespace) {
        if (namespace == null) {
            return "";
        }
        var trimmed = namespace.replaceAll("_+$", "");
        return trimmed.isEmpty() ? "" : trimmed + "_";
    }
}
