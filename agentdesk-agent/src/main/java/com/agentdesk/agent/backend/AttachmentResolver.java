package com.agentdesk.agent.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves resource ids to {@link Attachment}s. Ids the lookup cannot resolve
 * are skipped.
 */
@Slf4j
public class AttachmentResolver {

    /** Location of a stored resource. */
    public record ResourceInfo(String path, String name, String mimeType) {
    }

    @FunctionalInterface
    public interface ResourceLookup {
        Optional<ResourceInfo> find(String resourceId);
    }

    private final ResourceLookup lookup;

    public AttachmentResolver(ResourceLookup lookup) {
        this.lookup = lookup;
    }

    public static AttachmentResolver none() {
        return new AttachmentResolver(id -> Optional.empty());
    }

    public List<Attachment> resolve(String agentId, List<String> resourceIds) {
        if (resourceIds == null || resourceIds.isEmpty()) {
            return List.of();
        }
        List<Attachment> out = new ArrayList<>(resourceIds.size());
        for (String id : resourceIds) {
            Optional<ResourceInfo> info;
            try {
                info = lookup.find(id);
            } catch (RuntimeException e) {
                log.warn("attachment lookup failed: agentId={} resourceId={} error={}", agentId, id, e.toString());
                continue;
            }
            if (info.isEmpty()) {
                log.warn("attachment skipped: agentId={} resourceId={} reason=not_found", agentId, id);
                continue;
            }
            ResourceInfo r = info.get();
            String name = r.name() != null ? r.name() : fileName(r.path());
            out.add(new Attachment(id, r.path(), name, r.mimeType(), AttachmentType.classify(r.mimeType(), name)));
        }
        return out;
    }

    private static String fileName(String path) {
        if (path == null) {
            return null;
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash < 0 ? path : path.substring(slash + 1);
    }
}
