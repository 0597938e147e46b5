package com.agentbench.backend;

import com.agentbench.core.error.InfraException;
import com.agentbench.core.model.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the backend for a job's provider tag.
 */
@Component
public class BackendRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);

    private final Map<ProviderKind, ExecutionBackend> backends = new EnumMap<>(ProviderKind.class);

    public BackendRegistry(List<ExecutionBackend> available) {
        for (ExecutionBackend backend : available) {
            ExecutionBackend previous = backends.put(backend.kind(), backend);
            if (previous != null) {
                throw new IllegalStateException("Two backends registered for " + backend.kind().tag()
                        + ": " + previous.getClass().getSimpleName() + " and " + backend.getClass().getSimpleName());
            }
        }
        log.info("Execution backends available: {}", backends.keySet());
    }

    public ExecutionBackend forProvider(ProviderKind kind) {
        ExecutionBackend backend = backends.get(kind);
        if (backend == null) {
            throw new InfraException("No execution backend configured for provider " + kind.tag());
        }
        return backend;
    }

    public boolean supports(ProviderKind kind) {
        return backends.containsKey(kind);
    }
}
