package io.jobclock.core;

import io.jobclock.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps handler names to {@link JobHandler} instances.
 *
 * <p>Populated at startup; reads are lock-free afterwards. Registering a name twice keeps the last handler.
 */
public class JobHandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final Map<String, JobHandler<?>> handlersByName = new ConcurrentHashMap<>();

    public JobHandlerRegistry(List<? extends JobHandler<?>> handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        handlers.forEach(this::register);
    }

    public void register(JobHandler<?> handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String name = handler.name();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("JobHandler name must not be blank: " + handler.getClass().getName());
        }
        JobHandler<?> previous = handlersByName.put(name, handler);
        if (previous != null && previous != handler) {
            log.warn("JobHandler '{}' re-registered; {} replaces {}",
                    name, handler.getClass().getName(), previous.getClass().getName());
        }
    }

    public Optional<JobHandler<?>> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlersByName.get(name));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    public Set<String> names() {
        return new TreeSet<>(handlersByName.keySet());
    }
}
