package io.jobclock.core;

import io.jobclock.JobHandler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobHandlerRegistryTest {

    @Test
    void lookupShouldResolveRegisteredNames() {
        NamedHandler hello = new NamedHandler("print_hello");
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(hello, new NamedHandler("crunch")));

        assertSame(hello, registry.lookup("print_hello").orElseThrow());
        assertEquals(Set.of("crunch", "print_hello"), registry.names());
        assertTrue(registry.contains("crunch"));
    }

    @Test
    void unknownNameShouldNotBeFatal() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of());

        assertEquals(Optional.empty(), registry.lookup("missing"));
        assertEquals(Optional.empty(), registry.lookup(null));
        assertFalse(registry.contains("missing"));
    }

    @Test
    void reRegisteringShouldKeepLastHandler() {
        NamedHandler first = new NamedHandler("print_hello");
        NamedHandler second = new NamedHandler("print_hello");
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(first));

        registry.register(second);

        assertSame(second, registry.lookup("print_hello").orElseThrow());
        assertEquals(Set.of("print_hello"), registry.names());
    }

    @Test
    void blankNamesShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new JobHandlerRegistry(List.of(new NamedHandler(" "))));
    }

    private record NamedHandler(String name) implements JobHandler<Map<String, Object>> {
        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> dataClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public void execute(String jobId, Map<String, Object> data) {
        }
    }
}
