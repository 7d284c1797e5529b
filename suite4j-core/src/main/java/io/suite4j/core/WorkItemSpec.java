package io.suite4j.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one schedulable test class, as produced by discovery.
 */
public record WorkItemSpec(
        String classPath,
        List<String> methods,
        List<String> fixtureMethods
) {
    public WorkItemSpec {
        if (classPath == null || classPath.isBlank()) {
            throw new IllegalArgumentException("classPath must not be blank");
        }
        Objects.requireNonNull(methods, "methods must not be null");
        if (methods.isEmpty()) {
            throw new IllegalArgumentException("methods must not be empty for " + classPath);
        }
        methods = List.copyOf(methods);
        fixtureMethods = fixtureMethods == null ? List.of() : List.copyOf(fixtureMethods);
    }

    public static WorkItemSpec of(String classPath, String... methods) {
        return new WorkItemSpec(classPath, List.of(methods), List.of());
    }
}
