package io.suite4j.core;

import java.util.List;
import java.util.Objects;

/**
 * Either the discovered classes or the failure that prevented enumerating them.
 */
public final class DiscoveryResult {

    private final List<WorkItemSpec> items;
    private final DiscoveryFailure failure;

    private DiscoveryResult(List<WorkItemSpec> items, DiscoveryFailure failure) {
        this.items = items;
        this.failure = failure;
    }

    public static DiscoveryResult of(List<WorkItemSpec> items) {
        Objects.requireNonNull(items, "items must not be null");
        return new DiscoveryResult(List.copyOf(items), null);
    }

    public static DiscoveryResult failed(DiscoveryFailure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new DiscoveryResult(List.of(), failure);
    }

    public static DiscoveryResult failed(Throwable cause) {
        return failed(DiscoveryFailure.of(cause));
    }

    public boolean isFailure() {
        return failure != null;
    }

    /**
     * Empty when discovery failed.
     */
    public List<WorkItemSpec> items() {
        return items;
    }

    public DiscoveryFailure failure() {
        return failure;
    }

    @Override
    public String toString() {
        return isFailure()
                ? "DiscoveryResult[failure=" + failure.message() + "]"
                : "DiscoveryResult[items=" + items.size() + "]";
    }
}
