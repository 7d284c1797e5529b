package io.suite4j;

import io.suite4j.core.DiscoveryResult;

/**
 * Enumerates the classes of a suite. A thrown exception is treated as a discovery failure.
 */
public interface Discovery {
    DiscoveryResult discover() throws Exception;
}
