package com.statecheck.tool;

import java.io.IOException;
import java.time.Duration;

/**
 * Probes a host once and reports the round trip time.
 */
@FunctionalInterface
public interface HostProber {

    /**
     * @param host host name or address
     * @param timeout probe timeout
     * @return round trip in milliseconds, or {@code null} when the host did not answer
     * @throws IOException if the host cannot be probed at all
     */
    Double probe(String host, Duration timeout) throws IOException;
}
