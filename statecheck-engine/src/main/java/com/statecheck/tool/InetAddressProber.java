package com.statecheck.tool;

import java.io.IOException;
import java.net.InetAddress;
import java.time.Duration;

/**
 * Probes hosts with {@link InetAddress#isReachable(int)}.
 */
public class InetAddressProber implements HostProber {

    @Override
    public Double probe(String host, Duration timeout) throws IOException {
        InetAddress address = InetAddress.getByName(host);
        long start = System.nanoTime();
        if (!address.isReachable((int) Math.max(1, timeout.toMillis()))) {
            return null;
        }
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
