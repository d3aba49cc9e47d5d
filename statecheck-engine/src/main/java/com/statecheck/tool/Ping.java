package com.statecheck.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Checks that hosts answer on the network.
 *
 * <p>Result keys: {@code alive}, {@code num_alive}, {@code unresponsive}, {@code num_unresponsive},
 * {@code times} (host to average round trip in ms), {@code min_time}, {@code max_time}.
 */
@Data
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Ping extends Tool {
    private static final Logger log = LoggerFactory.getLogger(Ping.class);

    private static final Set<String> RESULT_KEYS = Set.of(
            "alive",
            "num_alive",
            "unresponsive",
            "num_unresponsive",
            "times",
            "min_time",
            "max_time"
    );

    private List<String> hosts = new ArrayList<>();
    /**
     * Probes per host; a host is alive if any probe answers.
     */
    private int count = 3;
    /**
     * Timeout per probe in seconds.
     */
    private double timeout = 3.0;

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private HostProber prober = new InetAddressProber();

    @Override
    public Set<String> resultKeys() {
        return RESULT_KEYS;
    }

    @Override
    public CompletableFuture<ToolResult> run(Executor executor) {
        List<String> targets = hosts != null ? List.copyOf(hosts) : List.of();
        List<CompletableFuture<Double>> probes = new ArrayList<>(targets.size());
        for (String host : targets) {
            probes.add(CompletableFuture.supplyAsync(() -> probeHost(host), executor));
        }

        return CompletableFuture.allOf(probes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<String> alive = new ArrayList<>();
                    List<String> unresponsive = new ArrayList<>();
                    Map<String, Object> times = new LinkedHashMap<>();
                    for (int i = 0; i < targets.size(); i++) {
                        Double time = probes.get(i).join();
                        if (time != null) {
                            alive.add(targets.get(i));
                            times.put(targets.get(i), time);
                        } else {
                            unresponsive.add(targets.get(i));
                        }
                    }

                    Map<String, Object> values = new LinkedHashMap<>();
                    values.put("alive", alive);
                    values.put("num_alive", alive.size());
                    values.put("unresponsive", unresponsive);
                    values.put("num_unresponsive", unresponsive.size());
                    values.put("times", times);
                    values.put("min_time", times.values().stream().mapToDouble(t -> (Double) t).min().orElse(0.0));
                    values.put("max_time", times.values().stream().mapToDouble(t -> (Double) t).max().orElse(0.0));
                    return new ToolResult(values);
                });
    }

    private Double probeHost(String host) {
        Duration perProbe = Duration.ofMillis((long) (timeout * 1000));
        double total = 0.0;
        int answered = 0;
        for (int i = 0; i < Math.max(1, count); i++) {
            try {
                Double rtt = prober.probe(host, perProbe);
                if (rtt != null) {
                    total += rtt;
                    answered++;
                }
            } catch (IOException e) {
                log.debug("Probe failed: host={}", host, e);
                break;
            }
        }
        return answered > 0 ? total / answered : null;
    }
}
