package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.device.DeviceDatabase;
import com.statecheck.model.Configuration;
import com.statecheck.model.ConfigurationGroup;
import com.statecheck.model.DeviceConfiguration;
import com.statecheck.model.PvConfiguration;
import com.statecheck.model.Result;
import com.statecheck.model.ToolConfiguration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * A configuration node bound to live resources.
 *
 * <p>The parent reference is non-owning and only used to reconstruct paths.
 */
public abstract class PreparedConfiguration {
    static final String INITIALIZATION_FAILURE = "At least one configuration failed to initialize";

    private final DataCache cache;
    private final PreparedGroup parent;
    private final List<FailedConfiguration> prepareFailures = new ArrayList<>();
    private volatile Result result;

    protected PreparedConfiguration(DataCache cache, PreparedGroup parent) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.parent = parent;
    }

    /**
     * Prepares any configuration node.
     *
     * @param config configuration node
     * @param parent prepared parent group, or {@code null} for a root
     * @param deviceDatabase resolves device names (only needed for device configurations)
     * @param cache data cache shared by the whole prepared tree
     * @return the prepared node
     * @throws PreparationFailedException if the node as a whole cannot be bound
     */
    public static PreparedConfiguration fromConfig(
            Configuration config,
            PreparedGroup parent,
            DeviceDatabase deviceDatabase,
            DataCache cache
    ) throws PreparationFailedException {
        if (config instanceof PvConfiguration pv) {
            return PreparedPvConfiguration.fromConfig(pv, parent, cache);
        }
        if (config instanceof ToolConfiguration tool) {
            return PreparedToolConfiguration.fromConfig(tool, parent, cache);
        }
        if (config instanceof DeviceConfiguration device) {
            return PreparedDeviceConfiguration.fromConfig(device, parent, deviceDatabase, cache);
        }
        if (config instanceof ConfigurationGroup group) {
            return PreparedGroup.fromGroup(group, parent, deviceDatabase, cache);
        }
        throw new IllegalArgumentException("Configuration type unsupported: "
                + (config == null ? "null" : config.getClass().getName()));
    }

    public abstract Configuration getConfig();

    /**
     * Walks the preparation failures and comparisons underneath this node, failures of a node first.
     *
     * @return a fresh traversal
     */
    public abstract Stream<PreparedLeaf> walkComparisons();

    /**
     * Folds the current leaf results into this node's result and stores it.
     */
    abstract Result fold();

    /**
     * Runs every comparison underneath this node and folds the results. Each call is a new pass
     * that fetches live data again, unless the cache was just filled.
     *
     * @param parallel run comparisons concurrently; {@code false} runs them one at a time
     * @return this node's result
     */
    public CompletableFuture<Result> compare(boolean parallel) {
        return runPass(parallel, null);
    }

    /**
     * Like {@link #compare(boolean)} with an overall deadline. Comparisons still running at the
     * deadline are folded as missing results and keep no result from this pass.
     *
     * @param parallel run comparisons concurrently
     * @param timeout deadline for the whole run
     * @return this node's result
     */
    public CompletableFuture<Result> compare(boolean parallel, Duration timeout) {
        return runPass(parallel, timeout);
    }

    private CompletableFuture<Result> runPass(boolean parallel, Duration timeout) {
        List<PreparedComparison> comparisons = comparisonsToRun();
        cache.beginPass();
        comparisons.forEach(PreparedComparison::resetResult);

        ComparisonPass pass = new ComparisonPass();
        CompletableFuture<Void> run = ComparisonRunner.run(comparisons, parallel, c -> c.compare(pass));
        if (timeout != null) {
            run = run.completeOnTimeout(null, timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        return run.thenApply(ignored -> {
            pass.close();
            return fold();
        });
    }

    /**
     * Names from the root down to this node; unnamed nodes use their configuration type.
     *
     * @return path elements
     */
    public List<String> getPath() {
        LinkedList<String> path = new LinkedList<>();
        PreparedConfiguration node = this;
        while (node != null) {
            path.addFirst(displayName(node.getConfig()));
            node = node.parent;
        }
        return path;
    }

    public DataCache getCache() {
        return cache;
    }

    public PreparedGroup getParent() {
        return parent;
    }

    public List<FailedConfiguration> getPrepareFailures() {
        return Collections.unmodifiableList(prepareFailures);
    }

    /**
     * @return the last folded result, or {@code null} before the first run
     */
    public Result getResult() {
        return result;
    }

    protected void setResult(Result result) {
        this.result = result;
    }

    protected void recordFailure(FailedConfiguration failure) {
        prepareFailures.add(failure);
    }

    protected List<PreparedComparison> comparisonsToRun() {
        return walkComparisons()
                .filter(PreparedComparison.class::isInstance)
                .map(PreparedComparison.class::cast)
                .toList();
    }

    static String displayName(Configuration config) {
        if (config == null) {
            return "<none>";
        }
        String name = config.getName();
        return name != null && !name.isBlank() ? name : config.getClass().getSimpleName();
    }
}
