package com.statecheck.prepared;

import com.statecheck.cache.DataCache;
import com.statecheck.device.DeviceDatabase;
import com.statecheck.model.ConfigurationFile;
import com.statecheck.model.ConfigurationGroup;
import com.statecheck.model.Result;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * A {@link ConfigurationFile} bound to live resources, ready to run.
 */
public class PreparedFile {
    private final DataCache cache;
    private final ConfigurationFile file;
    private final DeviceDatabase deviceDatabase;
    private final PreparedGroup root;

    private PreparedFile(DataCache cache, ConfigurationFile file, DeviceDatabase deviceDatabase, PreparedGroup root) {
        this.cache = cache;
        this.file = file;
        this.deviceDatabase = deviceDatabase;
        this.root = root;
    }

    /**
     * Prepares a whole file. Preparation does not raise for individual configuration failures;
     * they are recorded on the enclosing group.
     *
     * @param file configuration file
     * @param deviceDatabase resolves device names (may be null if the file has no device configurations)
     * @param cache data cache for this run
     * @return the prepared file
     */
    public static PreparedFile fromConfig(ConfigurationFile file, DeviceDatabase deviceDatabase, DataCache cache) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(cache, "cache");
        ConfigurationGroup rootConfig = file.getRoot() != null ? file.getRoot() : new ConfigurationGroup();
        PreparedGroup root = PreparedGroup.fromGroup(rootConfig, null, deviceDatabase, cache);
        return new PreparedFile(cache, file, deviceDatabase, root);
    }

    /**
     * Acquires every leaf's data without running comparisons. The next {@link #compare} pass
     * runs against the filled values.
     *
     * @param parallel acquire concurrently
     * @return completes once every acquisition has settled
     */
    public CompletableFuture<Void> fillCache(boolean parallel) {
        cache.clear();
        cache.markFilled();
        return ComparisonRunner.run(comparisons(), parallel, PreparedComparison::getDataAsync);
    }

    public Stream<PreparedLeaf> walkComparisons() {
        return root.walkComparisons();
    }

    /**
     * Walks the root and every nested group, depth-first.
     */
    public Stream<PreparedGroup> walkGroups() {
        return Stream.concat(Stream.of(root), root.walkGroups());
    }

    public CompletableFuture<Result> compare(boolean parallel) {
        return root.compare(parallel);
    }

    public CompletableFuture<Result> compare(boolean parallel, Duration timeout) {
        return root.compare(parallel, timeout);
    }

    /**
     * @return the root's last result, or {@code null} before the first run
     */
    public Result getResult() {
        return root.getResult();
    }

    public DataCache getCache() {
        return cache;
    }

    public ConfigurationFile getFile() {
        return file;
    }

    public DeviceDatabase getDeviceDatabase() {
        return deviceDatabase;
    }

    public PreparedGroup getRoot() {
        return root;
    }

    private List<PreparedComparison> comparisons() {
        return root.comparisonsToRun();
    }
}
