package com.statecheck.service;

import com.statecheck.cache.DataCache;
import com.statecheck.config.StatecheckProperties;
import com.statecheck.device.DeviceDatabase;
import com.statecheck.device.SignalFactory;
import com.statecheck.model.ConfigurationFile;
import com.statecheck.model.Result;
import com.statecheck.model.Severity;
import com.statecheck.prepared.FailedConfiguration;
import com.statecheck.prepared.PreparedFile;
import com.statecheck.prepared.PreparedLeaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

/**
 * Prepares and runs configuration files against live data.
 *
 * <p>Every run gets its own {@link DataCache}, so values are never shared between runs.
 */
@Service
public class CheckService {
    private static final Logger log = LoggerFactory.getLogger(CheckService.class);

    static final String MDC_RUN_ID = "run_id";

    private final StatecheckProperties properties;
    private final ConfigurationFileLoader loader;
    private final DeviceDatabase deviceDatabase;
    private final SignalFactory signalFactory;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService toolExecutor;

    public CheckService(
            StatecheckProperties properties,
            ConfigurationFileLoader loader,
            DeviceDatabase deviceDatabase,
            SignalFactory signalFactory,
            @Qualifier("statecheckScheduler") ScheduledExecutorService scheduler,
            @Qualifier("statecheckToolExecutor") ExecutorService toolExecutor
    ) {
        this.properties = properties;
        this.loader = loader;
        this.deviceDatabase = deviceDatabase;
        this.signalFactory = signalFactory;
        this.scheduler = scheduler;
        this.toolExecutor = toolExecutor;
    }

    public CheckReport run(Path path) {
        return run(loader.load(path));
    }

    /**
     * Prepares and runs a configuration file.
     *
     * @param file configuration file
     * @return report with the file result and per-leaf breakdown
     */
    public CheckReport run(ConfigurationFile file) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            DataCache cache = newCache();
            PreparedFile prepared = PreparedFile.fromConfig(file, deviceDatabase, cache);
            List<FailedConfiguration> failures = prepared.walkComparisons()
                    .filter(FailedConfiguration.class::isInstance)
                    .map(FailedConfiguration.class::cast)
                    .toList();
            log.info("Prepared configuration file: root={}, comparisons={}, failures={}",
                    prepared.getRoot().getPath(), prepared.walkComparisons().count() - failures.size(), failures.size());

            StatecheckProperties.Execution execution = properties.getExecution();
            Result result = prepared.compare(execution.isParallel(), execution.getRunTimeout()).join();

            Map<Severity, Long> counts = prepared.walkComparisons()
                    .map(PreparedLeaf::resultOf)
                    .collect(Collectors.groupingBy(Result::getSeverity,
                            () -> new EnumMap<>(Severity.class), Collectors.counting()));
            log.info("Check run finished: severity={}, counts={}", result.getSeverity(), counts);

            return CheckReport.builder()
                    .runId(runId)
                    .result(result)
                    .preparedFile(prepared)
                    .severityCounts(counts)
                    .failures(failures)
                    .build();
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    DataCache newCache() {
        StatecheckProperties.Cache cache = properties.getCache();
        return new DataCache(signalFactory, scheduler, toolExecutor, cache.getReadTimeout(), cache.getSampleInterval());
    }
}
