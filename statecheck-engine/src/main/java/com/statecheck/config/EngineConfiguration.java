package com.statecheck.config;

import com.statecheck.device.DeviceDatabase;
import com.statecheck.device.InMemoryDeviceDatabase;
import com.statecheck.device.SignalFactory;
import com.statecheck.device.StaticSignalRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine. Deployments provide their own {@link DeviceDatabase} and {@link SignalFactory}
 * beans; the in-memory ones are fallbacks.
 */
@Configuration
@EnableConfigurationProperties(StatecheckProperties.class)
public class EngineConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService statecheckScheduler(StatecheckProperties properties) {
        return Executors.newScheduledThreadPool(properties.getExecution().getWorkerThreads(),
                daemonThreads("statecheck-worker-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService statecheckToolExecutor(StatecheckProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecution().getToolThreads(),
                daemonThreads("statecheck-tool-"));
    }

    @Bean
    @ConditionalOnMissingBean(DeviceDatabase.class)
    public InMemoryDeviceDatabase deviceDatabase() {
        return new InMemoryDeviceDatabase();
    }

    @Bean
    @ConditionalOnMissingBean(SignalFactory.class)
    public StaticSignalRegistry signalFactory() {
        return new StaticSignalRegistry();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
