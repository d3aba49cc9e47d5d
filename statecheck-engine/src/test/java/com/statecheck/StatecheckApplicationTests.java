package com.statecheck;

import com.statecheck.config.StatecheckProperties;
import com.statecheck.device.StaticSignalRegistry;
import com.statecheck.model.Severity;
import com.statecheck.service.CheckReport;
import com.statecheck.service.CheckService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

@SpringBootTest
@ActiveProfiles("test")
class StatecheckApplicationTests {

    @Autowired
    private StatecheckProperties properties;

    @Autowired
    private StaticSignalRegistry signals;

    @Autowired
    private CheckService checkService;

    @Autowired
    @Qualifier("statecheckScheduler")
    private ScheduledExecutorService scheduler;

    @Autowired
    @Qualifier("statecheckToolExecutor")
    private ExecutorService toolExecutor;

    @Test
    void bindsProperties() {
        assertEquals(Duration.ofSeconds(1), properties.getCache().getReadTimeout());
        assertEquals(Duration.ofMillis(20), properties.getCache().getSampleInterval());
        assertEquals(2, properties.getExecution().getWorkerThreads());
        assertEquals(1, properties.getExecution().getToolThreads());
    }

    @Test
    void toolWorkRunsApartFromPolling() throws Exception {
        String thread = toolExecutor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
        assertEquals("statecheck-tool-1", thread);
        assertNotSame(scheduler, toolExecutor);
    }

    @Test
    void runsFileAgainstDefaultBeans() throws Exception {
        signals.register("VAC:STATE", "OK");
        Path file = Path.of(getClass().getResource("/configs/vacuum.yaml").toURI());

        CheckReport report = checkService.run(file);

        // gauge1 is not registered, so the device check fails to prepare
        assertEquals(Severity.ERROR, report.getSeverity());
        assertEquals(1, report.getFailures().size());
    }
}
