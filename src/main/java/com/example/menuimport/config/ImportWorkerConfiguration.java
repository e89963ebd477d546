package com.example.menuimport.config;

import com.example.menuimport.worker.CsvImportWorker;
import com.example.menuimport.worker.CsvImportWorkerHost;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Slf4j
@Configuration
@EnableScheduling
public class ImportWorkerConfiguration {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService importDeadlineScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("import-deadline-");
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    @Bean(destroyMethod = "close")
    public CsvImportWorkerHost csvImportWorkerHost(ScheduledExecutorService importDeadlineScheduler,
            @Value("${app.import.chunk-size:100}") int chunkSize,
            @Value("${app.import.id-pool-size:500}") int idPoolSize,
            @Value("${app.import.cancel-grace-period-ms:100}") long cancelGracePeriodMs) {
        log.info("Creating import worker host chunkSize={} idPoolSize={} cancelGracePeriodMs={}",
                chunkSize, idPoolSize, cancelGracePeriodMs);
        CustomizableThreadFactory workerThreads = new CustomizableThreadFactory("csv-import-worker-");
        workerThreads.setDaemon(true);
        return new CsvImportWorkerHost(
                () -> new CsvImportWorker(workerThreads, chunkSize, idPoolSize),
                importDeadlineScheduler,
                Duration.ofMillis(Math.max(0, cancelGracePeriodMs)));
    }
}
