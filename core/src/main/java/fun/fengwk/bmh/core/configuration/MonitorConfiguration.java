package fun.fengwk.bmh.core.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.bmh.core.service.browser.BrowserProperties;
import fun.fengwk.bmh.core.service.browser.WebCheckProperties;
import fun.fengwk.bmh.core.service.browser.runtime.ChromiumProcessLauncher;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerPoolConfig;
import fun.fengwk.bmh.core.service.browser.runtime.WorkerProcessPool;
import fun.fengwk.bmh.core.service.state.StateStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author fengwk
 */
@Configuration
public class MonitorConfiguration {

    @Bean
    public StateStore stateStore(StorageProperties storageProperties,
                                 PerformanceProperties performanceProperties,
                                 ObjectMapper objectMapper) {
        return StateStore.load(
            storageProperties.resolveBalanceCacheFile(),
            storageProperties.resolveCycleStateFile(),
            performanceProperties.getDailyRolloverHour(),
            objectMapper,
            Clock.systemDefaultZone()
        );
    }

    /**
     * Browser processes are only started when a web check first needs one.
     */
    @Lazy
    @Bean(destroyMethod = "shutdown")
    public WorkerProcessPool workerProcessPool(WebCheckProperties webCheckProperties, BrowserProperties browserProperties) {
        WorkerPoolConfig config = WorkerPoolConfig.builder()
            .minWorkers(webCheckProperties.getPoolSize())
            .maxWorkers(webCheckProperties.getMaxPoolSize())
            .portReadyTimeoutMs(webCheckProperties.getPortReadyTimeoutMs())
            .probeTimeoutMs(webCheckProperties.getProbeTimeoutMs())
            .build();
        return new WorkerProcessPool(config, new ChromiumProcessLauncher(browserProperties));
    }

    @Bean(name = "checkExecutor", destroyMethod = "shutdownNow")
    public ExecutorService checkExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("bmh-check-"));
    }

    @Bean(name = "webFlowExecutor", destroyMethod = "shutdownNow")
    public ExecutorService webFlowExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("bmh-web-flow-"));
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

}
