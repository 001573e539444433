package im.arun.menubuilder.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorProviderTest {

    @AfterEach
    void tearDown() {
        ExecutorProvider.shutdown();
    }

    @Test
    void poolIsBoundedByProcessors() {
        assertThat(ExecutorProvider.poolSize()).isBetween(1, ExecutorProvider.MAX_WORKERS);
    }

    @Test
    void runsOnNamedDaemonWorkers() throws Exception {
        Thread worker = ExecutorProvider.getExecutor().submit(Thread::currentThread).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("menubuilder-worker-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    void shutdownStartsAFreshPoolOnNextUse() {
        ExecutorService first = ExecutorProvider.getExecutor();
        assertThat(ExecutorProvider.getExecutor()).isSameAs(first);

        ExecutorProvider.shutdown();

        assertThat(first.isShutdown()).isTrue();
        assertThat(ExecutorProvider.getExecutor()).isNotSameAs(first);
    }
}
