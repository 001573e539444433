package im.arun.menubuilder.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for script listing and shelf imports.
 * <p>
 * Imports read one local file and scan it line by line, so they are CPU-bound
 * and finish quickly; the pool is sized to the processors rather than to
 * outstanding requests. Workers are daemons and answer interruption, which is
 * how a cancelled import {@link java.util.concurrent.Future} stops its scan.
 */
public final class ExecutorProvider {
    static final int MAX_WORKERS = 8;
    private static final String THREAD_PREFIX = "menubuilder-worker-";

    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    public static ExecutorService getExecutor() {
        ExecutorService executor = instance;
        if (executor == null) {
            synchronized (LOCK) {
                executor = instance;
                if (executor == null) {
                    executor = Executors.newFixedThreadPool(poolSize(), new ImportThreadFactory());
                    instance = executor;
                }
            }
        }
        return executor;
    }

    static int poolSize() {
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), MAX_WORKERS));
    }

    /**
     * Interrupts running imports and discards queued ones. The next
     * {@link #getExecutor()} call starts a fresh pool.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdownNow();
                instance = null;
            }
        }
    }

    private static final class ImportThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread worker = new Thread(task, THREAD_PREFIX + counter.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }
}
