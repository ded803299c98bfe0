package im.arun.syntaxdoc.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides a shared bounded thread pool for parsing the rules of a document in parallel.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns a shared ExecutorService sized for CPU-bound work: one thread per
     * available processor, capped at 8. Threads are daemons so an idle pool never
     * keeps the JVM alive.
     */
    public static ExecutorService getExecutor() {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    int poolSize = Math.min(Runtime.getRuntime().availableProcessors(), 8);
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "syntaxdoc-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
            }
        }
    }
}
