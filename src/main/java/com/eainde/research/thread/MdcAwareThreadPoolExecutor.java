package com.eainde.research.thread;

import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Thread pool that carries the submitting thread's MDC (run id, section) into
 * the worker thread, so log lines of a section sub-pipeline or a gateway
 * attempt stay correlated with their run.
 */
public class MdcAwareThreadPoolExecutor extends ThreadPoolExecutor {

    private MdcAwareThreadPoolExecutor(int core, int max, long keepAliveSeconds,
                                       BlockingQueue<Runnable> queue,
                                       String threadNamePrefix) {
        super(core, max, keepAliveSeconds, TimeUnit.SECONDS, queue, threadFactory(threadNamePrefix));
    }

    /**
     * At most {@code threads} tasks run at once; the rest wait in an unbounded queue.
     */
    public static MdcAwareThreadPoolExecutor fixed(int threads, String threadNamePrefix) {
        return new MdcAwareThreadPoolExecutor(threads, threads, 0L,
                new LinkedBlockingQueue<>(), threadNamePrefix);
    }

    /**
     * Grows on demand; idle threads are reclaimed after a minute.
     */
    public static MdcAwareThreadPoolExecutor cached(String threadNamePrefix) {
        return new MdcAwareThreadPoolExecutor(0, Integer.MAX_VALUE, 60L,
                new SynchronousQueue<>(), threadNamePrefix);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        super.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    private static CustomizableThreadFactory threadFactory(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }
}
