package io.jamsession.server.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for mutation work and broadcast fan-out: one virtual thread per task when the runtime
 * offers it, a cached pool of named daemon threads otherwise.
 */
final class VirtualThreads {

    private static final Logger logger = LoggerFactory.getLogger(VirtualThreads.class);
    private static final Method VIRTUAL_PER_TASK = lookup();

    private VirtualThreads() {}

    static boolean available() {
        return VIRTUAL_PER_TASK != null;
    }

    static ExecutorService newExecutor(String threadName) {
        if (VIRTUAL_PER_TASK != null) {
            try {
                return (ExecutorService) VIRTUAL_PER_TASK.invoke(null);
            } catch (ReflectiveOperationException e) {
                logger.debug("Virtual thread executor unavailable, using platform threads", e);
            }
        }
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, threadName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    private static Method lookup() {
        try {
            return Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
