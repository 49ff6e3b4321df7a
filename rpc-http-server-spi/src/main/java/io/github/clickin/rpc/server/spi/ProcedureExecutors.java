package io.github.clickin.rpc.server.spi;

import java.lang.reflect.Method;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for blocking procedure registries.
 */
final class ProcedureExecutors {
    static final String THREAD_PREFIX = "rpc-procedure";

    private ProcedureExecutors() {
    }

    /** The executor shared by every router built with {@link ProcedureRouter#blocking(ProcedureRouter.Blocking)}. */
    static ExecutorService shared() {
        return Shared.EXECUTOR;
    }

    // One virtual thread per call on 21+; on 17 a cached pool of named daemon threads.
    static ExecutorService create(String threadPrefix) {
        try {
            Method perTask = Executors.class.getMethod("newVirtualThreadPerTaskExecutor");
            return (ExecutorService) perTask.invoke(null);
        } catch (ReflectiveOperationException unavailable) {
            return Executors.newCachedThreadPool(daemonThreads(threadPrefix));
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class Shared {
        static final ExecutorService EXECUTOR = create(THREAD_PREFIX);
    }
}
