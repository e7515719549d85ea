package com.waterCompliance.complianceDemo.thread;

import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fixed-size executor that carries the submitting thread's MDC (sessionId, correlationId)
 * onto the worker thread.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(String threadNamePrefix, int threads) {
        this.delegate = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory(threadNamePrefix));
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
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

    public void shutdown() {
        delegate.shutdown();
    }
}
