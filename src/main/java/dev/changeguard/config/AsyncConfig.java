package dev.changeguard.config;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Executors for the fact collector's parallel fetches and for model calls.
 *
 * <p>Fetches are I/O-bound and short, so a bounded pool is enough. When the queue fills up
 * the submitting thread runs the fetch itself, which slows intake instead of dropping work.
 * The MDC is copied onto pool threads so collector logs keep the change id.
 */
@Configuration
public class AsyncConfig {

    private static final int POOL_SIZE = 16;
    private static final int QUEUE_CAPACITY = 256;
    private static final int MODEL_POOL_SIZE = 4;

    @Bean(name = "collectorExecutor", destroyMethod = "shutdown")
    public ExecutorService collectorExecutor() {
        ThreadPoolExecutor base = new ThreadPoolExecutor(
                POOL_SIZE, POOL_SIZE, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                new CustomizableThreadFactory("fact-collector-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        base.allowCoreThreadTimeOut(true);
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Model calls are few and slow; a small pool bounds concurrent Bedrock requests.
     */
    @Bean(name = "modelExecutor", destroyMethod = "shutdown")
    public ExecutorService modelExecutor() {
        ThreadPoolExecutor base = new ThreadPoolExecutor(
                MODEL_POOL_SIZE, MODEL_POOL_SIZE, 60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(QUEUE_CAPACITY),
                new CustomizableThreadFactory("model-call-"),
                new ThreadPoolExecutor.CallerRunsPolicy());
        base.allowCoreThreadTimeOut(true);
        return new DelegatingExecutorService(base, new MdcPropagatingTaskDecorator());
    }

    /**
     * Copies the caller's MDC (changeId) onto the worker thread for the duration of the task.
     */
    public static class MdcPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    if (previous != null) MDC.setContextMap(previous);
                    else MDC.clear();
                }
            };
        }
    }

    /**
     * Applies a {@link TaskDecorator} to everything submitted to the wrapped executor.
     */
    public static class DelegatingExecutorService extends AbstractExecutorService {
        private final ExecutorService delegate;
        private final TaskDecorator decorator;

        public DelegatingExecutorService(ExecutorService delegate, TaskDecorator decorator) {
            this.delegate = delegate;
            this.decorator = decorator;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(decorator.decorate(command));
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit)
                throws InterruptedException { return delegate.awaitTermination(timeout, unit); }
    }
}
