package com.p14n.eventstream.broker;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} that runs every task on its
 * own named daemon thread, reusing idle threads.
 *
 * <p>
 * Dispatched subscriptions block for as long as they are open, so a bounded
 * pool would leave later dispatches queued behind them.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ExecutorService es;

        public DefaultExecutor() {
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a cached thread pool with named threads.
         *
         * @return a cached thread pool executor service
         */
        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder()
                                                .setNameFormat("event-stream-dispatch-%d")
                                                .setDaemon(true)
                                                .build());
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return es.shutdownNow();
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
                return es.awaitTermination(timeout, unit);
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
