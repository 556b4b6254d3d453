package shadeagent.relayer.service.intent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.service.queue.IntentQueue;
import shadeagent.relayer.service.queue.QueuedIntent;

/**
 * Runs the queue workers. Each worker loops fetch then process with a catch boundary
 * around every iteration; a scheduled supervisor restarts workers that died.
 */
@Service
@Slf4j
public class IntentQueueConsumer {

    private final IntentQueue queue;
    private final IntentProcessor processor;
    private final boolean enabled;
    private final int concurrency;
    private final AtomicInteger restarts = new AtomicInteger();

    private volatile boolean running;
    private ExecutorService executor;
    private Future<?>[] workers;

    public IntentQueueConsumer(IntentQueue queue, IntentProcessor processor, RelayerProperties properties) {
        this.queue = queue;
        this.processor = processor;
        this.enabled = properties.getQueue().isEnabled();
        this.concurrency = Math.max(1, properties.getQueue().getConcurrency());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!enabled) {
            log.info("Intent queue consumer disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newFixedThreadPool(concurrency, workerThreadFactory());
        workers = new Future<?>[concurrency];
        for (int i = 0; i < concurrency; i++) {
            workers[i] = executor.submit(workerLoop(i));
        }
        log.info("Intent queue consumer started with {} workers", concurrency);
    }

    /**
     * Restarts any worker whose loop ended while the consumer is running.
     */
    @Scheduled(fixedDelayString = "${relayer.queue.supervisor-interval-ms:5000}")
    public synchronized void superviseWorkers() {
        if (!running) {
            return;
        }
        for (int i = 0; i < workers.length; i++) {
            if (!workers[i].isDone()) {
                continue;
            }
            log.error("Intent worker {} terminated unexpectedly: {}", i, describeTermination(workers[i]));
            workers[i] = executor.submit(workerLoop(i));
            restarts.incrementAndGet();
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Intent workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Intent queue consumer stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int getRestartCount() {
        return restarts.get();
    }

    public synchronized int getLiveWorkerCount() {
        if (workers == null) {
            return 0;
        }
        int live = 0;
        for (Future<?> worker : workers) {
            if (!worker.isDone()) {
                live++;
            }
        }
        return live;
    }

    Runnable workerLoop(int index) {
        return () -> {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    QueuedIntent next = queue.fetchNext();
                    processor.process(next);
                } catch (RuntimeException e) {
                    log.error("Intent worker {} iteration failed: {}", index, e.getMessage(), e);
                }
            }
        };
    }

    private static String describeTermination(Future<?> worker) {
        try {
            worker.get();
            return "loop exited";
        } catch (ExecutionException e) {
            return String.valueOf(e.getCause());
        } catch (CancellationException e) {
            return "cancelled";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "interrupted";
        }
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "intent-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
