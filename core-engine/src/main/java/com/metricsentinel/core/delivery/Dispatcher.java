package com.metricsentinel.core.delivery;

import com.metricsentinel.core.channel.ChannelRegistry;
import com.metricsentinel.core.channel.NotificationChannel;
import com.metricsentinel.core.channel.SendResult;
import com.metricsentinel.core.config.DeliverySettings;
import com.metricsentinel.core.model.DeliveryAttempt;
import com.metricsentinel.core.model.DeliveryOutcome;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.store.DeliveryLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Delivers queued notification jobs through their channel adapters.
 *
 * <p>
 * Each {@link #runOnce()} claims a batch of due jobs and sends them on a
 * worker pool, each send bounded by {@code sendTimeoutSeconds}. Outcomes:
 * </p>
 * <ul>
 * <li>success - DELIVERED</li>
 * <li>transient failure or timeout - attempts + 1, retried after the backoff
 * delay, DEAD once {@code maxAttempts} attempts have been made</li>
 * <li>permanent failure or unknown channel - DEAD at once</li>
 * </ul>
 * <p>
 * Every attempt is appended to the {@link DeliveryLog} after the job's state
 * transition; a failing log or listener is logged and never strands a job in
 * flight. Workers never wait out a backoff: a job that is not yet due simply
 * stays queued until a later poll.
 * </p>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} polls every {@code pollIntervalSeconds};
 * {@link #stop()} stops polling and returns only after in-flight sends have
 * completed.
 * </p>
 *
 * @since 1.0.0
 */
public class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);
    private static final long STOP_GRACE_SECONDS = 60;

    private final NotificationQueue queue;
    private final ChannelRegistry channels;
    private final DeliveryLog deliveryLog;
    private final BackoffPolicy backoff;
    private final DeliverySettings settings;
    private final Clock clock;
    private final List<DeliveryListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService workers;
    private final ExecutorService senders;
    private ScheduledExecutorService poller;

    public Dispatcher(NotificationQueue queue, ChannelRegistry channels, DeliveryLog deliveryLog,
            BackoffPolicy backoff, DeliverySettings settings, Clock clock) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.channels = Objects.requireNonNull(channels, "channels must not be null");
        this.deliveryLog = Objects.requireNonNull(deliveryLog, "deliveryLog must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.workers = Executors.newFixedThreadPool(settings.getWorkerPoolSize(), named("dispatch-worker"));
        this.senders = Executors.newCachedThreadPool(named("channel-send"));
    }

    public void addListener(DeliveryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Start polling the queue in the background.
     *
     * @throws IllegalStateException if already started
     */
    public synchronized void start() {
        if (poller != null) {
            throw new IllegalStateException("Dispatcher already started");
        }
        queue.recoverInFlight();
        poller = Executors.newSingleThreadScheduledExecutor(named("dispatch-poller"));
        long interval = settings.pollInterval().toMillis();
        poller.scheduleWithFixedDelay(this::pollSafely, 0, interval, TimeUnit.MILLISECONDS);
        LOG.info("Dispatcher started: {} worker(s), poll every {} ms", settings.getWorkerPoolSize(), interval);
    }

    /**
     * Stop polling and wait for in-flight sends to finish.
     */
    public synchronized void stop() {
        if (poller != null) {
            poller.shutdown();
            awaitQuietly(poller, "poller");
            poller = null;
        }
        workers.shutdown();
        awaitQuietly(workers, "workers");
        senders.shutdown();
        awaitQuietly(senders, "senders");
        LOG.info("Dispatcher stopped");
    }

    private void pollSafely() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            LOG.error("Dispatch poll failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Claim due jobs and process them, blocking until every claimed job reached
     * its next state.
     *
     * @return number of jobs processed
     */
    public int runOnce() {
        List<NotificationJob> claimed = queue.claimDue(settings.getBatchSize());
        if (claimed.isEmpty()) {
            return 0;
        }
        LOG.debug("Claimed {} job(s)", claimed.size());
        List<Future<?>> inFlight = new ArrayList<>(claimed.size());
        for (NotificationJob job : claimed) {
            inFlight.add(workers.submit(() -> process(job)));
        }
        for (Future<?> f : inFlight) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for deliveries; remaining jobs stay in flight");
                break;
            } catch (ExecutionException e) {
                LOG.error("Delivery worker failed: {}", e.getCause().getMessage(), e.getCause());
            }
        }
        return claimed.size();
    }

    void process(NotificationJob job) {
        int attemptNumber = job.getAttempts() + 1;
        long started = System.nanoTime();
        SendResult result = send(job);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        Instant now = clock.instant();

        NotificationJob updated = job.copy();
        updated.setAttempts(attemptNumber);
        DeliveryOutcome outcome = result.getOutcome();
        Consumer<DeliveryListener> terminal;
        if (outcome == DeliveryOutcome.SUCCESS) {
            queue.markDelivered(updated);
            LOG.info("Delivered job {} via {} (attempt {})", job.getId(), job.getChannel(), attemptNumber);
            terminal = l -> l.onDelivered(updated);
        } else if (outcome == DeliveryOutcome.TRANSIENT_FAILURE && attemptNumber < settings.getMaxAttempts()) {
            Duration delay = backoff.delay(attemptNumber);
            queue.scheduleRetry(updated, now.plus(delay), result.getDetail());
            LOG.warn("Job {} via {} failed (attempt {}/{}), retry in {}: {}", job.getId(), job.getChannel(),
                    attemptNumber, settings.getMaxAttempts(), delay, result.getDetail());
            terminal = l -> l.onRetryScheduled(updated);
        } else {
            queue.markDead(updated, result.getDetail());
            LOG.error("Job {} via {} is dead after {} attempt(s): {}", job.getId(), job.getChannel(),
                    attemptNumber, result);
            terminal = l -> l.onDead(updated);
        }

        // The job already reached its next state; recording failures must not undo that.
        DeliveryAttempt attempt = new DeliveryAttempt(job.getId(), attemptNumber, job.getChannel(),
                outcome, now, result.getDetail());
        try {
            deliveryLog.append(attempt);
        } catch (RuntimeException e) {
            LOG.error("Failed to record attempt {} of job {}: {}", attemptNumber, job.getId(), e.getMessage(), e);
        }
        notifyListeners(job, l -> l.onAttempt(job, attempt, elapsedMillis));
        notifyListeners(job, terminal);
    }

    private void notifyListeners(NotificationJob job, Consumer<DeliveryListener> event) {
        for (DeliveryListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.warn("Delivery listener {} failed for job {}: {}", listener.getClass().getSimpleName(),
                        job.getId(), e.getMessage(), e);
            }
        }
    }

    private SendResult send(NotificationJob job) {
        Optional<NotificationChannel> channel = channels.find(job.getChannel());
        if (channel.isEmpty()) {
            return SendResult.permanentFailure("No adapter for channel '" + job.getChannel() + "'");
        }
        Future<SendResult> future = senders.submit(
                () -> channel.get().send(job.getDestination(), job.getPayload()));
        long timeout = settings.sendTimeout().toMillis();
        try {
            SendResult result = future.get(timeout, TimeUnit.MILLISECONDS);
            return result != null ? result : SendResult.transientFailure("Channel returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            return SendResult.transientFailure("Send timed out after " + timeout + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return SendResult.transientFailure("Interrupted while sending");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOG.warn("Channel '{}' threw for job {}: {}", job.getChannel(), job.getId(), cause.toString());
            return SendResult.transientFailure("Channel error: " + cause);
        }
    }

    private static void awaitQuietly(ExecutorService executor, String name) {
        try {
            if (!executor.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Dispatcher {} did not terminate within {} s", name, STOP_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
