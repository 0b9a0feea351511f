package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.CafeDispatcher;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Per-group dead-letter queues that keep later events of a sequence behind a failed one.
 *
 * <p>Redrives go through the dispatcher attached with {@link #attach(CafeDispatcher)}, i.e. the
 * idempotency guard and the handler, never through the sequencing layer itself.
 */
@Slf4j
public class DeadLetterSequencer implements AutoCloseable {

    public static final String SEQUENCE_BLOCKED = "SEQUENCE_BLOCKED";

    private final DeadLetterQueue queue;
    private final CafeDeadLetterProperties props;
    private final Clock clock;
    private final DeadLetterHooks hooks;
    private final DeadLetterMetrics metrics; // may be null

    private volatile CafeDispatcher target;
    private final ExecutorService timeoutPool;

    public DeadLetterSequencer(DeadLetterQueue queue,
                               CafeDeadLetterProperties props,
                               Clock clock,
                               DeadLetterHooks hooks,
                               DeadLetterMetrics metrics) {
        this.queue = queue;
        this.props = props;
        this.clock = clock;
        this.hooks = hooks == null ? new DeadLetterHooks() {} : hooks;
        this.metrics = metrics;

        AtomicInteger n = new AtomicInteger();
        this.timeoutPool = hasTimeout() ? Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cafe-handler-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        }) : null;
    }

    /** Dispatcher used for redrives. Set once while the dispatcher chain is assembled. */
    public void attach(CafeDispatcher dispatcher) {
        this.target = dispatcher;
    }

    public boolean isBlocked(String processingGroup, String sequenceKey) {
        return queue.contains(processingGroup, sequenceKey);
    }

    public DeadLetter enqueue(String processingGroup, String sequenceKey, EventEnvelope envelope, ErrorInfo cause) {
        Map<String, Object> diagnostics = new LinkedHashMap<>();
        diagnostics.put("causeCode", cause.getCode());
        diagnostics.put("thread", Thread.currentThread().getName());
        if (envelope.getCorrelationId() != null) diagnostics.put("correlationId", envelope.getCorrelationId());

        DeadLetter letter = queue.enqueue(processingGroup, sequenceKey, envelope, cause, clock.instant(), diagnostics);
        if (metrics != null) metrics.incEnqueued();
        hooks.afterEnqueue(letter);

        if (SEQUENCE_BLOCKED.equals(cause.getCode())) {
            log.warn("Dead-letter QUEUED behind sequence group={} key={} eventId={} id={}",
                    processingGroup, sequenceKey, envelope.getEventId(), letter.id());
        } else {
            log.error("Dead-letter QUEUED group={} key={} eventId={} eventType={} id={} cause={}: {}",
                    processingGroup, sequenceKey, envelope.getEventId(), envelope.getEventType(), letter.id(),
                    cause.getCode(), cause.getMessage());
        }
        return letter;
    }

    /** Oldest due head of a QUEUED sequence; exhausted and backed-off letters are skipped. */
    public ProcessingResult processAny(String processingGroup) {
        Instant now = clock.instant();
        Optional<DeadLetter> head = queue.heads(processingGroup).stream()
                .filter(l -> l.isDue(now))
                .findFirst();
        if (head.isEmpty()) return ProcessingResult.EMPTY;
        return redrive(head.get()) ? ProcessingResult.PROCESSED : ProcessingResult.FAILED;
    }

    /**
     * Operator-driven processing: backoff and exhaustion are ignored, and a sequence whose head
     * failed is left alone for the rest of this run.
     */
    public ManualProcessingResult processManually(String processingGroup, int maxCount) {
        Set<String> failedSequences = new HashSet<>();
        int processed = 0;
        int failed = 0;

        for (int i = 0; i < maxCount; i++) {
            Predicate<DeadLetter> open = l -> !failedSequences.contains(l.sequenceKey());
            Optional<DeadLetter> head = queue.heads(processingGroup).stream().filter(open).findFirst();
            if (head.isEmpty()) break;

            if (redrive(head.get())) {
                processed++;
            } else {
                failed++;
                failedSequences.add(head.get().sequenceKey());
            }
        }

        int ignored = 0;
        if (!failedSequences.isEmpty()) {
            Map<String, Integer> perSequence = new LinkedHashMap<>();
            for (DeadLetter l : queue.letters(processingGroup)) {
                if (failedSequences.contains(l.sequenceKey())) perSequence.merge(l.sequenceKey(), 1, Integer::sum);
            }
            for (int count : perSequence.values()) ignored += Math.max(0, count - 1);
        }

        log.info("Manual dead-letter processing group={} processed={} failed={} ignored={}",
                processingGroup, processed, failed, ignored);
        return new ManualProcessingResult(processed, failed, ignored);
    }

    public List<DeadLetter> letters(String processingGroup) {
        return queue.letters(processingGroup);
    }

    public long size(String processingGroup) {
        return queue.size(processingGroup);
    }

    public boolean evict(long letterId) {
        boolean removed = queue.evict(letterId);
        if (removed) log.info("Dead-letter EVICTED id={}", letterId);
        return removed;
    }

    /**
     * Runs one delivery under the configured handler timeout.
     *
     * @throws HandlerTimeoutException when the handler did not finish in time
     */
    public void invoke(String processingGroup, EventEnvelope env, CafeDispatcher dispatcher) {
        if (!hasTimeout()) {
            dispatcher.dispatch(processingGroup, env);
            return;
        }

        long timeoutMs = props.getHandlerTimeout().toMillis();
        Future<String> f = timeoutPool.submit(() -> {
            try {
                dispatcher.dispatch(processingGroup, env);
                return DispatchOutcome.consume();
            } finally {
                DispatchOutcome.clear();
            }
        });
        try {
            DispatchOutcome.restore(f.get(timeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new HandlerTimeoutException(processingGroup, env.getEventId(), timeoutMs);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            throw new IllegalStateException("Interrupted while waiting for handler eventId=" + env.getEventId(), e);
        }
    }

    public static ErrorInfo causeOf(RuntimeException e) {
        if (e instanceof HandlerTimeoutException) return ErrorInfo.of(HandlerTimeoutException.CODE, e.getMessage());
        return ErrorInfo.from(e);
    }

    private boolean redrive(DeadLetter letter) {
        CafeDispatcher dispatcher = target;
        if (dispatcher == null) {
            throw new IllegalStateException("No dispatcher attached to the dead-letter sequencer");
        }

        Map<String, Object> headers = new LinkedHashMap<>(
                letter.envelope().getHeaders() == null ? Map.of() : letter.envelope().getHeaders());
        headers.put(CoreHeaders.DEAD_LETTER_REDRIVE, true);
        EventEnvelope env = letter.envelope().toBuilder().headers(headers).build();

        try {
            hooks.beforeRedrive(letter);
            invoke(letter.processingGroup(), env, dispatcher);
            queue.evict(letter.id());
            if (metrics != null) metrics.incRedriveSuccess();
            log.info("Dead-letter PROCESSED group={} key={} eventId={} id={} attempts={}",
                    letter.processingGroup(), letter.sequenceKey(), env.getEventId(), letter.id(), letter.retryCount() + 1);
            return true;
        } catch (RuntimeException e) {
            int retries = letter.retryCount() + 1;
            Instant now = clock.instant();
            DeadLetter.Status status = retries >= props.getMaxRetries()
                    ? DeadLetter.Status.EXHAUSTED
                    : DeadLetter.Status.QUEUED;
            Instant next = now.plus(backoff(retries));
            queue.markRetry(letter.id(), retries, status, next, causeOf(e), now);
            if (metrics != null) metrics.incRedriveFail();

            if (status == DeadLetter.Status.EXHAUSTED) {
                log.error("Dead-letter EXHAUSTED group={} key={} eventId={} id={} after retries={}",
                        letter.processingGroup(), letter.sequenceKey(), env.getEventId(), letter.id(), retries, e);
            } else {
                log.warn("Dead-letter RETRY group={} key={} eventId={} id={} retry={} nextAttempt={}",
                        letter.processingGroup(), letter.sequenceKey(), env.getEventId(), letter.id(), retries, next, e);
            }
            return false;
        } finally {
            DispatchOutcome.clear();
        }
    }

    /** retryCount=1 => base, retryCount=2 => 2*base, ... capped at max */
    Duration backoff(int retryCount) {
        long baseMs = Math.max(1, props.getBackoffBase().toMillis());
        int pow = Math.max(0, retryCount - 1);
        long exp = 1L << Math.min(30, pow);

        long ms = baseMs * exp;
        ms = Math.min(ms, props.getBackoffMax().toMillis());
        return Duration.ofMillis(ms);
    }

    private boolean hasTimeout() {
        Duration t = props.getHandlerTimeout();
        return t != null && !t.isZero() && !t.isNegative();
    }

    @Override
    public void close() {
        if (timeoutPool != null) timeoutPool.shutdownNow();
    }
}
