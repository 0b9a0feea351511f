package com.myorg.cafe.eventing;

import com.myorg.cafe.contracts.core.conventions.CoreHeaders;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;
import com.myorg.cafe.eventing.context.DispatchOutcome;
import com.myorg.cafe.eventing.idempotency.ProcessingRecord;
import com.myorg.cafe.eventing.idempotency.ProcessingRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Optional;

/**
 * At-most-once handler execution per (eventId, processingGroup).
 *
 * <p>The handler and the record insert share one transaction when a {@link TransactionTemplate}
 * is available. An insert that loses a race rolls the handler's writes back.
 * Envelopes carrying {@link CoreHeaders#REPLAY}=true always run and upsert the record.
 */
@Slf4j
@RequiredArgsConstructor
public class IdempotentCafeDispatcher implements CafeDispatcher {
    private final CafeDispatcher delegate;
    private final ProcessingRecordStore store;
    private final AggregateIdExtractor idExtractor;
    // null: no transaction manager, handler and record commit separately
    private final TransactionTemplate tx;
    private final Clock clock;

    @Override
    public void dispatch(String processingGroup, EventEnvelope env) {
        String eventId = env.getEventId();
        if (eventId == null || eventId.isBlank()) {
            delegate.dispatch(processingGroup, env);
            return;
        }

        Optional<String> aggregateId = idExtractor.extract(env);
        if (aggregateId.isEmpty()) {
            log.debug("No aggregate id for eventId={} eventType={} group={}, processing untracked",
                    eventId, env.getEventType(), processingGroup);
            delegate.dispatch(processingGroup, env);
            DispatchOutcome.markUntracked();
            return;
        }

        ProcessingRecord record = new ProcessingRecord(
                eventId, processingGroup, aggregateId.get(), false, env.getHeaders(), clock.instant());

        if (CoreHeaders.isTrue(env.header(CoreHeaders.REPLAY))) {
            inTransaction(() -> {
                delegate.dispatch(processingGroup, env);
                store.upsertReplay(record);
            });
            DispatchOutcome.markReplayed();
            return;
        }

        if (store.find(eventId, processingGroup).isPresent()) {
            log.info("Skip duplicate eventId={} eventType={} group={}", eventId, env.getEventType(), processingGroup);
            DispatchOutcome.markDuplicate();
            return;
        }

        boolean inserted;
        if (tx == null) {
            delegate.dispatch(processingGroup, env);
            inserted = store.insert(record);
        } else {
            inserted = Boolean.TRUE.equals(tx.execute(status -> {
                delegate.dispatch(processingGroup, env);
                boolean ok = store.insert(record);
                // a concurrent delivery won: undo this handler's writes
                if (!ok) status.setRollbackOnly();
                return ok;
            }));
        }
        if (!inserted) {
            log.info("Concurrent duplicate eventId={} eventType={} group={}", eventId, env.getEventType(), processingGroup);
            DispatchOutcome.markDuplicate();
        }
    }

    private void inTransaction(Runnable work) {
        if (tx == null) {
            work.run();
            return;
        }
        tx.executeWithoutResult(status -> work.run());
    }
}
