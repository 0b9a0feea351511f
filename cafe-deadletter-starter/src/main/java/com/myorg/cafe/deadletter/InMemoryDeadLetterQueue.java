package com.myorg.cafe.deadletter;

import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.contracts.core.envelope.EventEnvelope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class InMemoryDeadLetterQueue implements DeadLetterQueue {

    private final TreeMap<Long, DeadLetter> letters = new TreeMap<>();
    private long nextId = 1;

    @Override
    public synchronized DeadLetter enqueue(String processingGroup, String sequenceKey, EventEnvelope envelope,
                                           ErrorInfo cause, Instant now, Map<String, Object> diagnostics) {
        DeadLetter letter = new DeadLetter(nextId++, processingGroup, sequenceKey, envelope, cause,
                DeadLetter.Status.QUEUED, 0, now, now, now,
                diagnostics == null ? Map.of() : Map.copyOf(diagnostics));
        letters.put(letter.id(), letter);
        return letter;
    }

    @Override
    public synchronized boolean contains(String processingGroup, String sequenceKey) {
        return letters.values().stream()
                .anyMatch(l -> l.processingGroup().equals(processingGroup) && l.sequenceKey().equals(sequenceKey));
    }

    @Override
    public synchronized List<DeadLetter> heads(String processingGroup) {
        Map<String, DeadLetter> first = new LinkedHashMap<>();
        for (DeadLetter l : letters.values()) {
            if (l.processingGroup().equals(processingGroup)) first.putIfAbsent(l.sequenceKey(), l);
        }
        return new ArrayList<>(first.values());
    }

    @Override
    public synchronized List<DeadLetter> letters(String processingGroup) {
        return letters.values().stream().filter(l -> l.processingGroup().equals(processingGroup)).toList();
    }

    @Override
    public synchronized void markRetry(long id, int retryCount, DeadLetter.Status status, Instant nextAttemptAt,
                                       ErrorInfo cause, Instant now) {
        DeadLetter cur = letters.get(id);
        if (cur == null) return;
        letters.put(id, new DeadLetter(cur.id(), cur.processingGroup(), cur.sequenceKey(), cur.envelope(), cause,
                status, retryCount, cur.enqueuedAt(), now, nextAttemptAt, cur.diagnostics()));
    }

    @Override
    public synchronized boolean evict(long id) {
        return letters.remove(id) != null;
    }

    @Override
    public synchronized long size(String processingGroup) {
        return letters.values().stream().filter(l -> l.processingGroup().equals(processingGroup)).count();
    }

    @Override
    public synchronized long countQueued() {
        return letters.values().stream().filter(l -> l.status() == DeadLetter.Status.QUEUED).count();
    }
}
