package com.demo.coffeeshop.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.cafe.contracts.core.envelope.ErrorInfo;
import com.myorg.cafe.deadletter.DeadLetter;
import com.myorg.cafe.deadletter.DeadLetterSequencer;
import com.myorg.cafe.deadletter.ManualProcessingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * Operator view over parked events: list a group's letters, force a redrive batch,
 * or drop a single letter.
 */
@Slf4j
@RestController
@RequestMapping("/admin/deadletters")
@RequiredArgsConstructor
public class DeadLetterAdminController {

    private final DeadLetterSequencer sequencer;

    public record LetterView(long id,
                             String sequenceKey,
                             String eventId,
                             String eventType,
                             String status,
                             int retryCount,
                             Instant enqueuedAt,
                             Instant lastTouched,
                             Instant nextAttemptAt,
                             ErrorInfo cause,
                             JsonNode payload) {}

    public record GroupView(String group, long size, List<LetterView> letters) {}

    @GetMapping("/{group}")
    public GroupView list(@PathVariable String group) {
        List<LetterView> letters = sequencer.letters(group).stream().map(DeadLetterAdminController::toView).toList();
        return new GroupView(group, sequencer.size(group), letters);
    }

    @PostMapping("/process/{group}")
    public ManualProcessingResult process(@PathVariable String group, @RequestParam(defaultValue = "10") int count) {
        if (count <= 0) throw new IllegalArgumentException("count must be positive");
        ManualProcessingResult result = sequencer.processManually(group, count);
        log.info("Manual dead-letter run group={} processed={} failed={} ignored={}",
                group, result.processed(), result.failed(), result.ignored());
        return result;
    }

    @DeleteMapping("/{group}/{letterId}")
    public ResponseEntity<Void> evict(@PathVariable String group, @PathVariable long letterId) {
        boolean known = sequencer.letters(group).stream().anyMatch(l -> l.id() == letterId);
        if (!known || !sequencer.evict(letterId)) return ResponseEntity.notFound().build();
        return ResponseEntity.noContent().build();
    }

    private static LetterView toView(DeadLetter l) {
        return new LetterView(
                l.id(),
                l.sequenceKey(),
                l.envelope().getEventId(),
                l.envelope().getEventType(),
                l.status().name(),
                l.retryCount(),
                l.enqueuedAt(),
                l.lastTouched(),
                l.nextAttemptAt(),
                l.cause(),
                l.envelope().getPayload());
    }
}
