package com.myorg.cafe.deadletter;

import com.myorg.cafe.eventing.HandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.Collection;

/** Periodically redrives one due dead letter per processing group. */
@Slf4j
@RequiredArgsConstructor
public class DeadLetterProcessor {

    private final DeadLetterSequencer sequencer;
    private final HandlerRegistry registry;
    private final CafeDeadLetterProperties props;

    @Scheduled(
            initialDelayString = "#{@cafeDeadLetterSchedule.initialDelayMs}",
            fixedDelayString = "#{@cafeDeadLetterSchedule.fixedDelayMs}"
    )
    public void scheduledLoop() {
        if (!props.getProcessor().isSchedulingEnabled()) return;
        runOnce();
    }

    /** @return number of letters successfully redriven */
    public int runOnce() {
        int processed = 0;
        for (String group : groups()) {
            try {
                ProcessingResult r = sequencer.processAny(group);
                if (r == ProcessingResult.PROCESSED) processed++;
                if (r != ProcessingResult.EMPTY) {
                    log.debug("Dead-letter processing group={} result={}", group, r);
                }
            } catch (RuntimeException e) {
                log.error("Dead-letter processing failed for group={}", group, e);
            }
        }
        if (processed > 0) log.info("Dead-letter processor redrove {} letter(s)", processed);
        return processed;
    }

    private Collection<String> groups() {
        return props.getGroups().isEmpty() ? registry.groups() : props.getGroups();
    }
}
