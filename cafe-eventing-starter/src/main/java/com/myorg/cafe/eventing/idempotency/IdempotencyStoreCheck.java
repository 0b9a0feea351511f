package com.myorg.cafe.eventing.idempotency;

import com.myorg.cafe.eventing.CafeEventingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.Environment;

// Startup check: a store that cannot share the read model's transaction may lose a record
// after the projection already committed. Warn in dev, refuse to start in prod.
@Slf4j
@RequiredArgsConstructor
public class IdempotencyStoreCheck implements ApplicationListener<ApplicationReadyEvent> {
    private final CafeEventingProperties props;
    private final Environment env;
    private final ProcessingRecordStore store;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        var idem = props.getIdempotency();
        if (!idem.isEnabled() || store.transactional()) return;

        boolean isProd = false;
        for (String p : env.getActiveProfiles()) {
            if ("prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p)) {
                isProd = true;
                break;
            }
        }

        String msg = "Processing record store " + store.getClass().getSimpleName()
                + " does not join the read-model transaction; a crash between handler and record write can re-apply an event.";
        if (idem.isRequireTransactional() || isProd) {
            throw new IllegalStateException(msg + " (prod/requireTransactional => fail startup)");
        }
        log.warn(msg + " (dev => warn)");
    }
}
