package com.demo.app;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Flips to draining as soon as the context starts closing, so readiness reports 503 while consumers stop.
 */
@Slf4j
@Component
public class ShutdownState {

    private volatile boolean draining;

    @EventListener(ContextClosedEvent.class)
    public void onClose() {
        draining = true;
        log.info("Draining: readiness now reports 503");
    }

    public boolean isDraining() {
        return draining;
    }
}
