package com.myorg.cafe.eventing;

/**
 * Contributes handlers to the {@link HandlerRegistry}. Each projection exposes one bean.
 */
@FunctionalInterface
public interface ProjectionRegistration {
    void register(HandlerRegistry registry);
}
