package com.myorg.cafe.eventstore.aggregate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Two-way mapping between an aggregate's event classes and their stored type names,
 * together with the revision new events are written at.
 */
public final class EventTypeTable<E> {

    private record Entry(String type, Class<?> eventClass, int revision) {}

    private final Map<String, Entry> byType;
    private final Map<Class<?>, Entry> byClass;

    private EventTypeTable(Map<String, Entry> byType, Map<Class<?>, Entry> byClass) {
        this.byType = Map.copyOf(byType);
        this.byClass = Map.copyOf(byClass);
    }

    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    public String typeOf(E event) {
        return entryFor(event).type();
    }

    public int revisionOf(E event) {
        return entryFor(event).revision();
    }

    @SuppressWarnings("unchecked")
    public Class<? extends E> classOf(String eventType) {
        Entry e = byType.get(eventType);
        if (e == null) {
            throw new IllegalArgumentException("Unknown event type " + eventType);
        }
        return (Class<? extends E>) e.eventClass();
    }

    public boolean knows(String eventType) {
        return byType.containsKey(eventType);
    }

    public Set<String> types() {
        return byType.keySet();
    }

    private Entry entryFor(E event) {
        Entry e = byClass.get(event.getClass());
        if (e == null) {
            throw new IllegalArgumentException("Unregistered event class " + event.getClass().getName());
        }
        return e;
    }

    public static final class Builder<E> {
        private final Map<String, Entry> byType = new LinkedHashMap<>();
        private final Map<Class<?>, Entry> byClass = new LinkedHashMap<>();

        public Builder<E> register(String type, Class<? extends E> eventClass) {
            return register(type, eventClass, 1);
        }

        public Builder<E> register(String type, Class<? extends E> eventClass, int revision) {
            Entry entry = new Entry(type, eventClass, revision);
            if (byType.putIfAbsent(type, entry) != null) {
                throw new IllegalStateException("Duplicate event type " + type);
            }
            if (byClass.putIfAbsent(eventClass, entry) != null) {
                throw new IllegalStateException("Event class registered twice " + eventClass.getName());
            }
            return this;
        }

        public EventTypeTable<E> build() {
            return new EventTypeTable<>(byType, byClass);
        }
    }
}
