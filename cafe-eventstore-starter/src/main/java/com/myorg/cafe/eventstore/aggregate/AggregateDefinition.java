package com.myorg.cafe.eventstore.aggregate;

import java.util.List;

/**
 * Everything the engine needs to know about one aggregate type.
 *
 * @param <S> immutable state, serializable with Jackson for snapshots
 * @param <C> command
 * @param <E> event
 */
public interface AggregateDefinition<S, C, E> {

    String aggregateType();

    S initialState();

    Class<S> stateClass();

    EventTypeTable<E> eventTypes();

    /** Pure fold step. Must not read anything but its arguments. */
    S reduce(S state, E event);

    /**
     * Validates the command against the current state and returns the events it produces.
     *
     * @throws com.myorg.cafe.eventstore.exception.InvalidStateTransitionException when the state forbids it
     */
    List<E> handle(AggregateState<S> current, C command);

    String targetId(C command);

    boolean isCreation(C command);
}
