package com.myorg.cafe.eventstore.aggregate;

import com.myorg.cafe.eventstore.exception.InvalidStateTransitionException;

import java.util.List;

/**
 * Minimal aggregate for engine tests: open a tally, add to it, close it.
 */
class TallyDefinition implements AggregateDefinition<TallyDefinition.Tally, TallyDefinition.TallyCommand, TallyDefinition.TallyEvent> {

    public record Tally(String id, int total, boolean closed) {}

    public sealed interface TallyCommand {
        String id();
    }
    public record Open(String id) implements TallyCommand {}
    public record Add(String id, int amount) implements TallyCommand {}
    public record Close(String id) implements TallyCommand {}

    public sealed interface TallyEvent {}
    public record Opened(String id) implements TallyEvent {}
    public record Added(String id, int amount) implements TallyEvent {}
    public record Closed(String id) implements TallyEvent {}

    private static final EventTypeTable<TallyEvent> TYPES = EventTypeTable.<TallyEvent>builder()
            .register("test.tally.opened", Opened.class)
            .register("test.tally.added", Added.class, 2)
            .register("test.tally.closed", Closed.class)
            .build();

    @Override
    public String aggregateType() {
        return "tally";
    }

    @Override
    public Tally initialState() {
        return new Tally(null, 0, false);
    }

    @Override
    public Class<Tally> stateClass() {
        return Tally.class;
    }

    @Override
    public EventTypeTable<TallyEvent> eventTypes() {
        return TYPES;
    }

    @Override
    public Tally reduce(Tally s, TallyEvent e) {
        if (e instanceof Opened o) return new Tally(o.id(), 0, false);
        if (e instanceof Added a) return new Tally(s.id(), s.total() + a.amount(), s.closed());
        if (e instanceof Closed) return new Tally(s.id(), s.total(), true);
        throw new IllegalArgumentException(e.toString());
    }

    @Override
    public List<TallyEvent> handle(AggregateState<Tally> current, TallyCommand command) {
        Tally s = current.state();
        if (command instanceof Open o) return List.of(new Opened(o.id()));
        if (s.closed()) {
            throw new InvalidStateTransitionException(command.getClass().getSimpleName(), "CLOSED", "tally is closed");
        }
        if (command instanceof Add a) return a.amount() == 0 ? List.of() : List.of(new Added(a.id(), a.amount()));
        if (command instanceof Close c) return List.of(new Closed(c.id()));
        throw new IllegalArgumentException(command.toString());
    }

    @Override
    public String targetId(TallyCommand command) {
        return command.id();
    }

    @Override
    public boolean isCreation(TallyCommand command) {
        return command instanceof Open;
    }
}
