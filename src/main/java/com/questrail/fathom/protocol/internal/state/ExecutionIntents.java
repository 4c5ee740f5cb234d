package com.questrail.fathom.protocol.internal.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * ExecutionIntents
 * -----------------------------------------------------------------------------
 * Ordered, immutable list of {@link ExecutionIntent}s produced by one reducer step.
 *
 * <h2>Ordering</h2>
 * Unlike a set of flags, order matters here: the responder must emit
 * {@code error} before {@code status} before {@code result}, and eviction always
 * comes last. Executors carry intents out in list order.
 */
public final class ExecutionIntents
{
    private static final ExecutionIntents NONE = new ExecutionIntents(List.of());

    private final List<ExecutionIntent> intents;

    private ExecutionIntents(List<ExecutionIntent> intents) {
        this.intents = Collections.unmodifiableList(new ArrayList<>(intents));
    }

    public static ExecutionIntents none() {
        return NONE;
    }

    public static ExecutionIntents of(ExecutionIntent... intents) {
        return intents.length == 0 ? NONE : new ExecutionIntents(List.of(intents));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ExecutionIntent> asList() {
        return intents;
    }

    public boolean isEmpty() {
        return intents.isEmpty();
    }

    /**
     * Kinds in emission order; handy for assertions.
     */
    public List<ExecutionIntent.Kind> kinds() {
        return intents.stream().map(ExecutionIntent::kind).collect(Collectors.toUnmodifiableList());
    }

    public boolean contains(ExecutionIntent.Kind kind) {
        return intents.stream().anyMatch(i -> i.kind() == kind);
    }

    /**
     * First intent of the given type, if any.
     */
    public <I extends ExecutionIntent> Optional<I> first(Class<I> type) {
        return intents.stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    /**
     * Concatenates two intent lists, this one first.
     */
    public ExecutionIntents and(ExecutionIntents other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        List<ExecutionIntent> merged = new ArrayList<>(intents);
        merged.addAll(other.intents);
        return new ExecutionIntents(merged);
    }

    @Override
    public String toString() {
        return "ExecutionIntents" + kinds();
    }

    public static final class Builder {
        private final List<ExecutionIntent> intents = new ArrayList<>();

        private Builder() {}

        public Builder add(ExecutionIntent intent) {
            intents.add(intent);
            return this;
        }

        public ExecutionIntents build() {
            return intents.isEmpty() ? NONE : new ExecutionIntents(intents);
        }
    }
}
