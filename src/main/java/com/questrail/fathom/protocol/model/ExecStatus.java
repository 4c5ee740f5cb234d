package com.questrail.fathom.protocol.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle status of one execution.
 *
 * <pre>
 *   PENDING -> RUNNING -> { COMPLETED, FAILED, CANCELLED, TIMEOUT, OOM }
 * </pre>
 *
 * {@code PENDING} and {@code RUNNING} are the only non-terminal values. A
 * terminal status is never left once entered. {@code PENDING} is an internal
 * status and never appears in a {@code status} message.
 */
public enum ExecStatus {
    PENDING(null, false),
    RUNNING("running", false),
    COMPLETED("completed", true),
    FAILED("failed", true),
    CANCELLED("cancelled", true),
    TIMEOUT("timeout", true),
    OOM("oom", true);

    private final String wireName;
    private final boolean terminal;

    ExecStatus(String wireName, boolean terminal) {
        this.wireName = wireName;
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Wire representation used by {@code status} messages.
     *
     * @throws IllegalStateException for {@link #PENDING}, which is never sent
     */
    public String wireName() {
        if (wireName == null) {
            throw new IllegalStateException(name() + " has no wire representation");
        }
        return wireName;
    }

    public static Optional<ExecStatus> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(s -> s.wireName != null && s.wireName.equals(wireName))
                .findFirst();
    }
}
