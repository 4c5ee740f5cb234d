package com.questrail.fathom.protocol.model;

/**
 * Stream direction of an output chunk.
 *
 * <p>Chunks within one channel are appended in order. No ordering is implied
 * between the two channels.</p>
 */
public enum OutputChannel {
    STDOUT(MessageType.STDOUT),
    STDERR(MessageType.STDERR);

    private final MessageType messageType;

    OutputChannel(MessageType messageType) {
        this.messageType = messageType;
    }

    /**
     * The message type used to carry chunks of this channel.
     */
    public MessageType messageType() {
        return messageType;
    }

    public static OutputChannel of(MessageType type) {
        return switch (type) {
            case STDOUT -> STDOUT;
            case STDERR -> STDERR;
            default -> throw new IllegalArgumentException("Not an output message type: " + type);
        };
    }
}
