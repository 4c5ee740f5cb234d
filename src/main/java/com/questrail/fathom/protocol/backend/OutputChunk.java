package com.questrail.fathom.protocol.backend;

import com.questrail.fathom.protocol.model.OutputChannel;

import java.util.Objects;

/**
 * One piece of program output, or the end-of-stream marker.
 */
public final class OutputChunk
{
    private static final OutputChunk END_OF_STREAM = new OutputChunk(null, null);

    private final OutputChannel channel;
    private final String data;

    private OutputChunk(OutputChannel channel, String data) {
        this.channel = channel;
        this.data = data;
    }

    public static OutputChunk of(OutputChannel channel, String data) {
        return new OutputChunk(Objects.requireNonNull(channel, "channel"), Objects.requireNonNull(data, "data"));
    }

    public static OutputChunk stdout(String data) {
        return of(OutputChannel.STDOUT, data);
    }

    public static OutputChunk stderr(String data) {
        return of(OutputChannel.STDERR, data);
    }

    public static OutputChunk endOfStream() {
        return END_OF_STREAM;
    }

    public boolean isEndOfStream() {
        return this == END_OF_STREAM;
    }

    /**
     * @throws IllegalStateException on the end-of-stream marker
     */
    public OutputChannel channel() {
        if (isEndOfStream()) {
            throw new IllegalStateException("end of stream has no channel");
        }
        return channel;
    }

    /**
     * @throws IllegalStateException on the end-of-stream marker
     */
    public String data() {
        if (isEndOfStream()) {
            throw new IllegalStateException("end of stream has no data");
        }
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OutputChunk other)) {
            return false;
        }
        return channel == other.channel && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, data);
    }

    @Override
    public String toString() {
        return isEndOfStream() ? "OutputChunk[EOF]" : "OutputChunk[" + channel + ", " + data.length() + " chars]";
    }
}
