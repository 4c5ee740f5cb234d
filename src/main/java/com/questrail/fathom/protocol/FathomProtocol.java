package com.questrail.fathom.protocol;

import java.util.Set;

/**
 * FathomProtocol
 * -----------------------------------------------------------------------------
 * Protocol-wide constants shared by both connection roles.
 */
public final class FathomProtocol
{
    /** Protocol version spoken by this engine. */
    public static final int CURRENT_VERSION = 1;

    /** Versions a responder accepts unless configured otherwise. */
    public static final Set<Integer> SUPPORTED_VERSIONS = Set.of(CURRENT_VERSION);

    /** Output budget applied when a request carries no explicit {@code max_output_bytes}. */
    public static final long DEFAULT_MAX_OUTPUT_BYTES = 1024L * 1024L;

    /** Upper bound for a single newline-delimited frame on the transport. */
    public static final int DEFAULT_MAX_FRAME_BYTES = 4 * 1024 * 1024;

    private FathomProtocol() {}
}
