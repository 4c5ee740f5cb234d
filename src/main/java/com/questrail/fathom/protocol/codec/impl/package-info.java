/**
 * JSON implementation of the envelope codec.
 *
 * <p>Every message is one JSON object: {@code v}, {@code type}, optional
 * {@code id}, {@code ts} and a type-specific {@code payload} object. Timestamps
 * are written as UTC ISO-8601 with millisecond precision and accepted with any
 * offset.</p>
 */
package com.questrail.fathom.protocol.codec.impl;
