package com.questrail.fathom.protocol.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Language identifier carried by an {@code execute} request.
 *
 * <p>The set of languages is open on the wire. Whether a language can actually be
 * executed is a responder capability, so an unfamiliar name is not a decode
 * error; the responder answers it with {@code LANGUAGE_NOT_SUPPORTED}.</p>
 *
 * <p>Names are normalized to lower case.</p>
 */
public record Language(String name)
{
    public static final Language PYTHON = new Language("python");
    public static final Language JAVASCRIPT = new Language("javascript");
    public static final Language TYPESCRIPT = new Language("typescript");
    public static final Language BASH = new Language("bash");
    public static final Language RUBY = new Language("ruby");
    public static final Language GO = new Language("go");
    public static final Language RUST = new Language("rust");
    public static final Language JAVA = new Language("java");

    public Language {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("language must not be blank");
        }
    }

    public static Language of(String name) {
        return new Language(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
