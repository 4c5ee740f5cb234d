package com.questrail.fathom.protocol.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ExecutionRequest
 * -----------------------------------------------------------------------------
 * Immutable description of one code execution.
 *
 * <p>Created by the initiator and carried by an {@code execute} message. The
 * environment map keeps insertion order so that the request encodes the same
 * way every time it is sent.</p>
 */
public final class ExecutionRequest
{
    private final ExecutionId id;
    private final Language language;
    private final String code;
    private final String stdin;
    private final Map<String, String> env;
    private final ResourceLimits limits;

    private ExecutionRequest(ExecutionId id,
                             Language language,
                             String code,
                             String stdin,
                             Map<String, String> env,
                             ResourceLimits limits) {
        this.id = Objects.requireNonNull(id, "id");
        this.language = Objects.requireNonNull(language, "language");
        this.code = Objects.requireNonNull(code, "code");
        this.stdin = stdin;
        this.env = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(env, "env")));
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public ExecutionId id() {
        return id;
    }

    public Language language() {
        return language;
    }

    public String code() {
        return code;
    }

    public Optional<String> stdin() {
        return Optional.ofNullable(stdin);
    }

    /**
     * Environment variables in the order they were supplied.
     */
    public Map<String, String> env() {
        return env;
    }

    public ResourceLimits limits() {
        return limits;
    }

    public static Builder builder(ExecutionId id) {
        return new Builder(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExecutionRequest other)) {
            return false;
        }
        return id.equals(other.id)
                && language.equals(other.language)
                && code.equals(other.code)
                && Objects.equals(stdin, other.stdin)
                && env.equals(other.env)
                && limits.equals(other.limits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, language, code, stdin, env, limits);
    }

    @Override
    public String toString() {
        return "ExecutionRequest[id=" + id + ", language=" + language
                + ", codeLength=" + code.length() + ", limits=" + limits + "]";
    }

    public static final class Builder {
        private final ExecutionId id;
        private Language language;
        private String code;
        private String stdin;
        private final Map<String, String> env = new LinkedHashMap<>();
        private ResourceLimits limits;

        private Builder(ExecutionId id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder stdin(String stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder env(String name, String value) {
            env.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder env(Map<String, String> variables) {
            variables.forEach(this::env);
            return this;
        }

        public Builder limits(ResourceLimits limits) {
            this.limits = limits;
            return this;
        }

        public ExecutionRequest build() {
            return new ExecutionRequest(id, language, code, stdin, env, limits);
        }
    }
}
