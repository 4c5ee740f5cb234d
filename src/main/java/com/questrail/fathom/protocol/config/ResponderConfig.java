package com.questrail.fathom.protocol.config;

import com.questrail.fathom.protocol.FathomProtocol;
import com.questrail.fathom.protocol.model.Language;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Responder policy: what it speaks, what it runs and how much at once.
 */
public record ResponderConfig(
        Set<Integer> supportedVersions,
        Set<Language> supportedLanguages,
        LimitBounds limitBounds,
        int maxConcurrentExecutions,
        int maxFrameBytes
) {
    public ResponderConfig {
        supportedVersions = Set.copyOf(Objects.requireNonNull(supportedVersions, "supportedVersions"));
        supportedLanguages = Set.copyOf(Objects.requireNonNull(supportedLanguages, "supportedLanguages"));
        Objects.requireNonNull(limitBounds, "limitBounds");
        if (supportedVersions.isEmpty()) {
            throw new IllegalArgumentException("at least one protocol version is required");
        }
        if (maxConcurrentExecutions <= 0) {
            throw new IllegalArgumentException("maxConcurrentExecutions must be positive");
        }
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
    }

    public static ResponderConfig defaults() {
        return builder().build();
    }

    public boolean supports(Language language) {
        return supportedLanguages.contains(language);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Set<Integer> supportedVersions = FathomProtocol.SUPPORTED_VERSIONS;
        private Set<Language> supportedLanguages = new LinkedHashSet<>(Arrays.asList(
                Language.PYTHON, Language.JAVASCRIPT, Language.TYPESCRIPT, Language.BASH));
        private LimitBounds limitBounds = LimitBounds.defaults();
        private int maxConcurrentExecutions = 64;
        private int maxFrameBytes = FathomProtocol.DEFAULT_MAX_FRAME_BYTES;

        public Builder withSupportedVersions(Set<Integer> versions) {
            this.supportedVersions = versions;
            return this;
        }

        public Builder withSupportedLanguages(Set<Language> languages) {
            this.supportedLanguages = languages;
            return this;
        }

        public Builder withSupportedLanguages(Language... languages) {
            this.supportedLanguages = new LinkedHashSet<>(Arrays.asList(languages));
            return this;
        }

        public Builder withLimitBounds(LimitBounds bounds) {
            this.limitBounds = bounds;
            return this;
        }

        public Builder withMaxConcurrentExecutions(int max) {
            this.maxConcurrentExecutions = max;
            return this;
        }

        public Builder withMaxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public ResponderConfig build() {
            return new ResponderConfig(supportedVersions, supportedLanguages, limitBounds,
                    maxConcurrentExecutions, maxFrameBytes);
        }
    }
}
