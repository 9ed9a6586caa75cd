package com.github.raff.webhook.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Commerce platforms that deliver webhooks. */
public enum Platform {
    SALLA("salla"),
    ZID("zid");

    private final String path;

    private static final Map<String, Platform> LOOKUP =
            Arrays.stream(values())
                    .collect(Collectors.toUnmodifiableMap(Platform::path, Function.identity()));

    Platform(String path) {
        this.path = path;
    }

    /** Lower-case name used in URLs and hashed keys. */
    public String path() {
        return path;
    }

    public static Optional<Platform> fromPath(String value) {
        if (value == null) return Optional.empty();
        return Optional.ofNullable(LOOKUP.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
