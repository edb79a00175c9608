package org.driptable.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "drip-table")
public record DripTableProperties(
        @DefaultValue Validation validation,
        @DefaultValue Subtable subtable,
        @DefaultValue Virtual virtual,
        @DefaultValue Instances instances
) {

    public static DripTableProperties defaults() {
        return new DripTableProperties(
                new Validation(true, true, 1_000),
                new Subtable(8),
                new Virtual(300, 48, 5),
                new Instances(Duration.ofMinutes(30), 10_000)
        );
    }

    public record Validation(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("true") boolean additionalProperties,
            @DefaultValue("1000") long cacheSize
    ) {
    }

    public record Subtable(
            @DefaultValue("8") int maxDepth
    ) {
    }

    public record Virtual(
            @DefaultValue("300") int defaultScrollY,
            @DefaultValue("48") int rowHeight,
            @DefaultValue("5") int overscan
    ) {
    }

    /**
     * Mounted table instances not rendered or interacted with for {@code idleTimeout} are
     * dropped, as are the least recently used ones beyond {@code maxInstances}.
     */
    public record Instances(
            @DefaultValue("30m") Duration idleTimeout,
            @DefaultValue("10000") long maxInstances
    ) {
    }
}
