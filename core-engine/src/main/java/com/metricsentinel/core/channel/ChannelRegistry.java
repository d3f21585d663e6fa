package com.metricsentinel.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Channel adapters by name.
 *
 * @since 1.0.0
 */
public final class ChannelRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, NotificationChannel> channels;

    private ChannelRegistry(Map<String, NotificationChannel> channels) {
        this.channels = Collections.unmodifiableMap(channels);
    }

    public static ChannelRegistry of(NotificationChannel... channels) {
        Map<String, NotificationChannel> byName = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            Objects.requireNonNull(channel, "channel must not be null");
            String name = channel.name().toLowerCase(Locale.ROOT);
            if (byName.putIfAbsent(name, channel) != null) {
                throw new IllegalArgumentException("Duplicate channel adapter: " + name);
            }
        }
        LOG.info("Registered channel adapter(s): {}", byName.keySet());
        return new ChannelRegistry(byName);
    }

    public Optional<NotificationChannel> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(channels.get(name.toLowerCase(Locale.ROOT)));
    }

    public Set<String> names() {
        return channels.keySet();
    }
}
