package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;

/**
 * One delivery target of an alert rule: a channel name and the
 * channel-specific destination (webhook URL, e-mail address, ...).
 *
 * @since 1.0.0
 */
public class ChannelTarget implements Serializable {

    private static final long serialVersionUID = 1L;

    private String channel;
    private String destination;

    public ChannelTarget() {
    }

    public ChannelTarget(String channel, String destination) {
        setChannel(channel);
        this.destination = destination;
    }

    public String getChannel() {
        return channel;
    }

    /**
     * Set the channel name, normalised to lowercase.
     *
     * @param channel channel name such as {@code slack}
     */
    public void setChannel(String channel) {
        this.channel = channel != null ? channel.trim().toLowerCase(Locale.ROOT) : null;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ChannelTarget that))
            return false;
        return Objects.equals(channel, that.channel) && Objects.equals(destination, that.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, destination);
    }

    @Override
    public String toString() {
        return channel + "->" + destination;
    }
}
