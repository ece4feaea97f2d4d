package com.appmonitor.collector.model;

import java.util.EnumMap;

/**
 * Mutable per-channel counter for first-time downloads.
 */
public class ChannelCounts {

    private final EnumMap<DownloadChannel, Long> counts = new EnumMap<>(DownloadChannel.class);

    public ChannelCounts() {
        for (DownloadChannel channel : DownloadChannel.values()) {
            counts.put(channel, 0L);
        }
    }

    public void add(DownloadChannel channel, long amount) {
        counts.merge(channel, amount, Long::sum);
    }

    public long get(DownloadChannel channel) {
        return counts.get(channel);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
