package io.trading.advstream.client;

import io.trading.advstream.protocol.model.Channel;
import io.trading.advstream.protocol.model.EndpointKind;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the active subscriptions per endpoint so they can be replayed after a reconnect.
 *
 * Entries are keyed by (endpoint, channel) and hold an insertion-ordered set of product ids.
 * Updates to one entry are serialized through {@link ConcurrentHashMap#compute}; endpoints
 * have separate maps and never contend with each other.
 */
public class SubscriptionRegistry {

    private final Map<EndpointKind, ConcurrentHashMap<Channel, Set<String>>> entries =
        new EnumMap<>(EndpointKind.class);

    public SubscriptionRegistry() {
        for (EndpointKind kind : EndpointKind.values()) {
            entries.put(kind, new ConcurrentHashMap<>());
        }
    }

    /**
     * Adds product ids to an entry, creating it if needed (also for an empty list).
     */
    public void add(EndpointKind endpoint, Channel channel, Collection<String> productIds) {
        entries.get(endpoint).compute(channel, (key, current) -> {
            Set<String> updated = current == null ? new LinkedHashSet<>() : new LinkedHashSet<>(current);
            updated.addAll(productIds);
            return Collections.unmodifiableSet(updated);
        });
    }

    /**
     * Removes the named product ids from an entry. The entry itself is kept, even when it
     * becomes empty; unknown ids and missing entries are ignored.
     */
    public void remove(EndpointKind endpoint, Channel channel, Collection<String> productIds) {
        entries.get(endpoint).computeIfPresent(channel, (key, current) -> {
            Set<String> updated = new LinkedHashSet<>(current);
            updated.removeAll(productIds);
            return Collections.unmodifiableSet(updated);
        });
    }

    /**
     * Returns an immutable copy of one endpoint's entries, in channel order.
     */
    public Map<Channel, List<String>> snapshot(EndpointKind endpoint) {
        Map<Channel, List<String>> copy = new EnumMap<>(Channel.class);
        entries.get(endpoint).forEach((channel, productIds) -> copy.put(channel, List.copyOf(productIds)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Total number of product ids subscribed on an endpoint.
     */
    public int size(EndpointKind endpoint) {
        int total = 0;
        for (Set<String> productIds : entries.get(endpoint).values()) {
            total += productIds.size();
        }
        return total;
    }
}
