/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Conduit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.conduit.bridge.subscription;

import com.hellblazer.conduit.engine.PropertyType;
import com.hellblazer.conduit.resource.Handle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Client side of property subscriptions: maps (handle, property path, property type) to the broadcast of that
 * property's changes. Updates are published and delivered by the polling thread. A key disappears when its last
 * subscription is closed, or when its instance is dropped.
 * <p>
 * A subscription made with {@link #subscribePending} ignores updates until it is {@link #activate activated}, so it
 * only sees changes reported after the point its activation marks in the message stream.
 *
 * @author hal.hildebrand
 */
public class SubscriptionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConcurrentHashMap<Key, Broadcast<PropertyUpdate>> topics  = new ConcurrentHashMap<>();
    private final List<Broadcast<PropertyUpdate>>                   retired = new CopyOnWriteArrayList<>();
    private final int                                               capacity;
    private final Consumer<PropertySubscription>                    onUnsubscribe;

    record Key(Handle handle, String path, PropertyType type) {
    }

    /**
     * @param capacity buffer size of every subscription
     */
    public SubscriptionRegistry(int capacity) {
        this(capacity, subscription -> {
        });
    }

    /**
     * @param capacity      buffer size of every subscription
     * @param onUnsubscribe told of every subscription closed by its holder
     */
    public SubscriptionRegistry(int capacity, Consumer<PropertySubscription> onUnsubscribe) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.onUnsubscribe = Objects.requireNonNull(onUnsubscribe, "onUnsubscribe");
    }

    public PropertySubscription subscribe(Handle handle, String path, PropertyType type) {
        return subscribe(handle, path, type, null);
    }

    /**
     * Subscribe to changes of a value property
     *
     * @param listener invoked with each update at the end of a poll, or null to consume by pulling
     */
    public PropertySubscription subscribe(Handle handle, String path, PropertyType type,
                                          BroadcastListener<PropertyUpdate> listener) {
        return register(handle, path, type, listener, true);
    }

    /**
     * Subscribe with a subscription that ignores updates until it is activated
     */
    public PropertySubscription subscribePending(Handle handle, String path, PropertyType type,
                                                 BroadcastListener<PropertyUpdate> listener) {
        return register(handle, path, type, listener, false);
    }

    public void activate(PropertySubscription subscription) {
        if (!subscription.isClosed()) {
            subscription.receiver().activate();
        }
    }

    private PropertySubscription register(Handle handle, String path, PropertyType type,
                                          BroadcastListener<PropertyUpdate> listener, boolean active) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(path, "path");
        if (!type.isValue()) {
            throw new IllegalArgumentException("Only value properties can be subscribed to, not " + type);
        }
        var key = new Key(handle, path, type);
        var subscription = new PropertySubscription[1];
        topics.compute(key, (k, broadcast) -> {
            var topic = broadcast == null ? new Broadcast<PropertyUpdate>(k.handle() + "/" + k.path(), capacity)
                                          : broadcast;
            subscription[0] = new PropertySubscription(this, k, topic.subscribe(listener, active));
            return topic;
        });
        log.debug("Subscribed to {} {} ({})", handle, path, type);
        return subscription[0];
    }

    public void unsubscribe(PropertySubscription subscription) {
        var receiver = subscription.receiver();
        if (receiver.isClosed()) {
            return;
        }
        topics.computeIfPresent(subscription.key(), (k, broadcast) -> {
            receiver.close();
            return broadcast.getReceiverCount() == 0 ? null : broadcast;
        });
        receiver.close();
        onUnsubscribe.accept(subscription);
    }

    /**
     * Retire every subscription of an instance that no longer exists. Updates already buffered are still handed to
     * listeners by the next {@link #deliver()}, which then closes the subscriptions.
     *
     * @return the number of properties retired
     */
    public int dropInstance(Handle instance) {
        int dropped = 0;
        for (var key : topics.keySet()) {
            if (key.handle().equals(instance)) {
                var topic = topics.remove(key);
                if (topic != null) {
                    retired.add(topic);
                    dropped++;
                }
            }
        }
        log.debug("Dropped {} subscribed properties of {}", dropped, instance);
        return dropped;
    }

    public boolean isSubscribed(Handle handle, String path, PropertyType type) {
        return topics.containsKey(new Key(handle, path, type));
    }

    /**
     * Fan an update out to every subscription of its property
     *
     * @return false if nobody subscribes to the property any more
     */
    public boolean publish(PropertyUpdate update) {
        var topic = topics.get(new Key(update.instance(), update.path(), update.value().type()));
        if (topic == null) {
            return false;
        }
        topic.emit(update);
        return true;
    }

    /**
     * Invoke subscription listeners with their buffered updates
     */
    public void deliver() {
        for (var topic : topics.values()) {
            topic.deliver();
        }
        for (var topic : retired) {
            topic.deliver();
            topic.closeAll();
            retired.remove(topic);
        }
    }

    /**
     * Number of distinct subscribed properties
     */
    public int size() {
        return topics.size();
    }

    /**
     * Close every subscription
     */
    public void clear() {
        for (var topic : topics.values()) {
            topic.closeAll();
        }
        topics.clear();
        for (var topic : retired) {
            topic.closeAll();
        }
        retired.clear();
    }
}
