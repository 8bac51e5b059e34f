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

import java.util.List;

/**
 * A standing registration for changes of one property of one bindable instance. Closing it unsubscribes.
 *
 * @author hal.hildebrand
 */
public class PropertySubscription implements AutoCloseable {
    private final SubscriptionRegistry             registry;
    private final SubscriptionRegistry.Key         key;
    private final BroadcastReceiver<PropertyUpdate> receiver;

    PropertySubscription(SubscriptionRegistry registry, SubscriptionRegistry.Key key,
                         BroadcastReceiver<PropertyUpdate> receiver) {
        this.registry = registry;
        this.key = key;
        this.receiver = receiver;
    }

    public Handle getHandle() {
        return key.handle();
    }

    public String getPath() {
        return key.path();
    }

    public PropertyType getPropertyType() {
        return key.type();
    }

    public PropertyUpdate poll() {
        return receiver.poll();
    }

    public List<PropertyUpdate> drain() {
        return receiver.drain();
    }

    public long getDroppedCount() {
        return receiver.getDroppedCount();
    }

    /**
     * Whether updates are being received; a subscription made through a command queue becomes active once the
     * command server has registered it
     */
    public boolean isActive() {
        return receiver.isActive();
    }

    public boolean isClosed() {
        return receiver.isClosed();
    }

    @Override
    public void close() {
        registry.unsubscribe(this);
    }

    SubscriptionRegistry.Key key() {
        return key;
    }

    BroadcastReceiver<PropertyUpdate> receiver() {
        return receiver;
    }

    @Override
    public String toString() {
        return "PropertySubscription[" + key.handle() + " " + key.path() + " : " + key.type() + "]";
    }
}
