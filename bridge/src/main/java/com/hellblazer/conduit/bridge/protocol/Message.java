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
package com.hellblazer.conduit.bridge.protocol;

import com.hellblazer.conduit.bridge.ErrorKind;
import com.hellblazer.conduit.engine.EnumDefinition;
import com.hellblazer.conduit.engine.PropertyDescriptor;
import com.hellblazer.conduit.engine.PropertyValue;
import com.hellblazer.conduit.resource.Handle;

import java.util.List;
import java.util.Objects;

/**
 * A result or event produced by the command server and consumed by the client's poll. Answers carry the id of the
 * request they answer; unsolicited messages carry request id 0 and the handle they originate from.
 *
 * @author hal.hildebrand
 */
public interface Message {

    MessageType type();

    long requestId();

    /**
     * A native object was created and registered under {@code handle}
     */
    record Created(long requestId, Handle handle) implements Message {
        @Override
        public MessageType type() {
            return MessageType.CREATED;
        }
    }

    record Names(long requestId, Handle subject, List<String> names) implements Message {
        public Names {
            names = List.copyOf(names);
        }

        @Override
        public MessageType type() {
            return MessageType.NAMES;
        }
    }

    record Descriptors(long requestId, Handle subject, List<PropertyDescriptor> descriptors) implements Message {
        public Descriptors {
            descriptors = List.copyOf(descriptors);
        }

        @Override
        public MessageType type() {
            return MessageType.DESCRIPTORS;
        }
    }

    record Enums(long requestId, Handle subject, List<EnumDefinition> enums) implements Message {
        public Enums {
            enums = List.copyOf(enums);
        }

        @Override
        public MessageType type() {
            return MessageType.ENUMS;
        }
    }

    /**
     * Value of a property or state machine input
     */
    record Value(long requestId, Handle subject, String path, PropertyValue value) implements Message {
        @Override
        public MessageType type() {
            return MessageType.VALUE;
        }
    }

    record Count(long requestId, Handle subject, int count) implements Message {
        @Override
        public MessageType type() {
            return MessageType.COUNT;
        }
    }

    /**
     * Copy of a surface's contents, RGBA
     */
    record Pixels(long requestId, Handle surface, int width, int height, byte[] rgba) implements Message {
        public Pixels {
            rgba = rgba.clone();
        }

        @Override
        public byte[] rgba() {
            return rgba.clone();
        }

        @Override
        public MessageType type() {
            return MessageType.PIXELS;
        }
    }

    /**
     * A draw command finished; one per command however many operations it carried
     */
    record Drawn(long requestId, Handle drawKey, Handle surface, int operationCount) implements Message {
        @Override
        public MessageType type() {
            return MessageType.DRAWN;
        }
    }

    /**
     * A request without a result value succeeded
     */
    record Completed(long requestId, Handle subject) implements Message {
        @Override
        public MessageType type() {
            return MessageType.COMPLETED;
        }
    }

    /**
     * A command failed. Carries request id 0 when the command was fire-and-forget.
     *
     * @param origin  type of the failed command, null if the command carried no usable tag
     * @param subject the handle the failure concerns, may be null
     */
    record Failure(long requestId, CommandType origin, ErrorKind kind, Handle subject, String detail)
    implements Message {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public MessageType type() {
            return MessageType.ERROR;
        }
    }

    /**
     * A state machine settled after being advanced
     */
    record Settled(Handle stateMachine) implements Message {
        @Override
        public long requestId() {
            return 0;
        }

        @Override
        public MessageType type() {
            return MessageType.SETTLED;
        }
    }

    /**
     * A subscribed property changed; carries the value read back after the mutation
     */
    record PropertyChanged(Handle instance, String path, PropertyValue value) implements Message {
        @Override
        public long requestId() {
            return 0;
        }

        @Override
        public MessageType type() {
            return MessageType.PROPERTY_CHANGED;
        }
    }

    /**
     * A deleted instance took its property subscriptions with it; no further changes are reported for it
     */
    record SubscriptionsDropped(Handle instance) implements Message {
        @Override
        public long requestId() {
            return 0;
        }

        @Override
        public MessageType type() {
            return MessageType.SUBSCRIPTIONS_DROPPED;
        }
    }
}
