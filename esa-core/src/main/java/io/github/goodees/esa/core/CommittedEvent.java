package io.github.goodees.esa.core;

/*-
 * #%L
 * esa
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.Objects;

/**
 * Event as read from a store.
 *
 * <p>A store that cannot deserialize a stored event may still deliver it as {@link #unreadable(AggregateEventMetadata)
 * unreadable}, so that its version is accounted for by readers.
 */
public final class CommittedEvent {
    private final AggregateEvent<?> event;
    private final AggregateEventMetadata metadata;

    public CommittedEvent(AggregateEvent<?> event, AggregateEventMetadata metadata) {
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
    }

    private CommittedEvent(AggregateEventMetadata metadata) {
        this.event = null;
        this.metadata = Objects.requireNonNull(metadata, "Metadata cannot be null");
    }

    public static CommittedEvent of(UncommittedEvent event) {
        return new CommittedEvent(event.getEvent(), event.getMetadata());
    }

    /**
     * Stored event whose payload type is not known to the reader.
     * @param metadata metadata of the stored event
     * @return event without payload
     */
    public static CommittedEvent unreadable(AggregateEventMetadata metadata) {
        return new CommittedEvent(metadata);
    }

    public boolean isReadable() {
        return event != null;
    }

    /**
     * @return the event payload
     * @throws IllegalStateException when the event is not readable
     */
    public AggregateEvent<?> getEvent() {
        if (event == null) {
            throw new IllegalStateException("Event " + metadata.getEventTypeName() + " v"
                    + metadata.getEventTypeVersion() + " at version " + metadata.getAggregateVersion()
                    + " of " + metadata.getAggregateId() + " is not readable");
        }
        return event;
    }

    public AggregateEventMetadata getMetadata() {
        return metadata;
    }

    public long getAggregateVersion() {
        return metadata.getAggregateVersion();
    }

    @Override
    public String toString() {
        return "CommittedEvent{" + metadata.getAggregateId() + " v" + metadata.getAggregateVersion() + ": "
                + (event == null ? "<unreadable " + metadata.getEventTypeName() + ">" : event) + "}";
    }
}
