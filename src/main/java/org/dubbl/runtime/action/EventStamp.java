package org.dubbl.runtime.action;

/**
 * Identity and time assigned to an event when it is created.
 *
 * @param eventId   Unique event id.
 * @param timestamp Epoch milliseconds.
 */
public record EventStamp(String eventId, long timestamp) {}
