/**
 * Room lifecycle: scope keys per {@link io.agenthub.room.RoomPolicy} and single
 * creation of channel rooms under concurrent first use.
 */
package io.agenthub.room;
