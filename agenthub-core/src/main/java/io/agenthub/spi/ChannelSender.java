package io.agenthub.spi;

import io.agenthub.translate.ChannelPayload;

/**
 * Sends translated payloads into a room.
 */
@FunctionalInterface
public interface ChannelSender {

    /**
     * Sends a payload.
     *
     * <p>The transaction id is stable across retries of the same delivery so that
     * servers which deduplicate by transaction id (Matrix does) post the event once.
     *
     * @param roomId        target room
     * @param payload       the payload in channel format
     * @param transactionId idempotency key, the delivery id
     * @return the event id assigned by the channel server
     * @throws CollaboratorException if sending failed
     */
    String send(String roomId, ChannelPayload payload, String transactionId) throws CollaboratorException;
}
