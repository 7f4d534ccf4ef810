package io.agenthub.spring.boot;

import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.translate.ChannelPayload;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process channel standing in for a Matrix homeserver.
 */
class TestChannel implements ChannelProvisioner, ChannelSender {
    final AtomicInteger rooms = new AtomicInteger();
    final AtomicInteger sends = new AtomicInteger();

    @Override
    public String createRoom(String name) {
        return "!room" + rooms.incrementAndGet() + ":hub.test";
    }

    @Override
    public String send(String roomId, ChannelPayload payload, String transactionId) {
        return "$event" + sends.incrementAndGet();
    }
}
