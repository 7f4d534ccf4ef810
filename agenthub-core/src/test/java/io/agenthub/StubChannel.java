package io.agenthub;

import io.agenthub.spi.ChannelProvisioner;
import io.agenthub.spi.ChannelSender;
import io.agenthub.spi.CollaboratorException;
import io.agenthub.translate.ChannelPayload;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process channel that records created rooms and sent payloads. Failures can be
 * scripted: the next N calls of each kind throw a transient {@link CollaboratorException}.
 */
public class StubChannel implements ChannelProvisioner, ChannelSender {

    public final List<String> createdRooms = new CopyOnWriteArrayList<>();
    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final AtomicInteger createCalls = new AtomicInteger();
    public final AtomicInteger sendCalls = new AtomicInteger();

    private final AtomicInteger createFailures = new AtomicInteger();
    private final AtomicInteger sendFailures = new AtomicInteger();
    private volatile boolean sendPermanentFailure;
    private volatile long createDelayMs;
    private volatile long sendDelayMs;

    public StubChannel failNextCreates(int count) {
        createFailures.set(count);
        return this;
    }

    public StubChannel failNextSends(int count) {
        sendFailures.set(count);
        return this;
    }

    public StubChannel rejectSends() {
        sendPermanentFailure = true;
        return this;
    }

    public StubChannel createDelayMs(long delayMs) {
        this.createDelayMs = delayMs;
        return this;
    }

    public StubChannel sendDelayMs(long delayMs) {
        this.sendDelayMs = delayMs;
        return this;
    }

    @Override
    public String createRoom(String name) throws CollaboratorException {
        int call = createCalls.incrementAndGet();
        pause(createDelayMs);
        if (createFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new CollaboratorException("createRoom unavailable");
        }
        String roomId = "!room" + call + ":hub.test";
        createdRooms.add(roomId);
        return roomId;
    }

    @Override
    public String send(String roomId, ChannelPayload payload, String transactionId) throws CollaboratorException {
        int call = sendCalls.incrementAndGet();
        pause(sendDelayMs);
        if (sendPermanentFailure) {
            throw CollaboratorException.permanent("forbidden");
        }
        if (sendFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new CollaboratorException("send unavailable");
        }
        sent.add(new Sent(roomId, payload, transactionId));
        return "$event" + call;
    }

    private static void pause(long delayMs) throws CollaboratorException {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("interrupted", e);
        }
    }

    public record Sent(String roomId, ChannelPayload payload, String transactionId) {}
}
