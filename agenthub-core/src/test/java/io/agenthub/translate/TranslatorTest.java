package io.agenthub.translate;

import io.agenthub.identity.IdentityRegistry;
import io.agenthub.identity.Initiator;
import io.agenthub.identity.RegistryIdentityResolver;
import io.agenthub.model.AuditEvent;
import io.agenthub.store.InMemoryRecordStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranslatorTest {

    private static final IdentityResolver DIRECTORY = new IdentityResolver() {
        private final Map<String, String> nativeToChannel = Map.of("ou_1", "@alice:hub.test");

        @Override
        public Optional<String> toChannelId(String nativeId) {
            return Optional.ofNullable(nativeToChannel.get(nativeId));
        }

        @Override
        public Optional<String> toNativeId(String channelId) {
            return nativeToChannel.entrySet().stream()
                .filter(e -> e.getValue().equals(channelId))
                .map(Map.Entry::getKey)
                .findFirst();
        }
    };

    private final Translator translator = new Translator(DIRECTORY);

    // ── IM to channel ────────────────────────────────────────────

    @Test
    void plainTextIsLossless() {
        Translation<ChannelPayload> result = translator.toChannelFormat(NativeMessage.text(null, "hello"));

        assertTrue(result.isLossless());
        assertEquals("m.text", result.value().msgtype());
        assertEquals("hello", result.value().body());
        assertFalse(result.value().content().containsKey(Translator.SENDER_FIELD));
    }

    @Test
    void textMentionsAndSenderAreResolved() {
        NativeMessage message = NativeMessage.text("ou_1",
            "hi <at user_id=\"ou_1\">Alice</at> and @ou_9, mail bob@example.com");

        ChannelPayload payload = translator.toChannelFormat(message).value();

        assertEquals("hi @alice:hub.test and @ou_9, mail bob@example.com", payload.body());
        assertEquals("@alice:hub.test", payload.content().get(Translator.SENDER_FIELD));
    }

    @Test
    void overlongMentionPassesThroughRegistryResolver() {
        IdentityRegistry registry = IdentityRegistry.builder().store(new InMemoryRecordStore()).build();
        try {
            registry.registerAgent(Initiator.HUMAN, "A1", Map.of(RegistryIdentityResolver.MATRIX_USER_ID, "@a1:hub.test"));
            Translator withRegistry = new Translator(new RegistryIdentityResolver(registry));
            String longMention = "@" + "x".repeat(300);

            Translation<ChannelPayload> result = withRegistry.toChannelFormat(
                new MessageContent.Text("hi " + longMention + " and @A1"));

            assertEquals("hi " + longMention + " and @a1:hub.test", result.value().body());
        } finally {
            registry.close();
        }
    }

    @Test
    void unresolvedSenderPassesThrough() {
        ChannelPayload payload = translator.toChannelFormat(NativeMessage.text("ou_9", "x")).value();

        assertEquals("ou_9", payload.content().get(Translator.SENDER_FIELD));
    }

    @Test
    void richPostKeepsTextAndReportsStyling() {
        Map<String, Object> post = Map.of("zh_cn", Map.of(
            "title", "Weekly",
            "content", List.of(
                List.of(
                    Map.of("tag", "text", "text", "Hello ", "style", List.of("bold")),
                    Map.of("tag", "at", "user_id", "ou_1")),
                List.of(
                    Map.of("tag", "a", "text", "docs", "href", "https://docs.example"),
                    Map.of("tag", "img", "image_key", "img_1")))));

        Translation<ChannelPayload> result =
            translator.toChannelFormat(new NativeMessage(NativeMessageType.POST, null, post));

        assertEquals("Weekly\nHello @alice:hub.test\ndocs", result.value().body());
        assertEquals("m.text", result.value().msgtype());
        assertEquals(List.of("dropped rich-post styling", "dropped rich-post elements [a.href, img]"),
            result.warnings());
    }

    @Test
    void cardKeepsTitleAndTextOnly() {
        Map<String, Object> card = Map.of(
            "header", Map.of("title", Map.of("tag", "plain_text", "content", "Approve?"), "template", "blue"),
            "elements", List.of(
                Map.of("tag", "markdown", "content", "Deploy v2"),
                Map.of("tag", "div", "text", Map.of("tag", "lark_md", "content", "to prod")),
                Map.of("tag", "action", "actions", List.of())));

        Translation<ChannelPayload> result =
            translator.toChannelFormat(new NativeMessage(NativeMessageType.INTERACTIVE, null, card));

        assertEquals("Approve?\nDeploy v2\nto prod", result.value().body());
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().contains("dropped card elements [action]"));
    }

    // ── Hub content to channel ───────────────────────────────────

    @Test
    void noticeKeepsMsgtype() {
        ChannelPayload payload = translator.toChannelFormat(
            new MessageContent.Notice("build green", Map.of())).value();

        assertEquals("m.notice", payload.msgtype());
        assertEquals("build green", payload.body());
    }

    @Test
    void deliveryEventCarriesSemanticFields() {
        MessageContent content = new MessageContent.Delivery("approval_request",
            Map.of("channel", "im", "receive_id", "ou_1"),
            Map.of("request_id", "R1"), "please approve", Map.of());

        Translation<ChannelPayload> result = translator.toChannelFormat(content);

        assertTrue(result.isLossless());
        Map<String, Object> fields = result.value().content();
        assertEquals(MessageContent.DELIVERY_MSGTYPE, fields.get("msgtype"));
        assertEquals("approval_request", fields.get("semantic_type"));
        assertEquals(Map.of("channel", "im", "receive_id", "ou_1"), fields.get("target"));
        assertEquals(Map.of("request_id", "R1"), fields.get("payload"));
    }

    @Test
    void namespacedExtensionsAreCarriedOthersDropped() {
        MessageContent content = new MessageContent.Text("hi",
            Map.of("com.example.trace", "t-1", "color", "red"));

        Translation<ChannelPayload> result = translator.toChannelFormat(content);

        assertEquals("t-1", result.value().content().get("com.example.trace"));
        assertFalse(result.value().content().containsKey("color"));
        assertEquals(List.of("dropped extension 'color'"), result.warnings());
    }

    @Test
    void cardContentReportsDroppedElements() {
        MessageContent card = new MessageContent.Card("Title", "Summary",
            List.of(Map.of("tag", "button")), Map.of());

        Translation<ChannelPayload> result = translator.toChannelFormat(card);

        assertEquals("Title\nSummary", result.value().body());
        assertEquals(List.of("dropped 1 card element(s)"), result.warnings());
    }

    @Test
    void fromMapSelectsVariant() {
        assertInstanceOf(MessageContent.Notice.class,
            MessageContent.fromMap(Map.of("msgtype", "m.notice", "body", "x")));
        assertInstanceOf(MessageContent.Text.class, MessageContent.fromMap(Map.of("body", "x")));

        MessageContent delivery = MessageContent.fromMap(Map.of(
            "msgtype", "agenthub.delivery", "semantic_type", "alert_notification",
            "payload", Map.of("level", "high"), "body", "disk full"));
        MessageContent.Delivery d = assertInstanceOf(MessageContent.Delivery.class, delivery);
        assertEquals("alert_notification", d.semanticType());
        assertEquals("disk full", d.body());

        MessageContent card = MessageContent.fromMap(Map.of("msgtype", "card", "title", "T", "body", "B"));
        assertEquals("T\nB", card.body());
    }

    // ── Channel to IM ────────────────────────────────────────────

    @Test
    void channelTextBecomesImText() {
        ChannelEvent event = new ChannelEvent("!r:hub.test", "$1", "@alice:hub.test",
            Map.of("msgtype", "m.text", "body", "ping @alice:hub.test and @bob:hub.test"));

        Translation<NativeMessage> result = translator.toNativeFormat(event);

        assertTrue(result.isLossless());
        NativeMessage message = result.value();
        assertEquals(NativeMessageType.TEXT, message.type());
        assertEquals("ou_1", message.senderId());
        assertEquals("ping @ou_1 and @bob:hub.test", message.content().get("text"));
        assertEquals("text", message.toSendRequest().get("msg_type"));
    }

    @Test
    void channelFormattingIsDroppedWithWarning() {
        ChannelEvent event = new ChannelEvent("!r:hub.test", "$1", "@carol:hub.test",
            Map.of("msgtype", "m.text", "body", "hi",
                "format", "org.matrix.custom.html", "formatted_body", "<b>hi</b>"));

        Translation<NativeMessage> result = translator.toNativeFormat(event);

        assertEquals("@carol:hub.test", result.value().senderId());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("format"));
    }

    @Test
    void auditFieldsAreNotReportedAsLoss() {
        ChannelPayload payload = Translator.injectAuditFields(ChannelPayload.of("m.text", "hi"),
            new AuditEvent("m1", "agenthub", "A1", "!r", Instant.ofEpochMilli(1_700_000_000_000L)));
        ChannelEvent event = new ChannelEvent("!r", "$1", "@alice:hub.test", payload.content());

        assertTrue(translator.toNativeFormat(event).isLossless());
        assertEquals(1_700_000_000_000L, payload.content().get("timestamp"));
        assertEquals("m1", payload.content().get("message_id"));
    }

    @Test
    void unknownMsgtypeIsRenderedAsText() {
        ChannelEvent event = new ChannelEvent("!r", "$1", "@alice:hub.test",
            Map.of("msgtype", "m.emote", "body", "waves"));

        Translation<NativeMessage> result = translator.toNativeFormat(event);

        assertEquals("waves", result.value().content().get("text"));
        assertEquals(List.of("msgtype m.emote rendered as text"), result.warnings());
    }

    @Test
    void attributeSenderPrefixesBody() {
        ChannelPayload payload = Translator.attributeSender(ChannelPayload.of("m.text", "done"), "A2");

        assertEquals("[A2] done", payload.body());
    }

    @Test
    void payloadRequiresMsgtypeAndBody() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelPayload(Map.of("body", "x")));
        assertThrows(IllegalArgumentException.class, () -> new ChannelPayload(Map.of("msgtype", "m.text")));
    }
}
