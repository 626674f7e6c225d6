package io.cardlink.realtime.client;

import io.cardlink.realtime.json.jackson.JacksonJsonCodec;
import io.cardlink.realtime.json.spi.JsonCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundMessageTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    private String json(OutboundMessage m) throws Exception {
        return codec.writeString(m.toJson(codec));
    }

    @Test
    void replyToIdIsOmittedWhenAbsent() throws Exception {
        assertThat(json(OutboundMessage.sendMessage("hi", null)))
                .isEqualTo("{\"action\":\"send_message\",\"content\":\"hi\"}");
        assertThat(json(OutboundMessage.sendMessage("hi", "m1")))
                .isEqualTo("{\"action\":\"send_message\",\"content\":\"hi\",\"reply_to_id\":\"m1\"}");
    }

    @Test
    void conversationScopeComesFirst() throws Exception {
        OutboundMessage m = OutboundMessage.deleteMessage("m9", true).inConversation("c1");

        assertThat(json(m))
                .isEqualTo("{\"action\":\"delete_message\",\"conversation_id\":\"c1\",\"message_id\":\"m9\",\"for_me\":true}");
    }

    @Test
    void suggestTagsCarriesText() throws Exception {
        assertThat(json(OutboundMessage.suggestTags("Backend engineer")))
                .isEqualTo("{\"action\":\"suggest_tags\",\"bio_text\":\"Backend engineer\"}");
    }
}
