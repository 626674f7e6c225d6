package io.cardlink.realtime.client.generation;

import io.cardlink.realtime.client.ChannelOptions;
import io.cardlink.realtime.client.ChannelRuntime;
import io.cardlink.realtime.client.FakeSocketTransport;
import io.cardlink.realtime.client.ManualEventLoop;
import io.cardlink.realtime.core.CredentialProvider;
import io.cardlink.realtime.core.RealtimeException;
import io.cardlink.realtime.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BioGenerationClientTest {

    private static final String GENERATE = "{\"action\":\"generate_bio\"}";

    private ManualEventLoop loop;
    private FakeSocketTransport transport;
    private Bio bio;
    private BioGenerationClient client;
    private final List<String> progress = new ArrayList<>();

    static final class Bio implements EditableContent {
        String value;
        final List<String> writes = new ArrayList<>();

        Bio(String value) {
            this.value = value;
        }

        @Override
        public String get() {
            return value;
        }

        @Override
        public void set(String value) {
            this.value = value;
            writes.add(value);
        }
    }

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeSocketTransport();
        bio = new Bio("Old bio");
        ChannelRuntime runtime = new ChannelRuntime(transport, CredentialProvider.of("jwt"), loop,
                new JacksonJsonCodec(), ChannelOptions.defaults());
        client = new BioGenerationClient(URI.create("http://localhost:8000"), "card-1", "user-7", bio, runtime);
        client.addGenerationListener(new GenerationListener() {
            @Override
            public void onStarted() {
                progress.add("started");
            }

            @Override
            public void onChunk(String chunk, String accumulated) {
                progress.add("chunk " + accumulated);
            }

            @Override
            public void onCommitted(String content) {
                progress.add("committed " + content);
            }

            @Override
            public void onRolledBack(String restored, String reason) {
                progress.add("rolled back to " + restored + " (" + reason + ")");
            }
        });
    }

    private FakeSocketTransport.FakeSocket open() {
        client.connect();
        transport.last().acceptOpen();
        return transport.last();
    }

    private static String chunk(String text) {
        return "{\"type\":\"chunk\",\"content\":\"" + text + "\"}";
    }

    @Test
    void connectsWithCardAndOwner() {
        client.connect();

        assertThat(transport.last().url().toString())
                .isEqualTo("ws://localhost:8000/api/ws/cards/card-1?owner_id=user-7&token=jwt");
    }

    @Test
    void chunksAccumulateAndCompleteCommits() {
        FakeSocketTransport.FakeSocket s = open();

        CompletableFuture<String> result = client.generate();
        assertThat(client.isGenerating()).isTrue();
        assertThat(s.sent()).containsExactly(GENERATE);

        s.receive("{\"type\":\"start\",\"message\":\"Generating...\"}");
        s.receive(chunk("Hello"));
        s.receive(chunk(" world"));
        s.receive(chunk("!"));
        assertThat(bio.value).isEqualTo("Old bio");
        s.receive("{\"type\":\"complete\",\"full_bio\":\"Hello world!\"}");

        assertThat(result).isCompletedWithValue("Hello world!");
        assertThat(bio.value).isEqualTo("Hello world!");
        assertThat(client.isGenerating()).isFalse();
        assertThat(progress).containsExactly("started", "chunk Hello", "chunk Hello world", "chunk Hello world!",
                "committed Hello world!");
    }

    @Test
    void completeWithoutFullTextCommitsBuffer() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> result = client.generate();

        s.receive(chunk("stale"));
        s.receive("{\"type\":\"start\"}");
        s.receive(chunk("Fresh"));
        s.receive(chunk(" start"));
        s.receive("{\"type\":\"complete\"}");

        assertThat(result).isCompletedWithValue("Fresh start");
        assertThat(bio.value).isEqualTo("Fresh start");
    }

    @Test
    void emptyFullTextKeepsAccumulatedChunks() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> result = client.generate();

        s.receive("{\"type\":\"start\"}");
        s.receive(chunk("Hello"));
        s.receive("{\"type\":\"complete\",\"full_bio\":\"\"}");

        assertThat(result).isCompletedWithValue("Hello");
        assertThat(bio.value).isEqualTo("Hello");
    }

    @Test
    void errorRestoresSnapshot() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> result = client.generate();

        s.receive(chunk("Half"));
        s.receive(chunk(" done"));
        s.receive("{\"type\":\"error\",\"message\":\"failed\"}");

        assertThat(bio.value).isEqualTo("Old bio");
        assertThatThrownBy(result::join).hasCauseInstanceOf(RealtimeException.GenerationFailed.class)
                .hasMessageContaining("failed");
        assertThat(progress).endsWith("rolled back to Old bio (failed)");
        assertThat(client.isGenerating()).isFalse();
    }

    @Test
    void emptySnapshotIsRestoredExactly() {
        bio.value = "";
        FakeSocketTransport.FakeSocket s = open();
        client.generate();

        s.receive(chunk("Something"));
        client.cancel();

        assertThat(bio.value).isEmpty();
    }

    @Test
    void nullContentIsRestoredAsNull() {
        bio.value = null;
        FakeSocketTransport.FakeSocket s = open();
        client.generate();

        s.receive(chunk("Something"));
        s.receive("{\"type\":\"error\",\"message\":\"failed\"}");

        assertThat(bio.value).isNull();
        assertThat(bio.writes).containsExactly((String) null);
    }

    @Test
    void secondGenerateWhileStreamingFails() {
        FakeSocketTransport.FakeSocket s = open();
        client.generate();

        CompletableFuture<String> second = client.generate();

        assertThatThrownBy(second::join).hasCauseInstanceOf(RealtimeException.GenerationInProgress.class);
        assertThat(s.sent()).containsExactly(GENERATE);
    }

    @Test
    void generateRequiresOpenChannel() {
        CompletableFuture<String> result = client.generate();

        assertThatThrownBy(result::join).hasCauseInstanceOf(RealtimeException.ChannelNotOpen.class);
        assertThat(bio.writes).isEmpty();
    }

    @Test
    void cancelledStreamIsIgnoredUntilItEnds() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> first = client.generate();
        s.receive(chunk("Abandoned"));

        client.cancel();
        assertThatThrownBy(first::join).hasCauseInstanceOf(RealtimeException.GenerationCancelled.class);
        assertThat(bio.value).isEqualTo("Old bio");

        s.receive(chunk(" still streaming"));
        s.receive("{\"type\":\"complete\",\"full_bio\":\"Abandoned still streaming\"}");
        assertThat(bio.value).isEqualTo("Old bio");

        CompletableFuture<String> second = client.generate();
        s.receive("{\"type\":\"start\"}");
        s.receive(chunk("New"));
        s.receive("{\"type\":\"complete\",\"full_bio\":\"New\"}");

        assertThat(second).isCompletedWithValue("New");
        assertThat(bio.value).isEqualTo("New");
    }

    @Test
    void cancelledStreamEndingInErrorIsAlsoDiscarded() {
        FakeSocketTransport.FakeSocket s = open();
        client.generate();
        client.cancel();

        s.receive("{\"type\":\"error\",\"message\":\"upstream timeout\"}");
        CompletableFuture<String> next = client.generate();
        s.receive(chunk("Ok"));
        s.receive("{\"type\":\"complete\",\"full_bio\":\"Ok\"}");

        assertThat(next).isCompletedWithValue("Ok");
    }

    @Test
    void connectionLossDuringStreamingRollsBack() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> result = client.generate();
        s.receive(chunk("Partial"));

        s.fail(new IOException("reset"));

        assertThat(bio.value).isEqualTo("Old bio");
        assertThatThrownBy(result::join).hasCauseInstanceOf(RealtimeException.GenerationFailed.class);
        assertThat(client.isGenerating()).isFalse();
    }

    @Test
    void disconnectDuringStreamingRollsBack() {
        FakeSocketTransport.FakeSocket s = open();
        CompletableFuture<String> result = client.generate();
        s.receive(chunk("Partial"));

        client.disconnect();

        assertThat(bio.value).isEqualTo("Old bio");
        assertThat(result).isCompletedExceptionally();
        assertThat(s.sent()).containsExactly(GENERATE);
    }

    @Test
    void tagRequestsNeedEnoughText() {
        FakeSocketTransport.FakeSocket s = open();

        assertThat(client.requestTags("too short")).isFalse();
        assertThat(client.isTagsLoading()).isFalse();

        assertThat(client.requestTags("Senior backend engineer, Java and Kafka")).isTrue();
        assertThat(client.isTagsLoading()).isTrue();
        assertThat(s.sent()).containsExactly(
                "{\"action\":\"suggest_tags\",\"bio_text\":\"Senior backend engineer, Java and Kafka\"}");
    }

    @Test
    void tagsUpdateClearsLoadingAndNotifies() {
        List<String> names = new ArrayList<>();
        client.addTagListener(tags -> tags.forEach(t -> names.add(t.name() + ":" + t.category())));
        FakeSocketTransport.FakeSocket s = open();
        client.requestTags("Senior backend engineer, Java and Kafka");

        s.receive("{\"type\":\"tags_update\",\"tags\":[{\"name\":\"Java\",\"category\":\"skill\",\"confidence\":0.95,"
                + "\"reason\":\"mentioned\"},{\"name\":\"Kafka\",\"category\":\"skill\",\"confidence\":0.8,\"reason\":\"mentioned\"}]}");

        assertThat(client.isTagsLoading()).isFalse();
        assertThat(names).containsExactly("Java:skill", "Kafka:skill");
    }

    @Test
    void errorDuringGenerationAlsoEndsTagLoading() {
        FakeSocketTransport.FakeSocket s = open();
        client.requestTags("Senior backend engineer, Java and Kafka");
        CompletableFuture<String> result = client.generate();

        s.receive("{\"type\":\"error\",\"message\":\"tags failed\"}");

        assertThat(client.isTagsLoading()).isFalse();
        assertThat(client.isGenerating()).isFalse();
        assertThat(result).isCompletedExceptionally();
        assertThat(bio.value).isEqualTo("Old bio");
    }

    @Test
    void editsAreDebounced() {
        FakeSocketTransport.FakeSocket s = open();

        client.contentEdited("Product designer who");
        loop.advanceMillis(1000);
        client.contentEdited("Product designer who loves research");
        loop.advanceMillis(1499);
        assertThat(s.sent()).isEmpty();

        loop.advanceMillis(1);
        assertThat(s.sent()).containsExactly(
                "{\"action\":\"suggest_tags\",\"bio_text\":\"Product designer who loves research\"}");
    }

    @Test
    void tagsAreRequestedShortlyAfterCommit() {
        FakeSocketTransport.FakeSocket s = open();
        client.generate();
        s.receive("{\"type\":\"complete\",\"full_bio\":\"Engineer building payment systems in Java\"}");

        loop.advanceMillis(499);
        assertThat(s.sent()).containsExactly(GENERATE);
        loop.advanceMillis(1);

        assertThat(s.sent()).containsExactly(GENERATE,
                "{\"action\":\"suggest_tags\",\"bio_text\":\"Engineer building payment systems in Java\"}");
        assertThat(client.isTagsLoading()).isTrue();
        assertThat(client.isGenerating()).isFalse();
    }
}
