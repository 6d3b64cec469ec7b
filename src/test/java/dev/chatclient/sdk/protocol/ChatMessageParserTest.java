package dev.chatclient.sdk.protocol;

import dev.chatclient.sdk.exceptions.ChatParseException;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatFinishReason;
import dev.chatclient.sdk.types.chat.ChatMessageRole;
import dev.chatclient.sdk.types.chat.ImageDetail;
import dev.chatclient.sdk.types.chat.StreamingChatUpdate;
import dev.chatclient.sdk.types.chat.StreamingToolCallUpdate;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatMessageParserTest {

    private final ChatMessageParser parser = new ChatMessageParser();

    @Test
    void shouldParseContentDeltaWithChunkFields() {
        String chunk = """
                {"id":"chatcmpl-9","object":"chat.completion.chunk","created":1700000000,"model":"gpt-4o-2024",
                 "choices":[{"index":0,"delta":{"role":"assistant","content":"He"},"finish_reason":null}]}
                """;

        List<StreamingChatUpdate> updates = parser.parseStreamingUpdates(chunk);

        assertThat(updates).hasSize(1);
        StreamingChatUpdate update = updates.get(0);
        assertThat(update.getCompletionId()).isEqualTo("chatcmpl-9");
        assertThat(update.getModel()).isEqualTo("gpt-4o-2024");
        assertThat(update.getCreatedAt()).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(update.getRole()).isEqualTo(ChatMessageRole.ASSISTANT);
        assertThat(update.getContentUpdates()).hasSize(1);
        assertThat(update.getContentUpdates().get(0).getText()).isEqualTo("He");
        assertThat(update.getFinishReason()).isNull();
        assertThat(update.getUsage()).isNull();
    }

    @Test
    void shouldParseToolCallFragments() {
        String chunk = """
                {"id":"c","model":"m","choices":[{"index":0,"delta":{"tool_calls":[
                  {"index":1,"id":"call_2","type":"function","function":{"name":"lookup","arguments":"{\\"q\\":"}},
                  {"index":0,"function":{"arguments":"1}"}}
                ]},"finish_reason":"tool_calls"}]}
                """;

        StreamingChatUpdate update = parser.parseStreamingUpdates(chunk).get(0);

        assertThat(update.getFinishReason()).isEqualTo(ChatFinishReason.TOOL_CALLS);
        assertThat(update.getToolCallUpdates()).containsExactly(
                new StreamingToolCallUpdate(1, "call_2", "lookup", "{\"q\":"),
                new StreamingToolCallUpdate(0, null, null, "1}"));
    }

    @Test
    void shouldSplitChoicesAndAttachUsageToFirstUpdate() {
        String chunk = """
                {"id":"c","model":"m","usage":{"prompt_tokens":5,"completion_tokens":2,"total_tokens":7},
                 "choices":[{"index":0,"delta":{"content":"a"}},{"index":1,"delta":{"content":"b"}}]}
                """;

        List<StreamingChatUpdate> updates = parser.parseStreamingUpdates(chunk);

        assertThat(updates).extracting(StreamingChatUpdate::getChoiceIndex).containsExactly(0, 1);
        assertThat(updates.get(0).getUsage().getInputTokenCount()).isEqualTo(5);
        assertThat(updates.get(0).getUsage().getOutputTokenCount()).isEqualTo(2);
        assertThat(updates.get(1).getUsage()).isNull();
        assertThat(updates.get(1).getCompletionId()).isEqualTo("c");
    }

    @Test
    void shouldReturnSingleUpdateForUsageOnlyChunk() {
        String chunk = """
                {"id":"c","model":"m","choices":[],"usage":{"prompt_tokens":3,"completion_tokens":4,"total_tokens":7}}
                """;

        List<StreamingChatUpdate> updates = parser.parseStreamingUpdates(chunk);

        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).getUsage().getTotalTokenCount()).isEqualTo(7);
        assertThat(updates.get(0).getContentUpdates()).isEmpty();
    }

    @Test
    void shouldParseImageContentParts() {
        String chunk = """
                {"choices":[{"index":0,"delta":{"content":[
                  {"type":"image_url","image_url":{"url":"https://img.example.com/a.png","detail":"high"}},
                  {"type":"text","text":"caption"}
                ]}}]}
                """;

        StreamingChatUpdate update = parser.parseStreamingUpdates(chunk).get(0);

        assertThat(update.getContentUpdates()).hasSize(2);
        assertThat(update.getContentUpdates().get(0).isImage()).isTrue();
        assertThat(update.getContentUpdates().get(0).getImageUri()).isEqualTo(URI.create("https://img.example.com/a.png"));
        assertThat(update.getContentUpdates().get(0).getImageDetail()).isEqualTo(ImageDetail.HIGH);
        assertThat(update.getContentUpdates().get(1).getText()).isEqualTo("caption");
    }

    @Test
    void shouldIgnoreUnknownValuesAndMalformedChunks() {
        assertThat(parser.parseStreamingUpdates("{not json")).isEmpty();
        assertThat(parser.parseStreamingUpdates("[1,2]")).isEmpty();

        StreamingChatUpdate update = parser.parseStreamingUpdates("""
                {"choices":[{"delta":{"role":"narrator","content":null},"finish_reason":"mystery"}]}
                """).get(0);
        assertThat(update.getRole()).isNull();
        assertThat(update.getFinishReason()).isNull();
        assertThat(update.getContentUpdates()).isEmpty();
    }

    @Test
    void shouldIgnoreOutOfRangeCreatedTimestamp() {
        List<StreamingChatUpdate> updates = parser.parseStreamingUpdates("""
                {"id":"chatcmpl-2","created":9223372036854775807,"choices":[{"index":0,"delta":{"content":"x"}}]}
                """);

        assertThat(updates).hasSize(1);
        assertThat(updates.get(0).getCreatedAt()).isNull();
        assertThat(updates.get(0).getCompletionId()).isEqualTo("chatcmpl-2");
        assertThat(updates.get(0).getContentUpdates().get(0).getText()).isEqualTo("x");

        ChatCompletion completion = parser.parseCompletion("""
                {"id":"chatcmpl-3","created":-9223372036854775808}
                """);
        assertThat(completion.getCreatedAt()).isNull();
        assertThat(completion.getId()).isEqualTo("chatcmpl-3");
    }

    @Test
    void shouldParseUnaryCompletion() {
        String body = """
                {"id":"chatcmpl-1","object":"chat.completion","created":1700000001,"model":"gpt-4o",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"Hi there",
                   "tool_calls":[{"id":"call_1","type":"function","function":{"name":"f","arguments":"{}"}}]},
                   "finish_reason":"stop"}],
                 "usage":{"prompt_tokens":9,"completion_tokens":3,"total_tokens":12}}
                """;

        ChatCompletion completion = parser.parseCompletion(body);

        assertThat(completion.getId()).isEqualTo("chatcmpl-1");
        assertThat(completion.getModel()).isEqualTo("gpt-4o");
        assertThat(completion.getRole()).isEqualTo(ChatMessageRole.ASSISTANT);
        assertThat(completion.getText()).isEqualTo("Hi there");
        assertThat(completion.getFinishReason()).isEqualTo(ChatFinishReason.STOP);
        assertThat(completion.getToolCalls()).hasSize(1);
        assertThat(completion.getToolCalls().get(0).getFunctionName()).isEqualTo("f");
        assertThat(completion.getUsage().getTotalTokenCount()).isEqualTo(12);
    }

    @Test
    void shouldRejectUndecodableCompletion() {
        assertThatThrownBy(() -> parser.parseCompletion("<html>bad gateway</html>"))
                .isInstanceOf(ChatParseException.class)
                .satisfies(e -> assertThat(((ChatParseException) e).getPayload()).contains("bad gateway"));
    }
}
