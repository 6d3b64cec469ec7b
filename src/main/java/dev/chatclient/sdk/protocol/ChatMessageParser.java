package dev.chatclient.sdk.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.chatclient.sdk.exceptions.ChatParseException;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatFinishReason;
import dev.chatclient.sdk.types.chat.ChatMessageContentPart;
import dev.chatclient.sdk.types.chat.ChatMessageRole;
import dev.chatclient.sdk.types.chat.ChatTokenUsage;
import dev.chatclient.sdk.types.chat.ChatToolCall;
import dev.chatclient.sdk.types.chat.ImageDetail;
import dev.chatclient.sdk.types.chat.StreamingChatUpdate;
import dev.chatclient.sdk.types.chat.StreamingToolCallUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.net.URI;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decoder for chat completion JSON bodies and streaming chunks.
 */
public class ChatMessageParser {

    private static final Logger logger = LoggerFactory.getLogger(ChatMessageParser.class);
    private final ObjectMapper objectMapper;

    public ChatMessageParser() {
        this(new ObjectMapper());
    }

    public ChatMessageParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode one streaming chunk into zero or more updates, one per choice.
     *
     * <p>Chunk-level fields (id, model, created) are copied onto every update;
     * usage is attached to the first one only. A chunk without choices yields
     * a single update carrying the chunk-level fields. A payload that is not
     * valid JSON yields no updates.
     */
    public List<StreamingChatUpdate> parseStreamingUpdates(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to decode streaming chunk: {}", json, e);
            return Collections.emptyList();
        }
        if (root == null || !root.isObject()) {
            logger.warn("Ignoring streaming chunk that is not a JSON object: {}", json);
            return Collections.emptyList();
        }

        String id = text(root.get("id"));
        String model = text(root.get("model"));
        Instant created = timestamp(root.get("created"));
        ChatTokenUsage usage = parseUsage(root.get("usage"));

        JsonNode choices = root.get("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            return Collections.singletonList(StreamingChatUpdate.builder()
                    .completionId(id)
                    .model(model)
                    .createdAt(created)
                    .usage(usage)
                    .build());
        }

        List<StreamingChatUpdate> updates = new ArrayList<>(choices.size());
        int position = 0;
        for (JsonNode choice : choices) {
            StreamingChatUpdate.StreamingChatUpdateBuilder update = StreamingChatUpdate.builder()
                    .completionId(id)
                    .model(model)
                    .createdAt(created)
                    .choiceIndex(intValue(choice.get("index"), position))
                    .finishReason(finishReason(choice.get("finish_reason")));
            if (position == 0) {
                update.usage(usage);
            }

            JsonNode delta = choice.get("delta");
            if (delta != null && delta.isObject()) {
                update.role(role(delta.get("role")));
                update.contentUpdates(parseContent(delta.get("content")));
                update.toolCallUpdates(parseToolCallUpdates(delta.get("tool_calls")));
            }
            updates.add(update.build());
            position++;
        }
        return updates;
    }

    /**
     * Decode a unary chat completion body. Only the first choice is kept.
     */
    public ChatCompletion parseCompletion(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ChatParseException("Failed to parse chat completion", json, e);
        }
        if (root == null || !root.isObject()) {
            throw new ChatParseException("Chat completion is not a JSON object", json);
        }

        ChatCompletion.ChatCompletionBuilder completion = ChatCompletion.builder()
                .id(text(root.get("id")))
                .model(text(root.get("model")))
                .createdAt(timestamp(root.get("created")))
                .usage(parseUsage(root.get("usage")));

        JsonNode choices = root.get("choices");
        if (choices != null && choices.isArray() && !choices.isEmpty()) {
            JsonNode choice = choices.get(0);
            completion.finishReason(finishReason(choice.get("finish_reason")));
            JsonNode message = choice.get("message");
            if (message != null && message.isObject()) {
                completion.role(role(message.get("role")));
                completion.content(parseContent(message.get("content")));
                completion.toolCalls(parseToolCalls(message.get("tool_calls")));
            }
        }
        return completion.build();
    }

    private List<ChatMessageContentPart> parseContent(@Nullable JsonNode contentNode) {
        if (contentNode == null || contentNode.isNull()) {
            return Collections.emptyList();
        }
        if (contentNode.isTextual()) {
            return Collections.singletonList(ChatMessageContentPart.text(contentNode.asText()));
        }
        if (!contentNode.isArray()) {
            return Collections.emptyList();
        }

        List<ChatMessageContentPart> parts = new ArrayList<>();
        for (JsonNode partNode : contentNode) {
            String type = text(partNode.get("type"));
            if ("text".equals(type)) {
                String value = text(partNode.get("text"));
                if (value != null) {
                    parts.add(ChatMessageContentPart.text(value));
                }
            } else if ("image_url".equals(type)) {
                JsonNode image = partNode.path("image_url");
                String url = text(image.get("url"));
                if (url != null) {
                    try {
                        parts.add(ChatMessageContentPart.image(
                                URI.create(url),
                                ImageDetail.fromValue(text(image.get("detail")))));
                    } catch (IllegalArgumentException e) {
                        logger.warn("Ignoring image part with invalid url: {}", url);
                    }
                }
            }
        }
        return parts;
    }

    private List<StreamingToolCallUpdate> parseToolCallUpdates(@Nullable JsonNode toolCallsNode) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return Collections.emptyList();
        }
        List<StreamingToolCallUpdate> updates = new ArrayList<>();
        for (JsonNode toolCall : toolCallsNode) {
            JsonNode function = toolCall.path("function");
            updates.add(new StreamingToolCallUpdate(
                    intValue(toolCall.get("index"), 0),
                    text(toolCall.get("id")),
                    text(function.get("name")),
                    text(function.get("arguments"))
            ));
        }
        return updates;
    }

    private List<ChatToolCall> parseToolCalls(@Nullable JsonNode toolCallsNode) {
        if (toolCallsNode == null || !toolCallsNode.isArray()) {
            return Collections.emptyList();
        }
        List<ChatToolCall> toolCalls = new ArrayList<>();
        for (JsonNode toolCall : toolCallsNode) {
            JsonNode function = toolCall.path("function");
            String arguments = text(function.get("arguments"));
            toolCalls.add(new ChatToolCall(
                    text(toolCall.get("id")),
                    text(function.get("name")),
                    arguments != null ? arguments : ""
            ));
        }
        return toolCalls;
    }

    @Nullable
    private ChatTokenUsage parseUsage(@Nullable JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        return new ChatTokenUsage(
                usageNode.path("prompt_tokens").asInt(0),
                usageNode.path("completion_tokens").asInt(0),
                usageNode.path("total_tokens").asInt(0)
        );
    }

    @Nullable
    private ChatMessageRole role(@Nullable JsonNode node) {
        String value = text(node);
        ChatMessageRole role = ChatMessageRole.fromValue(value);
        if (value != null && role == null) {
            logger.debug("Ignoring unknown role: {}", value);
        }
        return role;
    }

    @Nullable
    private ChatFinishReason finishReason(@Nullable JsonNode node) {
        String value = text(node);
        ChatFinishReason reason = ChatFinishReason.fromValue(value);
        if (value != null && reason == null) {
            logger.debug("Ignoring unknown finish reason: {}", value);
        }
        return reason;
    }

    @Nullable
    private static Instant timestamp(@Nullable JsonNode node) {
        if (node == null || !node.canConvertToLong()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(node.asLong());
        } catch (DateTimeException e) {
            logger.debug("Ignoring out-of-range created timestamp: {}", node);
            return null;
        }
    }

    private static int intValue(@Nullable JsonNode node, int defaultValue) {
        if (node == null || !node.canConvertToInt()) {
            return defaultValue;
        }
        return node.asInt();
    }

    @Nullable
    private static String text(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }
}
