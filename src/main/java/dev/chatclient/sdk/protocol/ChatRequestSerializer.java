package dev.chatclient.sdk.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.chatclient.sdk.exceptions.ChatClientException;
import dev.chatclient.sdk.types.chat.ChatMessage;
import dev.chatclient.sdk.types.chat.ChatMessageContentPart;
import dev.chatclient.sdk.types.chat.ChatRequest;
import dev.chatclient.sdk.types.chat.ChatToolCall;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Encodes a {@link ChatRequest} into the chat-completions wire shape.
 */
public class ChatRequestSerializer {

    private final ObjectMapper objectMapper;

    public ChatRequestSerializer() {
        this(new ObjectMapper());
    }

    public ChatRequestSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param request      request to encode
     * @param defaultModel model used when the request names none
     * @param streaming    whether to ask for a server-sent event stream
     */
    public String serialize(ChatRequest request, @Nullable String defaultModel, boolean streaming) {
        try {
            return objectMapper.writeValueAsString(toJson(request, defaultModel, streaming));
        } catch (JsonProcessingException e) {
            throw new ChatClientException("Failed to serialize chat request", e);
        }
    }

    ObjectNode toJson(ChatRequest request, @Nullable String defaultModel, boolean streaming) {
        ObjectNode root = objectMapper.createObjectNode();
        String model = request.getModel() != null ? request.getModel() : defaultModel;
        if (model != null) {
            root.put("model", model);
        }

        ArrayNode messages = root.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            messages.add(toJson(message));
        }

        if (request.getMaxTokens() != null) {
            root.put("max_tokens", request.getMaxTokens());
        }
        if (request.getTemperature() != null) {
            root.put("temperature", request.getTemperature());
        }
        if (request.getTopP() != null) {
            root.put("top_p", request.getTopP());
        }

        root.put("stream", streaming);
        if (streaming && request.isIncludeStreamUsage()) {
            root.putObject("stream_options").put("include_usage", true);
        }
        return root;
    }

    private ObjectNode toJson(ChatMessage message) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("role", message.getRole().getValue());
        writeContent(node, message.getContent());

        if (!message.getToolCalls().isEmpty()) {
            ArrayNode toolCalls = node.putArray("tool_calls");
            for (ChatToolCall toolCall : message.getToolCalls()) {
                ObjectNode call = toolCalls.addObject();
                call.put("id", toolCall.getId());
                call.put("type", toolCall.getKind());
                ObjectNode function = call.putObject("function");
                function.put("name", toolCall.getFunctionName());
                function.put("arguments", toolCall.getFunctionArguments());
            }
        }
        if (message.getToolCallId() != null) {
            node.put("tool_call_id", message.getToolCallId());
        }
        if (message.getName() != null) {
            node.put("name", message.getName());
        }
        return node;
    }

    private void writeContent(ObjectNode node, List<ChatMessageContentPart> parts) {
        if (parts.isEmpty()) {
            // assistant messages that only carry tool calls
            node.putNull("content");
            return;
        }
        if (parts.size() == 1 && parts.get(0).isText()) {
            node.put("content", parts.get(0).getText());
            return;
        }

        ArrayNode content = node.putArray("content");
        for (ChatMessageContentPart part : parts) {
            ObjectNode partNode = content.addObject();
            if (part.isText()) {
                partNode.put("type", "text");
                partNode.put("text", part.getText());
            } else {
                partNode.put("type", "image_url");
                ObjectNode image = partNode.putObject("image_url");
                image.put("url", part.getImageUri().toString());
                if (part.getImageDetail() != null) {
                    image.put("detail", part.getImageDetail().getValue());
                }
            }
        }
    }
}
