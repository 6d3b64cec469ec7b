package dev.chatclient.sdk.instrumentation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.chatclient.sdk.types.chat.ChatFinishReason;
import dev.chatclient.sdk.types.chat.ChatMessage;
import dev.chatclient.sdk.types.chat.ChatMessageContentPart;
import dev.chatclient.sdk.types.chat.ChatMessageRole;
import dev.chatclient.sdk.types.chat.ChatToolCall;

import javax.annotation.Nullable;
import java.util.List;

/**
 * JSON bodies of the {@code event.data} attribute on message and choice events.
 * Text and tool arguments are replaced by {@link TelemetryConstants#REDACTED}
 * unless content recording is enabled.
 */
final class EventPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventPayloads() {
    }

    static String message(ChatMessage message, boolean recordContent) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("content", contentText(message.getContent(), recordContent));
        if (message.getRole() == ChatMessageRole.ASSISTANT && !message.getToolCalls().isEmpty()) {
            writeToolCalls(payload, message.getToolCalls(), recordContent);
        }
        if (message.getRole() == ChatMessageRole.TOOL && message.getToolCallId() != null) {
            payload.put("id", message.getToolCallId());
        }
        if (message.getRole() == ChatMessageRole.FUNCTION && message.getName() != null) {
            payload.put("name", message.getName());
        }
        return write(payload);
    }

    static String choice(@Nullable ChatFinishReason finishReason,
                         @Nullable ChatMessageRole role,
                         List<ChatMessageContentPart> content,
                         List<ChatToolCall> toolCalls,
                         boolean recordContent) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("index", 0);
        if (finishReason != null) {
            payload.put("finish_reason", finishReason.getValue());
        } else {
            payload.putNull("finish_reason");
        }

        ObjectNode message = payload.putObject("message");
        if (role != null) {
            message.put("role", role.getValue());
        }
        message.put("content", contentText(content, recordContent));
        if (!toolCalls.isEmpty()) {
            writeToolCalls(message, toolCalls, recordContent);
        }
        return write(payload);
    }

    private static void writeToolCalls(ObjectNode target, List<ChatToolCall> toolCalls, boolean recordContent) {
        ArrayNode calls = target.putArray("tool_calls");
        for (ChatToolCall toolCall : toolCalls) {
            ObjectNode call = calls.addObject();
            call.put("id", toolCall.getId());
            call.put("type", toolCall.getKind());
            ObjectNode function = call.putObject("function");
            function.put("name", toolCall.getFunctionName());
            function.put("arguments", recordContent ? toolCall.getFunctionArguments() : TelemetryConstants.REDACTED);
        }
    }

    private static String contentText(List<ChatMessageContentPart> parts, boolean recordContent) {
        if (!recordContent) {
            return TelemetryConstants.REDACTED;
        }
        StringBuilder text = new StringBuilder();
        for (ChatMessageContentPart part : parts) {
            if (part.isText()) {
                text.append(part.getText());
            } else if (part.getImageUri() != null) {
                text.append(part.getImageUri());
            }
        }
        return text.toString();
    }

    private static String write(ObjectNode payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event payload", e);
        }
    }
}
