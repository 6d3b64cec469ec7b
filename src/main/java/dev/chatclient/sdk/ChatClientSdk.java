package dev.chatclient.sdk;

import dev.chatclient.sdk.client.ChatClient;
import dev.chatclient.sdk.types.chat.ChatCompletion;
import dev.chatclient.sdk.types.chat.ChatMessage;
import dev.chatclient.sdk.types.chat.ChatRequest;
import dev.chatclient.sdk.types.options.ChatClientOptions;

/**
 * Main entry point for the chat client SDK.
 * <p>
 * Example:
 * <pre>{@code
 * ChatCompletion answer = ChatClientSdk.complete("What is 2 + 2?",
 *     ChatClientOptions.builder().apiKey(key).model("gpt-4o-mini").build());
 * }</pre>
 */
public class ChatClientSdk {

    private ChatClientSdk() {
    }

    /**
     * Create a client. The caller owns it and must close it.
     */
    public static ChatClient client(ChatClientOptions options) {
        return new ChatClient(options);
    }

    /**
     * One-shot completion of a single user prompt.
     */
    public static ChatCompletion complete(String prompt, ChatClientOptions options) {
        try (ChatClient client = client(options)) {
            return client.completeChat(ChatRequest.of(ChatMessage.user(prompt)));
        }
    }

    /**
     * Get SDK version.
     */
    public static String getVersion() {
        return "0.1.0";
    }
}
