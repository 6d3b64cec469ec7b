package dev.chatclient.sdk.support;

/**
 * Builds {@code text/event-stream} bodies.
 */
public final class Sse {

    private Sse() {
    }

    public static String events(String... data) {
        StringBuilder body = new StringBuilder();
        for (String item : data) {
            body.append("data: ").append(item).append("\n\n");
        }
        return body.toString();
    }

    public static String chunk(String deltaJson) {
        return chunk(deltaJson, null);
    }

    public static String chunk(String deltaJson, String finishReason) {
        return "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion.chunk\",\"created\":1700000000,"
                + "\"model\":\"gpt-test-0613\",\"choices\":[{\"index\":0,\"delta\":" + deltaJson
                + ",\"finish_reason\":" + (finishReason == null ? "null" : "\"" + finishReason + "\"") + "}]}";
    }
}
