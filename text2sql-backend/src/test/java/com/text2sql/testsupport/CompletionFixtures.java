package com.text2sql.testsupport;

/**
 * Canned chat completion payloads.
 */
public final class CompletionFixtures {

    private CompletionFixtures() {
    }

    /**
     * Wrap model output in an OpenAI-style chat completion body.
     */
    public static String completionBody(String content) {
        String escaped = content
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n");
        return "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"choices\":[{\"index\":0,"
                + "\"message\":{\"role\":\"assistant\",\"content\":\"" + escaped + "\"},"
                + "\"finish_reason\":\"stop\"}]}";
    }
}
