package com.example.FundScout.service;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * One-shot chat completion that is expected to answer with a JSON object.
 * Runs under the named resilience policy and strips Markdown code fences.
 */
@Service
@RequiredArgsConstructor
public class JsonChatService {

    static final String DEFAULT_MODEL = "openai";

    private final Map<String, ChatClient> chatClients;
    private final ResilientCallExecutor callExecutor;

    /**
     * @param callName resilience policy name ("selection" or "enrichment")
     * @param model    chat client key, e.g. "openai" or "deepseek"
     * @return the raw JSON text of the answer
     * @throws GenerativeCallException when the call fails, times out or answers blank
     */
    public String complete(String callName, String model, String system, String user) {
        ChatClient client = resolveClient(model);
        String content = callExecutor.call(
                callName,
                () -> client.prompt()
                        .system(system)
                        .user(user)
                        .call()
                        .content(),
                e -> new GenerativeCallException("Chat call '" + callName + "' failed", e)
        );
        String json = stripCodeFence(content);
        if (json.isBlank()) {
            throw new GenerativeCallException("Chat call '" + callName + "' returned an empty answer");
        }
        return json;
    }

    /**
     * Lookup keys: "&lt;model&gt;ChatClient", then "&lt;model&gt;"; falls back to the default
     * model's client, then to any client.
     */
    ChatClient resolveClient(String model) {
        String key = Optional.ofNullable(model)
                .map(m -> m.trim().toLowerCase(Locale.ROOT))
                .filter(m -> !m.isEmpty())
                .orElse(DEFAULT_MODEL);
        if (chatClients.containsKey(key + "ChatClient")) {
            return chatClients.get(key + "ChatClient");
        }
        if (chatClients.containsKey(key)) {
            return chatClients.get(key);
        }
        ChatClient fallback = chatClients.get(DEFAULT_MODEL + "ChatClient");
        if (fallback != null) {
            return fallback;
        }
        return chatClients.values().stream().findFirst()
                .orElseThrow(() -> new GenerativeCallException("No ChatClient beans are available"));
    }

    static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String s = content.trim();
        if (s.startsWith("```")) {
            int firstNewline = s.indexOf('\n');
            s = firstNewline < 0 ? "" : s.substring(firstNewline + 1);
            int closing = s.lastIndexOf("```");
            if (closing >= 0) {
                s = s.substring(0, closing);
            }
        }
        return s.trim();
    }
}
