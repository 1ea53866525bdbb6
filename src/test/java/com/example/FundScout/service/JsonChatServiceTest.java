package com.example.FundScout.service;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class JsonChatServiceTest {

    private final ChatClient openai = mock(ChatClient.class);
    private final ChatClient deepseek = mock(ChatClient.class);
    private final ResilientCallExecutor executor = mock(ResilientCallExecutor.class);

    @Test
    void resolvesClientByModelKey() {
        JsonChatService service = new JsonChatService(
                Map.of("openaiChatClient", openai, "deepseekChatClient", deepseek), executor);

        assertThat(service.resolveClient("DeepSeek")).isSameAs(deepseek);
        assertThat(service.resolveClient(null)).isSameAs(openai);
        assertThat(service.resolveClient("unknown")).isSameAs(openai);
    }

    @Test
    void fallsBackToAnyClientAndFailsWhenThereIsNone() {
        JsonChatService single = new JsonChatService(Map.of("defaultChatClient", deepseek), executor);
        JsonChatService none = new JsonChatService(Map.of(), executor);

        assertThat(single.resolveClient("openai")).isSameAs(deepseek);
        assertThatThrownBy(() -> none.resolveClient("openai")).isInstanceOf(GenerativeCallException.class);
    }

    @Test
    void stripsMarkdownFences() {
        assertThat(JsonChatService.stripCodeFence("```json\n{\"picks\":[]}\n```")).isEqualTo("{\"picks\":[]}");
        assertThat(JsonChatService.stripCodeFence("  {\"items\":[]} ")).isEqualTo("{\"items\":[]}");
        assertThat(JsonChatService.stripCodeFence(null)).isEmpty();
    }
}
