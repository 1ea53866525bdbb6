package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.Shortlist;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.FundScout.service.TestPrograms.program;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmSelectorTest {

    private JsonChatService chatService;
    private LlmSelector selector;
    private Shortlist shortlist;

    @BeforeEach
    void setUp() {
        chatService = mock(JsonChatService.class);
        selector = new LlmSelector(chatService, new ObjectMapper(), new FundingProperties());
        shortlist = Shortlist.of("robotics", List.of(
                program("Robotics Pilot Fund", "https://a.example"),
                program("InnoTop", "https://b.example"),
                program("Digital Bonus", "https://c.example"),
                program("Climate Start", "https://d.example"),
                program("EFRE Digital", "https://e.example")
        ));
    }

    private void answer(String json) {
        when(chatService.complete(eq("selection"), eq("openai"), anyString(), anyString())).thenReturn(json);
    }

    @Test
    void keepsValidUniqueIdsInPickOrder() {
        answer("""
                {"picks":[
                  {"id":2,"why":"SME innovation in the region"},
                  {"id":2,"why":"repeated"},
                  {"id":9,"why":"out of range"},
                  {"id":0,"why":"out of range"},
                  {"id":"1","why":"robotics pilot lines"}
                ]}""");

        SelectionResult result = selector.select("robotics", shortlist, 3);

        assertThat(result.ids()).containsExactly(2, 1);
        assertThat(result.reasonFor(2)).isEqualTo("SME innovation in the region");
        assertThat(result.degraded()).isFalse();
    }

    @Test
    void capsAtWanted() {
        answer("{\"picks\":[{\"id\":1,\"why\":\"a\"},{\"id\":2,\"why\":\"b\"},{\"id\":3,\"why\":\"c\"}]}");

        assertThat(selector.select("robotics", shortlist, 2).ids()).containsExactly(1, 2);
    }

    @Test
    void sameProgramUnderTwoIdsIsPickedOnce() {
        Shortlist withDuplicate = Shortlist.of("q", List.of(
                program("Robotics Pilot Fund", "https://a.example/fund"),
                program("Robotics Pilot Fund (copy)", "https://A.example/fund/"),
                program("InnoTop", "https://b.example")
        ));
        answer("{\"picks\":[{\"id\":1,\"why\":\"a\"},{\"id\":2,\"why\":\"a again\"},{\"id\":3,\"why\":\"b\"}]}");

        assertThat(selector.select("q", withDuplicate, 3).ids()).containsExactly(1, 3);
    }

    @Test
    void failedCallFallsBackToPositionalIds() {
        when(chatService.complete(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new GenerativeCallException("timed out"));

        SelectionResult result = selector.select("robotics", shortlist, 3);

        assertThat(result.ids()).containsExactly(1, 2, 3);
        assertThat(result.reasons()).isEmpty();
        assertThat(result.degraded()).isTrue();
    }

    @Test
    void malformedOrEmptyAnswerFallsBackToPositionalIds() {
        answer("not json at all");
        assertThat(selector.select("robotics", shortlist, 2).ids()).containsExactly(1, 2);

        answer("{\"picks\":[{\"id\":42,\"why\":\"nope\"}]}");
        assertThat(selector.select("robotics", shortlist, 2).degraded()).isTrue();
    }

    @Test
    void fallbackNeverExceedsShortlistSize() {
        when(chatService.complete(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new GenerativeCallException("down"));
        Shortlist small = Shortlist.of("q", List.of(program("Only", "https://only.example")));

        assertThat(selector.select("q", small, 3).ids()).containsExactly(1);
    }

    @Test
    void emptyShortlistSkipsTheCall() {
        assertThat(selector.select("q", Shortlist.empty("q"), 3).ids()).isEmpty();
        verify(chatService, never()).complete(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void payloadTruncatesLongFields() throws Exception {
        Shortlist longText = Shortlist.of("q", List.of(FundingProgram.builder()
                .name("Long")
                .description("d".repeat(2_000))
                .eligibility("e".repeat(2_000))
                .build()));

        String payload = selector.buildPayload("q", longText, 1);

        assertThat(payload).contains("d".repeat(800)).doesNotContain("d".repeat(801));
        assertThat(payload).contains("e".repeat(400)).doesNotContain("e".repeat(401));
    }
}
