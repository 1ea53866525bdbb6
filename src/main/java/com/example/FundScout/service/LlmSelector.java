package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.Shortlist;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lets the chat model pick the best programs from a shortlist, grounded only in the
 * supplied fields. Any failure or an answer without usable ids falls back to the
 * first {@code min(wanted, shortlist size)} ids.
 */
@Service
@RequiredArgsConstructor
public class LlmSelector {

    private static final Logger log = LoggerFactory.getLogger(LlmSelector.class);

    static final String CALL_NAME = "selection";

    static final int DESCRIPTION_LIMIT = 800;
    static final int ELIGIBILITY_LIMIT = 400;
    static final int REASON_LIMIT = 300;

    private static final String SYSTEM = """
            You select public funding programs for a company.
            Use ONLY the fields provided for each program. Never invent programs, amounts, dates, URLs or contacts.
            Answer with a single JSON object and nothing else.""";

    private final JsonChatService chatService;
    private final ObjectMapper objectMapper;
    private final FundingProperties properties;

    public SelectionResult select(String query, Shortlist shortlist, int wanted) {
        if (shortlist == null || shortlist.isEmpty() || wanted <= 0) {
            return SelectionResult.empty();
        }
        try {
            String answer = chatService.complete(
                    CALL_NAME, properties.getSelectionModel(), SYSTEM, buildPayload(query, shortlist, wanted));
            SelectionResult result = parse(answer, shortlist, wanted);
            if (result.size() == 0) {
                log.warn("Selector answered without usable ids; using positional fallback");
                return SelectionResult.positional(wanted, shortlist.size());
            }
            log.debug("Selector picked ids {}", result.ids());
            return result;
        } catch (GenerativeCallException | JsonProcessingException e) {
            log.warn("Selection failed, using positional fallback: {}", e.getMessage());
            return SelectionResult.positional(wanted, shortlist.size());
        }
    }

    String buildPayload(String query, Shortlist shortlist, int wanted) throws JsonProcessingException {
        List<Map<String, Object>> items = new ArrayList<>();
        for (FundingProgram p : shortlist.programs()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", p.id());
            item.put("name", p.displayName());
            item.put("title", nullToEmpty(p.title()));
            item.put("domain", nullToEmpty(p.domain()));
            item.put("description", truncate(p.description(), DESCRIPTION_LIMIT));
            item.put("eligibility", truncate(p.eligibility(), ELIGIBILITY_LIMIT));
            item.put("amount", nullToEmpty(p.amount()));
            item.put("deadline", nullToEmpty(p.deadline()));
            item.put("location", nullToEmpty(p.location()));
            item.put("source", nullToEmpty(p.source()));
            item.put("url", nullToEmpty(p.url()));
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("wanted", wanted);
        payload.put("instructions", List.of(
                "Pick at most " + wanted + " programs that best fit the query.",
                "Each pick must be a different program: no repeated id, name, source or url.",
                "For each pick give a short reason citing concrete words from its fields.",
                "Respond exactly as {\"picks\":[{\"id\": <int>, \"why\": \"<reason>\"}]}."
        ));
        payload.put("programs", items);
        return objectMapper.writeValueAsString(payload);
    }

    /**
     * Keeps ids within [1, shortlist size], drops repeated ids and repeated programs
     * (same dedupe key), caps at {@code wanted}.
     */
    SelectionResult parse(String answer, Shortlist shortlist, int wanted) throws JsonProcessingException {
        JsonNode picks = objectMapper.readTree(answer).path("picks");
        if (!picks.isArray()) {
            return SelectionResult.empty();
        }
        List<Integer> ids = new ArrayList<>();
        Map<Integer, String> reasons = new LinkedHashMap<>();
        Set<String> seenKeys = new HashSet<>();

        for (JsonNode pick : picks) {
            if (ids.size() >= wanted) {
                break;
            }
            int id = idOf(pick.path("id"));
            if (id < 1 || id > shortlist.size() || ids.contains(id)) {
                continue;
            }
            String key = shortlist.byId(id).map(FundingProgram::dedupeKey).orElse("");
            if (!seenKeys.add(key)) {
                continue;
            }
            ids.add(id);
            reasons.put(id, truncate(pick.path("why").asText(""), REASON_LIMIT));
        }
        return new SelectionResult(ids, reasons, false);
    }

    /** Integral or numeric-text id; 0 (never valid) otherwise. */
    static int idOf(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    static String truncate(String value, int limit) {
        if (value == null) {
            return "";
        }
        String s = value.trim();
        return s.length() <= limit ? s : s.substring(0, limit);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
