package com.example.FundScout.service;

import com.example.FundScout.config.FundingProperties;
import com.example.FundScout.model.Enrichment;
import com.example.FundScout.model.Enrichment.ProgramEnrichment;
import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.Shortlist;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes a grounded brief and up to three next steps per selected program.
 * On any failure every requested id gets an empty brief and no steps.
 */
@Service
@RequiredArgsConstructor
public class LlmEnricher {

    private static final Logger log = LoggerFactory.getLogger(LlmEnricher.class);

    static final String CALL_NAME = "enrichment";

    static final int DESCRIPTION_LIMIT = 800;
    static final int ELIGIBILITY_LIMIT = 500;
    static final int PROCEDURE_LIMIT = 500;
    static final int BRIEF_LIMIT = 600;
    static final int MAX_STEPS = 3;

    private static final String SYSTEM = """
            You summarize public funding programs.
            Use ONLY the fields provided. Never invent URLs, e-mail addresses, phone numbers or contacts.
            Answer with a single JSON object and nothing else.""";

    private final JsonChatService chatService;
    private final ObjectMapper objectMapper;
    private final FundingProperties properties;

    public Enrichment enrich(List<Integer> ids, Shortlist shortlist) {
        if (ids == null || ids.isEmpty()) {
            return Enrichment.empty();
        }
        try {
            String answer = chatService.complete(
                    CALL_NAME, properties.getEnrichmentModel(), SYSTEM, buildPayload(ids, shortlist));
            Enrichment enrichment = parse(answer, ids);
            log.debug("Enriched {} of {} selected programs", enrichment.items().size(), ids.size());
            return enrichment;
        } catch (GenerativeCallException | JsonProcessingException e) {
            log.warn("Enrichment failed, returning blank briefs: {}", e.getMessage());
            return Enrichment.blank(ids);
        }
    }

    String buildPayload(List<Integer> ids, Shortlist shortlist) throws JsonProcessingException {
        List<Map<String, Object>> items = new ArrayList<>();
        for (Integer id : ids) {
            Optional<FundingProgram> program = shortlist.byId(id);
            if (program.isEmpty()) {
                continue;
            }
            FundingProgram p = program.get();
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", id);
            item.put("name", p.displayName());
            item.put("description", LlmSelector.truncate(p.description(), DESCRIPTION_LIMIT));
            item.put("eligibility", LlmSelector.truncate(p.eligibility(), ELIGIBILITY_LIMIT));
            item.put("procedure", LlmSelector.truncate(p.procedure(), PROCEDURE_LIMIT));
            item.put("amount", p.amount() == null ? "" : p.amount());
            item.put("deadline", p.deadline() == null ? "" : p.deadline());
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("instructions", List.of(
                "brief: 1-2 sentences on what the program funds. Do not repeat eligibility or domain.",
                "next_steps: up to 3 steps, each at most 12 words, based on procedure or eligibility when given, generic otherwise.",
                "Respond exactly as {\"items\":[{\"id\": <int>, \"brief\": \"...\", \"next_steps\": [\"...\"]}]}."
        ));
        payload.put("programs", items);
        return objectMapper.writeValueAsString(payload);
    }

    /**
     * Keeps only requested ids; caps the brief and the step count. Requested ids the
     * answer skipped get a blank entry.
     */
    Enrichment parse(String answer, List<Integer> ids) throws JsonProcessingException {
        Set<Integer> requested = new LinkedHashSet<>(ids);
        Map<Integer, ProgramEnrichment> out = new LinkedHashMap<>();

        JsonNode items = objectMapper.readTree(answer).path("items");
        if (items.isArray()) {
            for (JsonNode item : items) {
                int id = LlmSelector.idOf(item.path("id"));
                if (!requested.contains(id) || out.containsKey(id)) {
                    continue;
                }
                String brief = LlmSelector.truncate(item.path("brief").asText(""), BRIEF_LIMIT);
                List<String> steps = new ArrayList<>();
                for (JsonNode step : item.path("next_steps")) {
                    String text = step.asText("").trim();
                    if (!text.isEmpty() && steps.size() < MAX_STEPS) {
                        steps.add(text);
                    }
                }
                out.put(id, new ProgramEnrichment(brief, steps));
            }
        }
        for (Integer id : requested) {
            out.putIfAbsent(id, ProgramEnrichment.BLANK);
        }
        return new Enrichment(out, false);
    }
}
