package com.example.FundScout.model;

import com.example.FundScout.util.FieldPresence;
import com.example.FundScout.util.ProgramNames;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One funding program candidate.
 *
 * id             - 1-based position within the shortlist that carries it (null before the shortlist exists)
 * deadline       - raw deadline text as published
 * deadlineDate   - parsed deadline in UTC, null when unparseable
 * daysLeft       - whole days until deadlineDate, null when deadlineDate is null
 * relevanceScore - heuristic score in [0, 100]
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FundingProgram(
        Integer id,
        String name,
        String title,
        String domain,
        String description,
        String eligibility,
        String amount,
        String deadline,
        OffsetDateTime deadlineDate,
        Long daysLeft,
        String location,
        String contact,
        String procedure,
        String url,
        String source,
        int relevanceScore
) {

    /** Attribute keys shared by the vector metadata, the catalog CSV and field backfill. */
    public static final String NAME = "name";
    public static final String TITLE = "title";
    public static final String DOMAIN = "domain";
    public static final String DESCRIPTION = "description";
    public static final String ELIGIBILITY = "eligibility";
    public static final String AMOUNT = "amount";
    public static final String DEADLINE = "deadline";
    public static final String LOCATION = "location";
    public static final String CONTACT = "contact";
    public static final String PROCEDURE = "procedure";
    public static final String URL = "url";
    public static final String SOURCE = "source";

    /**
     * Build a program from a flat metadata/catalog row. The first present of the
     * name-like columns (name, title, program, call, ...) becomes {@code name}.
     */
    public static FundingProgram fromAttributes(Map<String, String> row) {
        return FundingProgram.builder()
                .name(ProgramNames.fusedRawName(row).orElse(null))
                .title(row.get(TITLE))
                .domain(row.get(DOMAIN))
                .description(row.get(DESCRIPTION))
                .eligibility(row.get(ELIGIBILITY))
                .amount(row.get(AMOUNT))
                .deadline(row.get(DEADLINE))
                .location(row.get(LOCATION))
                .contact(row.get(CONTACT))
                .procedure(row.get(PROCEDURE))
                .url(row.get(URL))
                .source(row.get(SOURCE))
                .build();
    }

    /** Text attributes keyed like the catalog columns; absent values map to null. */
    public Map<String, String> attributes() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(NAME, name);
        map.put(TITLE, title);
        map.put(DOMAIN, domain);
        map.put(DESCRIPTION, description);
        map.put(ELIGIBILITY, eligibility);
        map.put(AMOUNT, amount);
        map.put(DEADLINE, deadline);
        map.put(LOCATION, location);
        map.put(CONTACT, contact);
        map.put(PROCEDURE, procedure);
        map.put(URL, url);
        map.put(SOURCE, source);
        return map;
    }

    @JsonIgnore
    public String displayName() {
        return ProgramNames.displayName(url, name, title);
    }

    @JsonIgnore
    public String normalizedName() {
        return ProgramNames.normalizedName(url, name, title);
    }

    @JsonIgnore
    public String dedupeKey() {
        return ProgramNames.dedupeKey(url, name, title);
    }

    @JsonIgnore
    public boolean hasUrl() {
        return FieldPresence.isPresent(url);
    }

    public FundingProgram withId(int newId) {
        return toBuilder().id(newId).build();
    }
}
