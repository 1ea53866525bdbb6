package com.example.FundScout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ranked, size-bounded candidates produced by one pipeline run.
 * Programs carry 1-based ids equal to their position.
 */
public record Shortlist(String query, List<FundingProgram> programs) {

    public Shortlist {
        programs = programs == null ? List.of() : List.copyOf(programs);
    }

    /**
     * Freeze a ranked candidate list, assigning ids 1..n in order.
     */
    public static Shortlist of(String query, List<FundingProgram> ranked) {
        List<FundingProgram> numbered = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            numbered.add(ranked.get(i).withId(i + 1));
        }
        return new Shortlist(query, numbered);
    }

    public static Shortlist empty(String query) {
        return new Shortlist(query, List.of());
    }

    public int size() {
        return programs.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return programs.isEmpty();
    }

    /** Program by 1-based id. */
    public Optional<FundingProgram> byId(int id) {
        if (id < 1 || id > programs.size()) {
            return Optional.empty();
        }
        return Optional.of(programs.get(id - 1));
    }
}
