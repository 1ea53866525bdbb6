package com.example.FundScout.model;

import java.util.List;
import java.util.Map;

/**
 * Partial-success result of a fan-out search.
 *
 * programs       - ranked, deduplicated programs from every source that answered
 * countsBySource - raw hit count per answering source
 * failures       - source name -> failure message for sources that errored or timed out
 */
public record SourceSearchAggregate(
        List<FundingProgram> programs,
        Map<String, Integer> countsBySource,
        Map<String, String> failures
) {

    public SourceSearchAggregate {
        programs = programs == null ? List.of() : List.copyOf(programs);
        countsBySource = countsBySource == null ? Map.of() : Map.copyOf(countsBySource);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }
}
