package com.example.FundScout.controller;

import com.example.FundScout.model.ComprehensiveSearchRequest;
import com.example.FundScout.model.FundingQueryRequest;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.model.SourceSearchAggregate;
import com.example.FundScout.service.ComprehensiveSearchService;
import com.example.FundScout.service.FundingShortlistService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/funding")
@RequiredArgsConstructor
public class FundingSearchController {

    private final FundingShortlistService shortlistService;
    private final ComprehensiveSearchService comprehensiveSearchService;

    /**
     * Simple mode: only the query, defaults for everything else.
     *   GET /api/funding/shortlist?q=robotics startup in Mainz
     */
    @GetMapping("/shortlist")
    public Shortlist shortlistByQueryParam(@RequestParam("q") String query) {
        return shortlistService.shortlist(FundingQueryRequest.of(query));
    }

    /**
     * Advanced mode with scoring inputs and size overrides:
     *   POST /api/funding/shortlist
     *   {
     *     "query": "AI platform for SMEs",
     *     "fundingNeed": 100000,
     *     "targetDomain": "digital",
     *     "location": "Rhineland-Palatinate",
     *     "want": 5
     *   }
     */
    @PostMapping("/shortlist")
    public Shortlist shortlistByBody(@RequestBody FundingQueryRequest request) {
        return shortlistService.shortlist(request);
    }

    @PostMapping("/search/comprehensive")
    public SourceSearchAggregate comprehensiveSearch(@RequestBody ComprehensiveSearchRequest request) {
        return comprehensiveSearchService.search(request);
    }
}
