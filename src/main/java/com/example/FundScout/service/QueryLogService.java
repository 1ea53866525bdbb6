package com.example.FundScout.service;

import com.example.FundScout.model.QueryLog;
import com.example.FundScout.model.SelectionResult;
import com.example.FundScout.model.Shortlist;
import com.example.FundScout.repository.QueryLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class QueryLogService {

    private static final Logger log = LoggerFactory.getLogger(QueryLogService.class);

    private final QueryLogRepository queryLogRepository;
    private final ObjectMapper objectMapper;

    public void recordQuery(String sessionId,
                            String model,
                            String query,
                            Shortlist shortlist,
                            SelectionResult selection) {
        QueryLog queryLog = new QueryLog();
        queryLog.setSessionId(sessionId);
        queryLog.setModel(model);
        queryLog.setQuery(query);
        queryLog.setShortlistJson(serializeShortlist(shortlist));
        queryLog.setSelectedIds(selection.ids().stream().map(String::valueOf).collect(Collectors.joining(",")));
        queryLog.setDegraded(selection.degraded());

        queryLogRepository.save(queryLog);
    }

    private String serializeShortlist(Shortlist shortlist) {
        if (shortlist == null || shortlist.isEmpty()) {
            return "[]";
        }
        try {
            return objectMapper.writeValueAsString(shortlist.programs());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize shortlist for query log", e);
            return "[]";
        }
    }
}
