package com.example.FundScout.service;

import com.example.FundScout.model.FundingProgram;
import com.example.FundScout.model.SearchCriteria;

import java.util.List;

/**
 * One independently searchable origin of funding programs in comprehensive mode.
 * Implementations may block; they run on their own worker.
 */
public interface FundingSource {

    String name();

    List<FundingProgram> search(SearchCriteria criteria, int limit);
}
