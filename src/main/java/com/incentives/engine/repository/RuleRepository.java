package com.incentives.engine.repository;

import com.incentives.engine.model.Rule;

import java.util.List;

public interface RuleRepository {
    Rule save(Rule rule);

    /** Rules of the competition in ascending priority. */
    List<Rule> findByCompetitionId(String competitionId);
}
