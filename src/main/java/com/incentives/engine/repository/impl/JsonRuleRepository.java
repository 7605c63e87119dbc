package com.incentives.engine.repository.impl;

import com.incentives.engine.model.Rule;
import com.incentives.engine.repository.RuleRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;

@Repository
public class JsonRuleRepository extends JsonDocumentStore<Rule> implements RuleRepository {

    public JsonRuleRepository(@Value("${incentives.storage.root:./data}") String storageRoot) {
        super(Paths.get(storageRoot, "rules").toString(), Rule.class);
    }

    @Override
    protected String partitionOf(Rule rule) {
        return rule.getCompetitionId();
    }

    @Override
    protected String idOf(Rule rule) {
        return rule.getId();
    }

    @Override
    public Rule save(Rule rule) {
        if (rule == null || rule.getId() == null || rule.getCompetitionId() == null) {
            throw new IllegalArgumentException("Rule id and competitionId are required");
        }
        if (rule.getConfig() == null) {
            throw new IllegalArgumentException("Rule " + rule.getId() + " has no config");
        }
        return put(rule);
    }

    @Override
    public List<Rule> findByCompetitionId(String competitionId) {
        return list(competitionId).stream()
            .sorted(Comparator.comparingInt(Rule::getPriority))
            .toList();
    }
}
