package de.netcompliance.core.repository;

import de.netcompliance.core.model.Rule;

import java.util.Optional;

public interface RuleRepository {

    Optional<Rule> findRule(final String ruleId);
}
