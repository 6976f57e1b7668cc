package de.netcompliance.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import de.netcompliance.core.model.Rule;
import de.netcompliance.core.repository.RuleRepository;
import de.netcompliance.util.yaml.YamlUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Slf4j
public class YamlRuleRepository implements RuleRepository {

    private final Map<String, Rule> rules = new LinkedHashMap<>();

    public YamlRuleRepository(final InputStream content) {
        List<Rule> loaded = YamlUtil.load(content, new TypeReference<>() {
        });
        if (Objects.nonNull(loaded)) {
            loaded.forEach(rule -> rules.put(rule.getId(), rule));
        }
        log.info("Loaded {} rule(s)", rules.size());
    }

    @Override
    public Optional<Rule> findRule(final String ruleId) {
        return Optional.ofNullable(ruleId).map(rules::get);
    }

    public Collection<Rule> findAll() {
        return List.copyOf(rules.values());
    }
}
