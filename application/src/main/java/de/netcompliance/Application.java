package de.netcompliance;

import de.netcompliance.repository.WorkflowCatalog;
import de.netcompliance.repository.YamlDeviceInventory;
import de.netcompliance.repository.YamlRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class Application implements CommandLineRunner {

    private final YamlDeviceInventory deviceInventory;
    private final YamlRuleRepository ruleRepository;
    private final WorkflowCatalog workflowCatalog;

    public Application(final YamlDeviceInventory deviceInventory,
                       final YamlRuleRepository ruleRepository,
                       final WorkflowCatalog workflowCatalog) {
        this.deviceInventory = deviceInventory;
        this.ruleRepository = ruleRepository;
        this.workflowCatalog = workflowCatalog;
    }

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    @Override
    public void run(String... args) {
        log.info("Ready: {} device(s), {} rule(s), {} workflow(s)",
                deviceInventory.findAll().size(),
                ruleRepository.findAll().size(),
                workflowCatalog.findAll().size());
    }
}
