package de.netcompliance.repository;

import de.netcompliance.core.model.Workflow;

import java.util.Collection;
import java.util.Optional;

public interface WorkflowCatalog {

    Optional<Workflow> findWorkflow(final String name);

    Collection<Workflow> findAll();
}
