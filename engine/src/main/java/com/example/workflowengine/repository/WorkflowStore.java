package com.example.workflowengine.repository;

import com.example.workflowengine.domain.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for workflow definitions, one document per workflow id.
 */
public interface WorkflowStore {

    /**
     * Inserts or replaces the workflow with the same id.
     */
    Workflow save(Workflow workflow);

    Optional<Workflow> load(String id);

    /**
     * @return true if a workflow was deleted
     */
    boolean delete(String id);

    List<Workflow> list();
}
