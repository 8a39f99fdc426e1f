package com.example.workflowengine.repository;

import com.example.workflowengine.domain.Workflow;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link WorkflowStore} keeping each workflow as a JSON document in {@code workflow_document}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaWorkflowStore implements WorkflowStore {

    private final WorkflowDocumentRepository repository;
    private final JsonMapper jsonMapper;

    @Override
    @Transactional
    public Workflow save(Workflow workflow) {
        Instant now = Instant.now();
        Workflow stamped = workflow.withTimestamps(
                workflow.createdAt() != null ? workflow.createdAt() : now,
                workflow.updatedAt() != null ? workflow.updatedAt() : now);
        repository.save(new WorkflowDocument(
                stamped.id(),
                stamped.name(),
                write(stamped),
                stamped.createdAt(),
                stamped.updatedAt()));
        log.debug("Saved workflow id={} components={} connections={}",
                stamped.id(), stamped.components().size(), stamped.connections().size());
        return stamped;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Workflow> load(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findById(id).map(this::read);
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        if (id == null || !repository.existsById(id)) {
            return false;
        }
        repository.deleteById(id);
        log.debug("Deleted workflow id={}", id);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Workflow> list() {
        return repository.findAllByOrderByCreatedAtAsc().stream()
                .map(this::read)
                .toList();
    }

    private String write(Workflow workflow) {
        try {
            return jsonMapper.writeValueAsString(workflow);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow " + workflow.id(), e);
        }
    }

    private Workflow read(WorkflowDocument document) {
        try {
            return jsonMapper.readValue(document.getDocumentJson(), Workflow.class);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to deserialize workflow " + document.getId(), e);
        }
    }
}
