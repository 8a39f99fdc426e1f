package com.example.workflowengine.repository;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowDocumentRepository extends JpaRepository<WorkflowDocument, String> {

    List<WorkflowDocument> findAllByOrderByCreatedAtAsc();
}
