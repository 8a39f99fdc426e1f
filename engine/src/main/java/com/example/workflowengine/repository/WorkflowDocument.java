package com.example.workflowengine.repository;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * JPA entity holding one workflow definition.
 * <p>
 * The whole workflow (components, connections, config) is stored as JSON in {@code document_json};
 * name and timestamps are duplicated into columns for listing.
 * </p>
 */
@Entity
@Table(name = "workflow_document")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WorkflowDocument {

    @Id
    @Column(length = 255)
    private String id;

    @Column(length = 255)
    private String name;

    @Column(name = "document_json", nullable = false, columnDefinition = "CLOB")
    private String documentJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public WorkflowDocument(String id, String name, String documentJson, Instant createdAt, Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.documentJson = Objects.requireNonNull(documentJson, "documentJson");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    }
}
