package com.example.workflowengine.api.v1.dto;

import java.util.List;

public record ExecutionListResponse(List<ExecutionResponse> executions) {}
