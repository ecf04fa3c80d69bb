package io.lemon.core.exception;

import java.io.Serial;
import java.util.Map;

public class WorkflowNotFoundException extends LemonException {
    @Serial private static final long serialVersionUID = -2719058434460131387L;

    private final String workflowId;

    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId, Map.of("workflow_id", String.valueOf(workflowId)));
        this.workflowId = workflowId;
    }

    public String getWorkflowId() {
        return workflowId;
    }
}
