package com.relay.notification.engine.dimensions;

import com.relay.notification.engine.RelevanceDimension;
import com.relay.notification.model.ContextSnapshot;
import com.relay.notification.model.DimensionType;
import com.relay.notification.model.Notification;
import com.relay.notification.model.NotificationMetadata;
import com.relay.notification.model.NotificationType;
import com.relay.notification.model.WorkflowContext;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Component
public class WorkflowPhaseDimension implements RelevanceDimension {

    @Override
    public DimensionType getDimensionType() {
        return DimensionType.WORKFLOW_PHASE;
    }

    @Override
    public double score(Notification notification, ContextSnapshot context) {
        WorkflowContext workflow = context.getWorkflow();
        if (workflow == null) {
            return 0.0;
        }

        double score = 0.0;
        NotificationMetadata metadata = notification.getMetadata();
        NotificationType type = notification.getType();

        if (metadata.getWorkflowId() != null && Objects.equals(metadata.getWorkflowId(), workflow.getWorkflowId())) {
            score += 0.9;
        }
        if (metadata.getPhase() != null && Objects.equals(metadata.getPhase(), workflow.getPhase())) {
            score += 0.7;
        }

        if (workflow.hasStatus("running") && type == NotificationType.INFO) {
            score += 0.6;
        } else if (workflow.hasStatus("failed") && type == NotificationType.ERROR) {
            score += 0.8;
        } else if (workflow.hasStatus("completed") && type == NotificationType.SUCCESS) {
            score += 0.7;
        }

        // near completion / just started
        if (workflow.getProgress() > 0.8 && type == NotificationType.SUCCESS) {
            score += 0.5;
        } else if (workflow.getProgress() < 0.2 && type == NotificationType.WARNING) {
            score += 0.4;
        }
        return score;
    }
}
