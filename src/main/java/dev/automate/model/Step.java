package dev.automate.model;

import java.util.List;

/**
 * A node of the step tree. Only {@link StepAction.Group} steps have children.
 */
public record Step(
    String id,
    String label,
    String deviceId, // nullable until bound, explicit device binding by id or alias
    Route route,     // nullable, explicit sub-backend for hybrid devices
    StepAction action
) {
    public StepKind kind() {
        return action.kind();
    }

    public List<Step> children() {
        return action instanceof StepAction.Group group ? group.children() : List.of();
    }

    public Step withDeviceId(String newDeviceId) {
        return new Step(id, label, newDeviceId, route, action);
    }

    public Step withAction(StepAction newAction) {
        return new Step(id, label, deviceId, route, newAction);
    }
}
