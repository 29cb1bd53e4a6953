package dev.automate.engine;

import dev.automate.model.Device;
import dev.automate.model.Step;
import dev.automate.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Binds every step of a tree to a concrete device once, before any code is emitted.
 * A step names its device by id or alias; a step that names none inherits its group's
 * device, or the first device at top level.
 */
public final class DeviceBinder {

    private static final Logger log = LoggerFactory.getLogger(DeviceBinder.class);

    private DeviceBinder() {}

    /**
     * Returns the tree with every {@link Step#deviceId()} set to the id of an existing device.
     */
    public static List<Step> bind(List<Step> steps, List<Device> devices) {
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("No devices to bind steps to");
        }
        return bind(steps, devices, devices.get(0));
    }

    private static List<Step> bind(List<Step> steps, List<Device> devices, Device inherited) {
        var bound = new ArrayList<Step>();
        for (Step step : steps) {
            Device device = inherited;
            if (step.deviceId() != null) {
                device = find(step.deviceId(), devices).orElse(null);
                if (device == null) {
                    log.warn("Step '{}' names unknown device '{}'; using '{}'",
                        step.id(), step.deviceId(), inherited.alias());
                    device = inherited;
                }
            }
            Step result = step.withDeviceId(device.id());
            if (step.action() instanceof StepAction.Group group) {
                result = result.withAction(new StepAction.Group(bind(group.children(), devices, device)));
            }
            bound.add(result);
        }
        return bound;
    }

    /** Device whose id, or failing that whose alias, equals {@code reference} ignoring case. */
    public static Optional<Device> find(String reference, List<Device> devices) {
        for (Device device : devices) {
            if (device.id().equalsIgnoreCase(reference)) {
                return Optional.of(device);
            }
        }
        for (Device device : devices) {
            if (device.alias() != null && device.alias().equalsIgnoreCase(reference)) {
                return Optional.of(device);
            }
        }
        return Optional.empty();
    }
}
