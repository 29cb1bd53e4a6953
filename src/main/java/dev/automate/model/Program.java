package dev.automate.model;

import java.util.List;

/**
 * Everything one compilation consumes: the global default backend, the devices and the
 * step forest.
 */
public record Program(
    Backend backend,
    List<Device> devices,
    List<Step> steps
) {
    public Program {
        devices = devices == null ? List.of() : List.copyOf(devices);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
