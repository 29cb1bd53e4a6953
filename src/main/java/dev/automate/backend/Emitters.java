package dev.automate.backend;

import dev.automate.model.Backend;

import java.util.EnumMap;
import java.util.Map;

/**
 * One emitter per strategy.
 */
public final class Emitters {

    private final Map<Backend, StepEmitter> emitters = new EnumMap<>(Backend.class);

    public Emitters() {
        register(new DirectRawEmitter());
        register(new DriverEmitter());
        register(new StreamingEmitter());
        register(new HybridEmitter());
    }

    private void register(StepEmitter emitter) {
        emitters.put(emitter.backend(), emitter);
    }

    public StepEmitter forBackend(Backend backend) {
        StepEmitter emitter = emitters.get(backend);
        if (emitter == null) {
            throw new IllegalArgumentException("No emitter for backend " + backend);
        }
        return emitter;
    }
}
