package com.phillippitts.visqol.service.engine;

/**
 * Backend selection lifecycle of a {@link VisqolEngine}.
 *
 * <pre>
 * UNINITIALIZED → PROBING → HIGH_FIDELITY
 *                         → APPROXIMATE
 * </pre>
 * Both outcomes are terminal for the lifetime of the engine.
 */
public enum EngineState {
    UNINITIALIZED,
    PROBING,
    HIGH_FIDELITY,
    APPROXIMATE;

    public boolean isTerminal() {
        return this == HIGH_FIDELITY || this == APPROXIMATE;
    }
}
