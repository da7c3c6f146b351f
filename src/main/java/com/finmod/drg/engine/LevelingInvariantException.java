package com.finmod.drg.engine;

/**
 * Internal error: a graph that passed cycle verification could not be ordered
 * when levels were assigned. Reported through the log, never thrown to
 * callers.
 */
public class LevelingInvariantException extends IllegalStateException {

    public LevelingInvariantException(String message) {
        super(message);
    }
}
