package com.phillippitts.streamscribe.service.engine;

import com.phillippitts.streamscribe.exception.EngineInitException;

/**
 * Factory that loads an {@link Engine} from a model file.
 */
@FunctionalInterface
public interface EngineLoader {

    /**
     * Loads the model synchronously.
     *
     * @param modelPath path to the model file
     * @param useGpu    whether the engine may use GPU acceleration
     * @return a ready-to-use engine
     * @throws EngineInitException if the model (or its runtime) cannot be loaded
     */
    Engine open(String modelPath, boolean useGpu);
}
