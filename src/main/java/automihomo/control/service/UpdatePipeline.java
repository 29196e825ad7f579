package automihomo.control.service;

import automihomo.control.model.RunResult;

/**
 * One execution of the external refresh pipeline.
 * Implementations report every outcome as a {@link RunResult} instead of throwing.
 */
@FunctionalInterface
public interface UpdatePipeline {

    RunResult run();
}
