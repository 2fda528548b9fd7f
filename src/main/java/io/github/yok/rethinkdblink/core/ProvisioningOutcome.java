package io.github.yok.rethinkdblink.core;

/**
 * Classification of one provisioning step.
 */
public enum ProvisioningOutcome {

    /** The entity was present before the step ran; nothing was created. */
    ALREADY_EXISTED,

    /** The entity was absent and this session created it. */
    CREATED,

    /** Listing or creating failed; the step was logged and the session continued. */
    FAILED,

    /** The step did not run. */
    SKIPPED
}
