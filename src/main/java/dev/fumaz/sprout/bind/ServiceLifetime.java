package dev.fumaz.sprout.bind;

/**
 * Controls how often a registered service is instantiated.
 */
public enum ServiceLifetime {

    /**
     * A new instance is produced every time the service is requested.
     */
    TRANSIENT,

    /**
     * One instance is produced per {@link dev.fumaz.sprout.scope.ActivationScope}.
     */
    SCOPED,

    /**
     * One instance is produced per {@link dev.fumaz.sprout.container.ServiceProvider}.
     */
    SINGLETON

}
