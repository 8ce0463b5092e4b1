package com.rotseproc.core.exception;

/**
 * A stage's required parameter is absent or malformed. Raised at pipeline-build time or at stage
 * entry; never recovered by substituting a default.
 */
public class ConfigurationException extends RotseProcException {
    private final String parameter;

    public ConfigurationException(String stageName, String parameter, String message) {
        super(stageName, message);
        this.parameter = parameter;
    }

    public static ConfigurationException missing(String stageName, String parameter) {
        return new ConfigurationException(stageName, parameter,
            "Stage '" + stageName + "' requires parameter '" + parameter + "'");
    }

    public static ConfigurationException unrecognized(String stageName, String parameter) {
        return new ConfigurationException(stageName, parameter,
            "Stage '" + stageName + "' does not recognize parameter '" + parameter + "'");
    }

    public static ConfigurationException invalid(String stageName, String parameter, String detail) {
        return new ConfigurationException(stageName, parameter,
            "Stage '" + stageName + "' parameter '" + parameter + "' is invalid: " + detail);
    }

    /** Offending parameter key, or null for a whole missing block. */
    public String parameter() {
        return parameter;
    }
}
