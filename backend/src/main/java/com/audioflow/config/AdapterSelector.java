package com.audioflow.config;

/**
 * Startup-time choice between simulated and real adapters. Changing the inputs requires a restart.
 */
public final class AdapterSelector {

    private AdapterSelector() {
    }

    public static AdapterKind transport(AppProperties properties) {
        return properties.testMode() ? AdapterKind.SIMULATED : AdapterKind.REAL;
    }

    public static AdapterKind recognition(AppProperties properties) {
        return properties.azure() != null && properties.azure().isConfigured()
                ? AdapterKind.REAL
                : AdapterKind.SIMULATED;
    }
}
