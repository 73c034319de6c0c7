package com.heronix.assignment.model.enums;

/**
 * Provider quota classes. Each class has its own per-minute ceiling.
 */
public enum RateClass {

    PATCH(20),

    POST(25);

    private final int providerLimitPerMinute;

    RateClass(int providerLimitPerMinute) {
        this.providerLimitPerMinute = providerLimitPerMinute;
    }

    public int getProviderLimitPerMinute() {
        return providerLimitPerMinute;
    }
}
