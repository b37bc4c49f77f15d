package com.stratumduck.sampling;

/**
 * Settings for the sampling engine.
 *
 * <p>Defaults can be overridden with system properties:
 * <ul>
 *   <li>{@code stratumduck.staging.prefix}: prefix of staging relation names
 *       (default {@code __strat_})</li>
 *   <li>{@code stratumduck.verify.draws}: whether the with-replacement path
 *       verifies that every draw resolved to a row (default {@code true})</li>
 * </ul>
 * Invalid values fall back to the defaults.
 */
public final class SamplerConfig {

    public static final String PROP_STAGING_PREFIX = "stratumduck.staging.prefix";
    public static final String PROP_VERIFY_DRAWS = "stratumduck.verify.draws";

    public static final String DEFAULT_STAGING_PREFIX = "__strat_";
    public static final boolean DEFAULT_VERIFY_DRAWS = true;

    private final String stagingPrefix;
    private final boolean verifyDraws;

    private SamplerConfig(String stagingPrefix, boolean verifyDraws) {
        this.stagingPrefix = stagingPrefix;
        this.verifyDraws = verifyDraws;
    }

    /**
     * Returns the built-in defaults, ignoring system properties.
     */
    public static SamplerConfig defaults() {
        return new SamplerConfig(DEFAULT_STAGING_PREFIX, DEFAULT_VERIFY_DRAWS);
    }

    /**
     * Returns the defaults overridden by any system properties that are set.
     */
    public static SamplerConfig fromSystemProperties() {
        return new SamplerConfig(getConfiguredPrefix(), getConfiguredVerifyDraws());
    }

    public SamplerConfig withStagingPrefix(String prefix) {
        if (!isValidPrefix(prefix)) {
            throw new IllegalArgumentException("Invalid staging prefix: " + prefix);
        }
        return new SamplerConfig(prefix, verifyDraws);
    }

    public SamplerConfig withVerifyDraws(boolean verify) {
        return new SamplerConfig(stagingPrefix, verify);
    }

    public String stagingPrefix() {
        return stagingPrefix;
    }

    public boolean verifyDraws() {
        return verifyDraws;
    }

    // ========== Configuration Helpers ==========

    private static String getConfiguredPrefix() {
        String value = System.getProperty(PROP_STAGING_PREFIX);
        if (value != null && isValidPrefix(value)) {
            return value;
        }
        return DEFAULT_STAGING_PREFIX;
    }

    private static boolean getConfiguredVerifyDraws() {
        String value = System.getProperty(PROP_VERIFY_DRAWS);
        if (value != null) {
            String normalized = value.trim().toLowerCase();
            if (normalized.equals("true") || normalized.equals("false")) {
                return Boolean.parseBoolean(normalized);
            }
            // Ignore, use default
        }
        return DEFAULT_VERIFY_DRAWS;
    }

    private static boolean isValidPrefix(String prefix) {
        return prefix != null && prefix.matches("[A-Za-z_][A-Za-z0-9_]*");
    }

    @Override
    public String toString() {
        return String.format("SamplerConfig(stagingPrefix=%s, verifyDraws=%s)", stagingPrefix, verifyDraws);
    }
}
