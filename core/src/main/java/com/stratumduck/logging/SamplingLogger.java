package com.stratumduck.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for sampling invocations.
 *
 * <p>Each invocation gets an id that is put into the SLF4J MDC under
 * {@code invocationId}, together with the pass currently running under
 * {@code stage}, so every log line emitted while the invocation runs (including
 * backend and runtime lines) can be correlated. Always call
 * {@link #clearContext()} in a finally block.
 *
 * <pre>
 *   SamplingLogger.startInvocation(id, "main.sales", "main.sales_sample");
 *   try {
 *       ...
 *       SamplingLogger.logStage("label", elapsedMs);
 *   } finally {
 *       SamplingLogger.clearContext();
 *   }
 * </pre>
 */
public final class SamplingLogger {

    private static final Logger logger = LoggerFactory.getLogger(SamplingLogger.class);

    public static final String MDC_INVOCATION_ID = "invocationId";
    public static final String MDC_STAGE = "stage";

    private SamplingLogger() {}

    public static void startInvocation(String invocationId, String source, String output) {
        MDC.put(MDC_INVOCATION_ID, invocationId);
        logger.info("Sampling {} into {}", source, output);
    }

    /**
     * Marks the pass that is about to run.
     */
    public static void enterStage(String stage) {
        MDC.put(MDC_STAGE, stage);
    }

    public static void logStage(String stage, long elapsedMs) {
        logger.debug("Stage {} finished in {} ms", stage, elapsedMs);
    }

    public static void completeInvocation(long outputRows, long totalMs) {
        MDC.remove(MDC_STAGE);
        logger.info("Sampling complete: {} rows in {} ms", outputRows, totalMs);
    }

    public static void logError(Throwable error) {
        String stage = MDC.get(MDC_STAGE);
        logger.error("Sampling failed during stage {}: {}", stage != null ? stage : "validation",
            error.getMessage());
    }

    public static void clearContext() {
        MDC.remove(MDC_INVOCATION_ID);
        MDC.remove(MDC_STAGE);
    }
}
