package com.harden.core.logging;

import com.harden.core.model.Stage;
import org.slf4j.MDC;

/**
 * Utility for managing the pipeline's MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String UNIT = "unit";
    public static final String STAGE = "stage";

    private MdcContext() {}

    public static void setUnit(String unitName, Stage stage) {
        MDC.put(UNIT, unitName);
        MDC.put(STAGE, stage.wireName());
    }

    public static void clear() {
        MDC.remove(UNIT);
        MDC.remove(STAGE);
    }
}
