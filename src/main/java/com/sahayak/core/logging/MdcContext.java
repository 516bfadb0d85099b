package com.sahayak.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Sahayak-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String USER_ID = "userId";
    public static final String PLAN_ID = "planId";

    private MdcContext() {}

    public static void setUser(String userId) {
        MDC.put(USER_ID, userId);
    }

    public static void setPlan(String userId, String planId) {
        MDC.put(USER_ID, userId);
        MDC.put(PLAN_ID, planId);
    }

    public static void clearPlan() {
        MDC.remove(PLAN_ID);
    }

    public static void clear() {
        MDC.remove(USER_ID);
        MDC.remove(PLAN_ID);
    }
}
