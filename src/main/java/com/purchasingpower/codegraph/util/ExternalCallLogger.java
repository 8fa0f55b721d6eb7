package com.purchasingpower.codegraph.util;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls into the entity store and the file system.
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }
}
