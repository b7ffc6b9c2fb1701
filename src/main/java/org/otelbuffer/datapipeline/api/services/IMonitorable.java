package org.otelbuffer.datapipeline.api.services;

import java.util.List;
import java.util.Map;

/**
 * A component that reports metrics and transient errors.
 */
public interface IMonitorable {

    /**
     * @return metric name to current value, in a stable order
     */
    Map<String, Number> getMetrics();

    /**
     * @return recorded operational errors, oldest first
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return true if the component is not in an error state and has no recorded errors
     */
    boolean isHealthy();
}
