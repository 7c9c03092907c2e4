package com.labpulse.driver;

import com.labpulse.model.MonitorState;

import java.util.List;

/**
 * Implemented by drivers that can list individually monitored items with an up/down state.
 */
public interface MonitorListing {

    /**
     * @return monitored items as currently reported by the service
     * @throws DriverException if the service cannot be queried
     */
    List<MonitorState> fetchMonitorList();
}
