package com.keer.studiosync.sync.connector;

import java.time.LocalDate;
import java.util.List;

public interface AutomationConnector {

    /**
     * @throws ConnectorException when the portal cannot be reached or the login fails
     */
    List<ScrapedReservation> fetch(LocalDate from, LocalDate to);
}
