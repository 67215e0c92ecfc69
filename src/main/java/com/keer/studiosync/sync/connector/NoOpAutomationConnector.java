package com.keer.studiosync.sync.connector;

import java.time.LocalDate;
import java.util.List;

public class NoOpAutomationConnector implements AutomationConnector {

    @Override
    public List<ScrapedReservation> fetch(LocalDate from, LocalDate to) {
        return List.of();
    }
}
