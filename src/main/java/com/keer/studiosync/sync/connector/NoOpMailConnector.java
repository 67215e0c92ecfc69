package com.keer.studiosync.sync.connector;

import java.util.List;

public class NoOpMailConnector implements MailConnector {

    @Override
    public List<InboundMail> fetchRecent() {
        return List.of();
    }
}
