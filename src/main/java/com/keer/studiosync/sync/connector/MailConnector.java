package com.keer.studiosync.sync.connector;

import com.keer.studiosync.reservation.model.ReservationAction;

import java.util.List;

/**
 * Read side of the mailbox holding the platform's notifications.
 */
public interface MailConnector {

    /**
     * Messages received within the connector's recent window, most recent first.
     *
     * @throws ConnectorException when the mailbox cannot be reached or refuses the credentials
     */
    List<InboundMail> fetchRecent();

    /**
     * Tags a message once it has been merged so the next run can skip it.
     */
    default void markProcessed(String messageId, ReservationAction action) {}
}
