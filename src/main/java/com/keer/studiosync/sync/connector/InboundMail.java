package com.keer.studiosync.sync.connector;

public record InboundMail(String messageId, String sender, String subject, String body) {
}
