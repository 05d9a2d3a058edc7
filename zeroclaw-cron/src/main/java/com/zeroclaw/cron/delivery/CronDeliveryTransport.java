package com.zeroclaw.cron.delivery;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound channel sender (Telegram, Discord, Slack, ...). The scheduler only
 * picks the channel and recipient; the protocol lives behind this interface.
 */
public interface CronDeliveryTransport {

    /** Channel identifier, lowercase (e.g. "telegram"). */
    String getChannelId();

    /**
     * Send a text message.
     *
     * @param to recipient, or {@code null} for the channel's default target
     */
    CompletableFuture<Void> sendText(String to, String text);
}
