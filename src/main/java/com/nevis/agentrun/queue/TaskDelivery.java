package com.nevis.agentrun.queue;

import java.util.UUID;

/**
 * One delivery of a message. The receipt changes on every redelivery, so only the latest holder can ack.
 */
public record TaskDelivery(
    UUID messageId,
    String queueName,
    UUID receipt,
    int deliveryCount,
    TaskMessage message
) {}
