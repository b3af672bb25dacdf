package com.p14n.fanout.broker;

import com.p14n.fanout.data.Message;

/**
 * Capability a {@link Consumer} uses to process messages.
 * The broker calls {@link #handle(Message)} at most once per accepted message
 * per subscription and never retries a failed call.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Called when a message is delivered to the owning consumer.
     *
     * @param message The message to process
     * @throws Exception if processing fails; the failure is reported and
     *                   contained at the consumer
     */
    void handle(Message message) throws Exception;

    /**
     * Called after {@link #handle(Message)} failed for a message.
     *
     * @param message The message that could not be processed
     * @param error   The error that occurred
     */
    default void onError(Message message, Throwable error) {
    }
}
