package com.relaychat.broadcast;

/**
 * What happened to one published message.
 *
 * @param accepted  false if the message failed validation and went nowhere
 * @param storageId id assigned by the primary store, or null if that write failed
 * @param mirrored  whether the mirror append succeeded
 * @param delivered number of connections the frame was sent to
 * @param evicted   number of connections dropped because their send failed
 */
public record BroadcastOutcome(boolean accepted, Long storageId, boolean mirrored, int delivered, int evicted) {

    public static BroadcastOutcome rejected() {
        return new BroadcastOutcome(false, null, false, 0, 0);
    }
}
