package scenariopool.coordinator.server;

import io.netty.channel.Channel;
import scenariopool.protocol.WorkerMessage;

/**
 * Receives transport events. Called on Netty IO threads: implementations
 * hand the event over to their own thread and return.
 */
public interface SupervisorEvents {

    void onMessage(Channel channel, WorkerMessage message);

    void onDisconnected(Channel channel);

    /** A line that could not be decoded. The connection stays open. */
    default void onMalformed(Channel channel, String line, IllegalArgumentException error) {
    }
}
