package io.agenthub.spi;

/**
 * Creates communication channels (Matrix rooms) on the federated side.
 */
@FunctionalInterface
public interface ChannelProvisioner {

    /**
     * Creates a new room.
     *
     * @param name human readable room name
     * @return the room id assigned by the channel server
     * @throws CollaboratorException if the room could not be created
     */
    String createRoom(String name) throws CollaboratorException;
}
