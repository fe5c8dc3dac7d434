package com.relaychat.registry;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The set of currently open client connections. Safe for concurrent
 * {@link #add}, {@link #remove} and {@link #snapshot} from any thread.
 */
@Component
public class ConnectionRegistry {

    private final Set<ClientConnection> members = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the connection was not already registered
     */
    public boolean add(ClientConnection connection) {
        return members.add(connection);
    }

    /**
     * @return true if this call removed the connection; false if it was absent
     */
    public boolean remove(ClientConnection connection) {
        return members.remove(connection);
    }

    public boolean contains(ClientConnection connection) {
        return members.contains(connection);
    }

    /**
     * Immutable copy of the current members, in no particular order.
     */
    public List<ClientConnection> snapshot() {
        return List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
