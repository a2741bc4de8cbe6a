package com.secondhand.authority;

/**
 * Pushes applied changes to non-authoritative participants. Single-player hosts use
 * {@link #NONE}.
 */
public interface StateBroadcaster {

    StateBroadcaster NONE = change -> { };

    void broadcast(StateChange change);
}
