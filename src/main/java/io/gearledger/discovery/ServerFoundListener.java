package io.gearledger.discovery;

@FunctionalInterface
public interface ServerFoundListener {
    /**
     * Called from the listener thread for a server that was unknown or had gone
     * stale. Refreshes of a live entry do not call this.
     */
    void onServerFound(DiscoveredServer server);
}
