package com.iksanov.partitionedcache.common.cluster;

import java.util.Objects;

public record NodeInfo(String nodeId, String host, int port) {

    public NodeInfo {
        if (nodeId == null || nodeId.isBlank()) throw new IllegalArgumentException("nodeId cannot be null or blank");
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host cannot be null or blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
    }

    /**
     * Parses {@code "nodeId:host:port"}.
     */
    public static NodeInfo fromString(String address) {
        if (address == null) throw new IllegalArgumentException("address is null");
        String[] parts = address.trim().split(":");
        if (parts.length != 3) throw new IllegalArgumentException("Invalid node address '" + address + "', expected 'nodeId:host:port'");
        try {
            return new NodeInfo(parts[0], parts[1], Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in node address '" + address + "'", e);
        }
    }

    public String toAddressString() {
        return nodeId + ":" + host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeInfo that)) return false;
        return Objects.equals(this.nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId);
    }

    @Override
    public String toString() {
        return "NodeInfo[nodeId=%s, host=%s, port=%d]".formatted(nodeId, host, port);
    }
}
