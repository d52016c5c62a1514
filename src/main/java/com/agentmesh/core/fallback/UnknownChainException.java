package com.agentmesh.core.fallback;

/**
 * Thrown when a chain is looked up by a name that was never registered.
 */
public class UnknownChainException extends IllegalStateException {
    public UnknownChainException(String chainName) {
        super("No fallback chain registered under '" + chainName + "'; register it before use");
    }
}
