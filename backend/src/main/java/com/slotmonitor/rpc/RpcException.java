package com.slotmonitor.rpc;

/**
 * Thrown when a chain RPC call fails: transport error, non-2xx status, JSON-RPC error object or unparsable result.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
