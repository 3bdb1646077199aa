package com.slotmonitor.rpc.solana;

import reactor.core.publisher.Mono;

/**
 * Raw Solana JSON-RPC transport: one request, response body as text. Parsing and retries live in
 * {@link SolanaChainRpcClient}.
 */
public interface SolanaRpcClient {

    Mono<String> call(String endpointUrl, String method, Object params);
}
