package com.renewalsync.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Ledger JSON-RPC client abstraction for testing and endpoint rotation.
 * Retries across endpoints are handled by the adapter using {@link RpcEndpointRotator}.
 */
public interface LedgerRpcClient {

    /**
     * Perform a single JSON-RPC 2.0 call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "getEvents"
     * @param params      method params, or null to omit the member
     * @return response body as string (JSON); errors with {@link RpcException} on HTTP or transport failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
