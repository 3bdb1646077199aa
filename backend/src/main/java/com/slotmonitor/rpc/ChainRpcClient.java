package com.slotmonitor.rpc;

import java.util.List;

/**
 * Chain queries the sync engine and the confirmation endpoint depend on.
 */
public interface ChainRpcClient {

    /**
     * Current chain head slot.
     *
     * @throws RpcException if the call fails
     */
    long getLatestSlot();

    /**
     * Confirmed slots within [startSlot, endSlot], ascending and without duplicates. Skipped slots are absent.
     *
     * @throws RpcException if the call fails
     */
    List<Long> getBlocks(long startSlot, long endSlot);
}
