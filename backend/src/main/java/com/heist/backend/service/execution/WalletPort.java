package com.heist.backend.service.execution;

import com.heist.backend.model.Chain;
import com.heist.backend.model.PositionSnapshot;

import java.math.BigDecimal;

/**
 * Swap execution and pricing boundary. Calls may block and are always guarded by the caller.
 */
public interface WalletPort {

    Fill buy(String address, Chain chain, BigDecimal amountUsd);

    Fill sell(PositionSnapshot position);

    BigDecimal quote(PositionSnapshot position);

    BigDecimal balanceUsd();

    record Fill(BigDecimal price, BigDecimal tokenAmount, BigDecimal amountUsd, String txRef) {
    }
}
