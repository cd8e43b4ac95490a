package com.polycopy.copytrade.execution;

import java.util.Optional;

/**
 * Where copied trades are sent.
 */
public interface TradeExecutionGateway {

    /**
     * Token id of {@code outcome} in the market identified by {@code conditionId}.
     */
    Optional<String> resolveInstrument(String conditionId, String outcome);

    /**
     * @throws TradeExecutionException when the order could not be placed
     */
    OrderResult submit(TradeIntent intent);
}
