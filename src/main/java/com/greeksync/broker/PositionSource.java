package com.greeksync.broker;

import com.greeksync.domain.model.Position;
import java.util.List;

/** Current holdings of the brokerage account: stocks, options, futures and others. */
public interface PositionSource {

    /**
     * @return all held positions; empty when the account holds nothing
     * @throws com.greeksync.exception.BrokerException if positions cannot be retrieved
     */
    List<Position> fetchPositions();
}
