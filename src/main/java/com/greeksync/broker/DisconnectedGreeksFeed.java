package com.greeksync.broker;

import com.greeksync.domain.vo.OptionIdentity;
import com.greeksync.exception.BrokerException;
import java.util.Collection;

/**
 * Feed used when no brokerage connection is wired in. Every subscription fails, so a
 * reconciliation pass runs in degraded mode on cached Greeks only.
 */
public class DisconnectedGreeksFeed implements GreeksFeed {

    @Override
    public void subscribe(Collection<OptionIdentity> identities, GreeksFeedListener listener) {
        throw new BrokerException("No live Greeks feed connected");
    }

    @Override
    public void unsubscribe(Collection<OptionIdentity> identities) {
        // nothing was subscribed
    }
}
