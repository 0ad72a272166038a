package com.greeksync.broker;

import com.greeksync.domain.vo.OptionIdentity;
import java.util.Collection;

/**
 * Push-style live Greeks feed of the brokerage terminal. Every component that needs
 * live Greeks goes through {@link GreeksFetcher}, which owns subscription cleanup;
 * nothing else subscribes on this interface directly.
 *
 * <p>Updates for a subscribed option arrive asynchronously on feed threads, in any
 * order across options, possibly several per option (partial ticks first). An option
 * the terminal cannot serve (unknown contract, no market data permission) is reported
 * through {@link GreeksFeedListener#onRejected}.
 */
public interface GreeksFeed {

    /**
     * Requests streaming Greeks for the given options. Returns without waiting for data.
     *
     * @throws com.greeksync.exception.BrokerException if the terminal is unreachable
     */
    void subscribe(Collection<OptionIdentity> identities, GreeksFeedListener listener);

    /**
     * Cancels the streaming requests for the given options. Must tolerate options that
     * were never successfully subscribed.
     */
    void unsubscribe(Collection<OptionIdentity> identities);
}
