package com.greeksync.broker;

import com.greeksync.domain.model.GreeksUpdate;
import com.greeksync.domain.vo.OptionIdentity;

/** Callback registered with {@link GreeksFeed#subscribe}. May be invoked from any thread. */
public interface GreeksFeedListener {

    void onGreeks(GreeksUpdate update);

    void onRejected(OptionIdentity identity, String reason);
}
