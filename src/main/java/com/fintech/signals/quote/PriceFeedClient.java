package com.fintech.signals.quote;

import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.PriceQuote;

/**
 * Upstream price source. Untrusted: any failure must surface, never a substituted value.
 */
public interface PriceFeedClient {

    /**
     * @throws com.fintech.signals.error.UpstreamFetchException when no usable price is available
     */
    PriceQuote fetchPrice(Instrument instrument);

    String sourceName();
}
