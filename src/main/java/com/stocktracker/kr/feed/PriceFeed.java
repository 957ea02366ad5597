package com.stocktracker.kr.feed;

import com.stocktracker.kr.model.Cycle;

import java.util.OptionalDouble;

public interface PriceFeed {

    /**
     * @return the ticker's price for the cycle, empty when the feed has none
     */
    OptionalDouble priceOf(String ticker, Cycle cycle);
}
