package com.tradeledger;

import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.TradeSide;
import com.tradeledger.domain.TradeSource;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trade records for tests. Times are minutes after a fixed origin so ordering is obvious at a glance.
 */
public final class TradeFixtures {

    public static final Instant ORIGIN = Instant.parse("2025-03-01T00:00:00Z");

    private TradeFixtures() {
    }

    public static Instant at(int minute) {
        return ORIGIN.plusSeconds(60L * minute);
    }

    public static TradeRecord buy(String orderId, String symbol, String quantity, String price, int minute) {
        return trade(orderId, symbol, TradeSide.BUY, quantity, price, "0", minute);
    }

    public static TradeRecord sell(String orderId, String symbol, String quantity, String price, int minute) {
        return trade(orderId, symbol, TradeSide.SELL, quantity, price, "0", minute);
    }

    public static TradeRecord trade(String orderId, String symbol, TradeSide side, String quantity, String price,
                                    String fee, int minute) {
        TradeRecord t = new TradeRecord();
        t.setOrderId(orderId);
        t.setTradeId(orderId + "-t1");
        t.setSymbol(symbol);
        t.setSide(side);
        t.setQuantity(new BigDecimal(quantity));
        t.setPrice(new BigDecimal(price));
        t.setFee(new BigDecimal(fee));
        t.setExchangeTimestamp(at(minute));
        t.setIngestedAt(at(minute).plusSeconds(5));
        t.setSource(TradeSource.NORMAL);
        return t;
    }
}
