package com.tradeledger.ledger;

import com.tradeledger.domain.RawFill;
import com.tradeledger.domain.TradeRecord;
import com.tradeledger.domain.TradeSide;
import com.tradeledger.domain.TradeSource;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * Converts exchange fills into ledger records. Decimals are kept exactly as reported (trailing zeros stripped).
 */
@Component
public class TradeRecordNormalizer {

    public TradeRecord normalize(RawFill fill, TradeSource source, Instant ingestedAt) {
        if (fill.orderId() == null || fill.orderId().isBlank()) {
            throw new InvalidFillException("Fill has no order id");
        }
        String orderId = fill.orderId().strip();
        if (fill.symbol() == null || fill.symbol().isBlank()) {
            throw new InvalidFillException("Fill " + orderId + " has no symbol");
        }
        if (fill.tradeTime() == null) {
            throw new InvalidFillException("Fill " + orderId + " has no trade time");
        }
        BigDecimal quantity = fill.quantity();
        if (quantity == null || quantity.signum() <= 0) {
            throw new InvalidFillException("Fill " + orderId + " has non-positive quantity " + quantity);
        }
        BigDecimal price = fill.price();
        if (price == null || price.signum() < 0) {
            throw new InvalidFillException("Fill " + orderId + " has invalid price " + price);
        }
        BigDecimal fee = fill.fee() != null ? fill.fee() : BigDecimal.ZERO;
        if (fee.signum() < 0) {
            throw new InvalidFillException("Fill " + orderId + " has negative fee " + fee);
        }

        TradeRecord record = new TradeRecord();
        record.setOrderId(orderId);
        record.setTradeId(fill.tradeId());
        record.setSymbol(fill.symbol().strip().toUpperCase(Locale.ROOT));
        record.setSide(parseSide(orderId, fill.side()));
        record.setQuantity(quantity.stripTrailingZeros());
        record.setPrice(price.stripTrailingZeros());
        record.setFee(fee.stripTrailingZeros());
        record.setExchangeTimestamp(fill.tradeTime());
        record.setIngestedAt(ingestedAt);
        record.setSource(source);
        return record;
    }

    private static TradeSide parseSide(String orderId, String side) {
        if (side == null) {
            throw new InvalidFillException("Fill " + orderId + " has no side");
        }
        try {
            return TradeSide.valueOf(side.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidFillException("Fill " + orderId + " has unknown side " + side);
        }
    }
}
