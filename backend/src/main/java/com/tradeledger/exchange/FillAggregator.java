package com.tradeledger.exchange;

import com.tradeledger.domain.RawFill;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses the partial fills of an order into one fill: quantity and fee summed, price weighted by quantity,
 * trade time of the last piece.
 */
public final class FillAggregator {

    private static final int SCALE = 18;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    static final Comparator<RawFill> BY_TIME_THEN_ORDER = Comparator
            .comparing(RawFill::tradeTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(RawFill::orderId, Comparator.nullsLast(Comparator.naturalOrder()));

    private FillAggregator() {
    }

    public static List<RawFill> aggregateByOrder(List<RawFill> fills) {
        Map<String, List<RawFill>> byOrder = new LinkedHashMap<>();
        for (RawFill fill : fills) {
            byOrder.computeIfAbsent(fill.orderId(), k -> new ArrayList<>()).add(fill);
        }
        List<RawFill> out = new ArrayList<>(byOrder.size());
        for (List<RawFill> pieces : byOrder.values()) {
            out.add(merge(pieces));
        }
        out.sort(BY_TIME_THEN_ORDER);
        return out;
    }

    static RawFill merge(List<RawFill> pieces) {
        if (pieces.size() == 1) {
            return pieces.get(0);
        }
        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal fee = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        RawFill last = pieces.get(0);
        for (RawFill piece : pieces) {
            BigDecimal q = piece.quantity() != null ? piece.quantity() : BigDecimal.ZERO;
            quantity = quantity.add(q);
            fee = fee.add(piece.fee() != null ? piece.fee() : BigDecimal.ZERO);
            notional = notional.add(q.multiply(piece.price() != null ? piece.price() : BigDecimal.ZERO));
            if (isLater(piece.tradeTime(), last.tradeTime())) {
                last = piece;
            }
        }
        BigDecimal price = quantity.signum() == 0
                ? last.price()
                : notional.divide(quantity, SCALE, ROUNDING).stripTrailingZeros();
        RawFill first = pieces.get(0);
        return new RawFill(first.orderId(), last.tradeId(), first.symbol(), first.side(),
                quantity, price, fee, last.tradeTime());
    }

    private static boolean isLater(Instant candidate, Instant current) {
        return candidate != null && (current == null || candidate.isAfter(current));
    }
}
