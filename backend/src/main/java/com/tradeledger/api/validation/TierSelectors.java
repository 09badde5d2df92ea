package com.tradeledger.api.validation;

import com.tradeledger.domain.ReconciliationTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses tier selectors from the API: a level ("1", "2"), a tier name ("presence", "value") or "all".
 */
public final class TierSelectors {

    private TierSelectors() {
    }

    public static boolean isValid(String selector) {
        try {
            parse(selector);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Empty result means all tiers. */
    public static List<ReconciliationTier> parseAll(List<String> selectors) {
        List<ReconciliationTier> tiers = new ArrayList<>();
        if (selectors == null) {
            return tiers;
        }
        for (String selector : selectors) {
            tiers.addAll(parse(selector));
        }
        return tiers;
    }

    static List<ReconciliationTier> parse(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new IllegalArgumentException("Empty tier selector");
        }
        String s = selector.strip().toUpperCase(Locale.ROOT);
        if ("ALL".equals(s)) {
            return List.of(ReconciliationTier.values());
        }
        if (s.chars().allMatch(Character::isDigit)) {
            return List.of(ReconciliationTier.ofLevel(Integer.parseInt(s)));
        }
        return List.of(ReconciliationTier.valueOf(s));
    }
}
