package com.tradeledger.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeledger.domain.RawFill;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses exchange fill responses:
 * <pre>{"fills":[{"order_id","trade_id","product_id","side","size","price","commission","trade_time"}],"cursor":"..."}</pre>
 * Decimal fields may be JSON strings or numbers. A malformed body is a permanent call failure, not an empty page.
 */
public class ExchangeFillParser {

    private final ObjectMapper objectMapper;

    public ExchangeFillParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FillPage parsePage(String json) {
        JsonNode root = readRoot(json);
        List<RawFill> fills = parseFills(root);
        JsonNode cursorNode = root.path("cursor");
        String cursor = cursorNode.isTextual() && !cursorNode.asText().isBlank() ? cursorNode.asText() : null;
        return new FillPage(fills, cursor);
    }

    public List<RawFill> parseFills(String json) {
        return parseFills(readRoot(json));
    }

    private JsonNode readRoot(String json) {
        if (json == null || json.isBlank()) {
            throw ExchangeCallException.permanentFailure("Empty response body from exchange", null);
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw ExchangeCallException.permanentFailure("Malformed fill response: " + e.getMessage(), e);
        }
    }

    private static List<RawFill> parseFills(JsonNode root) {
        JsonNode fills = root.path("fills");
        if (!fills.isArray()) {
            throw ExchangeCallException.permanentFailure("Fill response has no 'fills' array", null);
        }
        List<RawFill> out = new ArrayList<>(fills.size());
        for (JsonNode node : fills) {
            String orderId = text(node, "order_id");
            if (orderId == null || orderId.isBlank()) {
                throw ExchangeCallException.permanentFailure(
                        "Fill without order_id (trade_id=" + text(node, "trade_id") + ")", null);
            }
            out.add(new RawFill(
                    orderId,
                    text(node, "trade_id"),
                    text(node, "product_id"),
                    text(node, "side"),
                    decimal(node, "size"),
                    decimal(node, "price"),
                    decimal(node, "commission"),
                    instant(node, "trade_time")
            ));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().strip());
        } catch (NumberFormatException e) {
            throw ExchangeCallException.permanentFailure("Field '" + field + "' is not a decimal: " + value.asText(), e);
        }
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw ExchangeCallException.permanentFailure("Field '" + field + "' is not an ISO-8601 instant: " + value, e);
        }
    }
}
