package com.tradeledger.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes BigDecimal as Decimal128 instead of a string. Values wider than 34 digits are
 * rounded to Decimal128 precision (the engine works at scale 18, so this only affects huge magnitudes).
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        BigDecimal value = source.precision() > 34 ? source.round(MathContext.DECIMAL128) : source;
        return new Decimal128(value);
    }
}
