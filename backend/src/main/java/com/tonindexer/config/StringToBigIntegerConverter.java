package com.tonindexer.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigInteger;

/**
 * Reads base-10 string amounts back as BigInteger.
 */
@ReadingConverter
public class StringToBigIntegerConverter implements Converter<String, BigInteger> {

    @Override
    public BigInteger convert(String source) {
        return new BigInteger(source);
    }
}
