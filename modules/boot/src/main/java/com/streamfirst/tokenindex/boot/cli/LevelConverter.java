package com.streamfirst.tokenindex.boot.cli;

import com.streamfirst.tokenindex.domain.TokenLevel;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/** Parses a level code {@code 1..4}. */
class LevelConverter implements ITypeConverter<TokenLevel> {

    @Override
    public TokenLevel convert(String value) {
        int code;
        try {
            code = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new TypeConversionException("'" + value + "' is not a level number");
        }
        if (!TokenLevel.isValidCode(code)) {
            throw new TypeConversionException("Level must be between 1 and 4, got " + code);
        }
        return TokenLevel.of(code);
    }
}
