package com.example.chunker.application.structure;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Parses statement amount cells such as {@code "1,25,000.00"} or {@code " 450 "}.
 * Only thousands separators and whitespace are stripped; currency markers like "Cr" make a value
 * non-numeric.
 */
public final class Amounts {

    private Amounts() {
    }

    /**
     * @param value raw cell value
     * @return parsed amount, empty when the value is blank or not a number
     */
    public static Optional<BigDecimal> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String stripped = value.replace(",", "").replaceAll("\\s+", "");
        if (stripped.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(stripped));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * @param value raw cell value
     * @return {@code true} when the value parses to a number other than zero
     */
    public static boolean isNonZero(String value) {
        return parse(value).map(amount -> amount.signum() != 0).orElse(false);
    }
}
