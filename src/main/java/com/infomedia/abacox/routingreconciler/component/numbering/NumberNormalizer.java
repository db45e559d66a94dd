package com.infomedia.abacox.routingreconciler.component.numbering;

import com.infomedia.abacox.routingreconciler.exception.UnsupportedNumberFormatException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class NumberNormalizer {

    private static final Pattern NON_DIGITS = Pattern.compile("\\D+");

    /**
     * Removes every character that is not an ASCII digit.
     *
     * @param value any text, may be null
     * @return the digits of {@code value} in order, or an empty string
     */
    public String stripNonDigits(String value) {
        if (value == null) {
            return "";
        }
        return NON_DIGITS.matcher(value).replaceAll("");
    }

    /**
     * Resolves a free-text number into its directory number and local target.
     * Only a 10 digit number starting with {@code 0} or an 11 digit number
     * starting with {@code 41} is accepted.
     *
     * @param raw the number as typed by the operator
     * @return both views of the number
     * @throws UnsupportedNumberFormatException for any other digit layout
     */
    public CanonicalNumber classify(String raw) {
        String digits = stripNonDigits(raw);

        if (digits.length() == CanonicalNumber.TARGET_LENGTH && digits.startsWith(CanonicalNumber.TARGET_PREFIX)) {
            return CanonicalNumber.fromTarget(digits);
        }

        if (digits.length() == CanonicalNumber.DN_LENGTH && digits.startsWith(CanonicalNumber.DN_PREFIX)) {
            return CanonicalNumber.fromDn(digits);
        }

        throw new UnsupportedNumberFormatException(raw);
    }
}
