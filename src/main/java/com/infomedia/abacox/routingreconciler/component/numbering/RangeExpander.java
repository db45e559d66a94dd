package com.infomedia.abacox.routingreconciler.component.numbering;

import com.infomedia.abacox.routingreconciler.exception.BadRangeFormatException;
import com.infomedia.abacox.routingreconciler.exception.RangeEndBeforeStartException;
import com.infomedia.abacox.routingreconciler.exception.RangeTooLargeException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Expands a number or a {@code start-end} range into the individual numbers it covers.
 * <p>
 * The end of a range may be written as a suffix of the start, so
 * {@code 0412345678-681} covers {@code 0412345678} up to {@code 0412345681}.
 * Every produced number keeps the width of the range start, leading zeros included.
 */
@Component
@RequiredArgsConstructor
public class RangeExpander {

    public static final int DEFAULT_MAX_SPAN = 100;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final char RANGE_SEPARATOR = '-';

    private final NumberNormalizer numberNormalizer;

    public List<String> expand(String expression) {
        return expand(expression, DEFAULT_MAX_SPAN);
    }

    /**
     * @param expression a single number or a dash range, whitespace is ignored
     * @param maxSpan    the largest number of entries the range may produce
     * @return the covered numbers in ascending order
     */
    public List<String> expand(String expression, int maxSpan) {
        String compact = expression == null ? "" : WHITESPACE.matcher(expression).replaceAll("");

        int separator = compact.indexOf(RANGE_SEPARATOR);
        if (separator < 0) {
            // a lone number is classified later, keep it untouched here
            return List.of(compact);
        }

        String startDigits = numberNormalizer.stripNonDigits(compact.substring(0, separator));
        String endDigits = numberNormalizer.stripNonDigits(compact.substring(separator + 1));
        if (startDigits.isEmpty() || endDigits.isEmpty()) {
            throw new BadRangeFormatException();
        }

        String endFull = endDigits;
        if (endDigits.length() < startDigits.length()) {
            endFull = startDigits.substring(0, startDigits.length() - endDigits.length()) + endDigits;
        }

        BigInteger start = new BigInteger(startDigits);
        BigInteger end = new BigInteger(endFull);
        if (end.compareTo(start) < 0) {
            throw new RangeEndBeforeStartException();
        }

        BigInteger span = end.subtract(start).add(BigInteger.ONE);
        if (span.compareTo(BigInteger.valueOf(maxSpan)) > 0) {
            throw new RangeTooLargeException(maxSpan);
        }

        int width = startDigits.length();
        List<String> numbers = new ArrayList<>(span.intValue());
        for (BigInteger n = start; n.compareTo(end) <= 0; n = n.add(BigInteger.ONE)) {
            numbers.add(zeroPad(n.toString(), width));
        }
        return numbers;
    }

    private static String zeroPad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return "0".repeat(width - value.length()) + value;
    }
}
