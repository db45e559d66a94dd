package com.infomedia.abacox.routingreconciler.component.numbering;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
@Log4j2
public class PreviewBuilder {

    public static final String ROUTING_KEY_PREFIX = "nprn:routing:";

    private final RangeExpander rangeExpander;
    private final NumberNormalizer numberNormalizer;

    /**
     * Expands {@code expression} and derives the target, directory number and
     * routing cache key of every covered number. Fails on the first number that
     * cannot be classified; nothing is returned partially.
     */
    public NumberPreview buildPreview(String expression) {
        List<String> expanded = rangeExpander.expand(expression, RangeExpander.DEFAULT_MAX_SPAN);

        List<String> targets = new ArrayList<>(expanded.size());
        List<String> dns = new ArrayList<>(expanded.size());
        List<String> cacheKeys = new ArrayList<>(expanded.size());
        for (String number : expanded) {
            CanonicalNumber canonical = numberNormalizer.classify(number);
            targets.add(canonical.getTarget());
            dns.add(canonical.getDn());
            cacheKeys.add(routingKey(canonical.getDn()));
        }

        log.debug("Expression '{}' expanded to {} number(s)", expression, targets.size());
        return new NumberPreview(targets, dns, cacheKeys);
    }

    public static String routingKey(String dn) {
        return ROUTING_KEY_PREFIX + dn;
    }
}
