package com.infomedia.abacox.routingreconciler.component.numbering;

import lombok.Getter;

import java.util.List;

/**
 * The derived keys of an expanded number expression. The three lists are
 * parallel: index {@code i} always refers to the same number.
 */
@Getter
public class NumberPreview {

    private final List<String> targets;
    private final List<String> dns;
    private final List<String> cacheKeys;

    public NumberPreview(List<String> targets, List<String> dns, List<String> cacheKeys) {
        if (targets.size() != dns.size() || dns.size() != cacheKeys.size()) {
            throw new IllegalArgumentException("Preview lists must have the same length");
        }
        this.targets = List.copyOf(targets);
        this.dns = List.copyOf(dns);
        this.cacheKeys = List.copyOf(cacheKeys);
    }

    public int getCount() {
        return targets.size();
    }
}
