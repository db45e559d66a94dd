package com.infomedia.abacox.routingreconciler.component.numbering;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One number identity seen in its two stored formats: the 11 digit directory
 * number ({@code 41...}) and the 10 digit local target ({@code 0...}).
 * Both views are derived from each other on construction.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class CanonicalNumber {

    public static final String DN_PREFIX = "41";
    public static final String TARGET_PREFIX = "0";
    public static final int DN_LENGTH = 11;
    public static final int TARGET_LENGTH = 10;

    private final String dn;
    private final String target;

    private CanonicalNumber(String dn, String target) {
        this.dn = dn;
        this.target = target;
    }

    static CanonicalNumber fromTarget(String target) {
        return new CanonicalNumber(DN_PREFIX + target.substring(TARGET_PREFIX.length()), target);
    }

    static CanonicalNumber fromDn(String dn) {
        return new CanonicalNumber(dn, TARGET_PREFIX + dn.substring(DN_PREFIX.length()));
    }
}
