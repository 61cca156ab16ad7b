package com.eon.credit.scoring;

/** Score bands, lowest first. The ordinal doubles as the tier index used by attestations. */
public enum CreditTier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM;

    public static CreditTier fromIndex(int index) {
        CreditTier[] all = values();
        if (index < 0 || index >= all.length) {
            throw new IllegalArgumentException("No tier with index " + index);
        }
        return all[index];
    }
}
