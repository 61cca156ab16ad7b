package com.eon.credit.scoring;

/** Cross-system reputation on 0..100, trusted as given. */
public interface ExternalReputationSource {

    int reputationOf(String subject);
}
