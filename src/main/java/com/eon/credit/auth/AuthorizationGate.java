package com.eon.credit.auth;

import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.ledger.LedgerTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Allow-list check in front of every privileged write. The list is mutable only by principals
 * holding {@link Capability#ADMIN}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationGate {

    private final AllowListRepository allowList;
    private final LedgerTransactions transactions;
    private final Clock clock;

    public boolean isAuthorized(String principal, Capability capability) {
        return principal != null && !principal.isBlank() && allowList.exists(principal, capability);
    }

    public void require(String principal, Capability capability) {
        if (!isAuthorized(principal, capability)) {
            log.warn("Rejected caller '{}' lacking {}", principal, capability);
            throw new AuthorizationException(CreditErrorCode.UNAUTHORIZED,
                    "Caller '" + principal + "' is not authorized for " + capability);
        }
    }

    public void grant(String admin, String principal, Capability capability) {
        transactions.run(() -> {
            require(admin, Capability.ADMIN);
            if (allowList.insert(principal, capability, clock.instant())) {
                log.info("{} granted {} to {}", admin, capability, principal);
            }
        });
    }

    public void revoke(String admin, String principal, Capability capability) {
        transactions.run(() -> {
            require(admin, Capability.ADMIN);
            if (allowList.delete(principal, capability)) {
                log.info("{} revoked {} from {}", admin, capability, principal);
            }
        });
    }

    /** Startup seeding from configuration; bypasses the admin check. */
    public void bootstrap(String principal, Capability capability) {
        transactions.run(() -> allowList.insert(principal, capability, clock.instant()));
    }

    public List<AllowListRepository.Grant> grants() {
        return allowList.findAll();
    }
}
