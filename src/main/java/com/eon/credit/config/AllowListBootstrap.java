package com.eon.credit.config;

import com.eon.credit.auth.AuthorizationGate;
import com.eon.credit.auth.Capability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/** Seeds the allow-list from configuration at startup. Existing grants are left alone. */
@Slf4j
@Component
@RequiredArgsConstructor
public class AllowListBootstrap implements ApplicationRunner {

    private final AuthorizationGate gate;
    private final CreditProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        CreditProperties.Principals p = properties.getPrincipals();
        grantAll(p.getAdmins(), Capability.ADMIN);

        // the engines report to the ledger under their own principals
        gate.bootstrap(p.getLendingEngine(), Capability.LEDGER_WRITER);
        gate.bootstrap(p.getLendingEngine(), Capability.FUND_REQUESTOR);
        gate.bootstrap(p.getAuctioneer(), Capability.LEDGER_WRITER);

        grantAll(p.getLedgerWriters(), Capability.LEDGER_WRITER);
        grantAll(p.getActivityReporters(), Capability.ACTIVITY_REPORTER);
        grantAll(p.getAttesters(), Capability.ATTESTER);
        log.info("Allow-list holds {} grants", gate.grants().size());
    }

    private void grantAll(List<String> principals, Capability capability) {
        for (String principal : principals) {
            gate.bootstrap(principal, capability);
        }
    }
}
