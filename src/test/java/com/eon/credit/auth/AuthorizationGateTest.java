package com.eon.credit.auth;

import com.eon.credit.error.AuthorizationException;
import com.eon.credit.error.CreditErrorCode;
import com.eon.credit.support.LedgerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.eon.credit.support.LedgerFixture.ADMIN;
import static com.eon.credit.support.LedgerFixture.START;
import static com.eon.credit.support.LedgerFixture.WRITER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthorizationGate")
class AuthorizationGateTest {

    private LedgerFixture fx;
    private AuthorizationGate gate;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        gate = fx.gate;
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("capabilities are independent")
    void independent() {
        assertThat(gate.isAuthorized(ADMIN, Capability.ADMIN)).isTrue();
        assertThat(gate.isAuthorized(ADMIN, Capability.LEDGER_WRITER)).isFalse();
        assertThat(gate.isAuthorized(WRITER, Capability.ADMIN)).isFalse();
    }

    @Test
    @DisplayName("blank callers are never authorized")
    void blank() {
        assertThat(gate.isAuthorized(null, Capability.ADMIN)).isFalse();
        assertThat(gate.isAuthorized(" ", Capability.ADMIN)).isFalse();
    }

    @Test
    @DisplayName("admins grant and revoke")
    void grantAndRevoke() {
        gate.grant(ADMIN, "new-bank", Capability.LEDGER_WRITER);

        assertThatCode(() -> gate.require("new-bank", Capability.LEDGER_WRITER)).doesNotThrowAnyException();
        assertThat(gate.grants()).anySatisfy(g -> {
            assertThat(g.principal()).isEqualTo("new-bank");
            assertThat(g.capability()).isEqualTo(Capability.LEDGER_WRITER);
            assertThat(g.grantedAt()).isEqualTo(START);
        });

        gate.revoke(ADMIN, "new-bank", Capability.LEDGER_WRITER);

        assertThatThrownBy(() -> gate.require("new-bank", Capability.LEDGER_WRITER))
                .isInstanceOf(AuthorizationException.class)
                .hasFieldOrPropertyWithValue("code", CreditErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("granting twice keeps a single entry")
    void idempotentGrant() {
        gate.grant(ADMIN, "new-bank", Capability.LEDGER_WRITER);
        gate.grant(ADMIN, "new-bank", Capability.LEDGER_WRITER);

        assertThat(gate.grants()).filteredOn(g -> g.principal().equals("new-bank")).hasSize(1);
    }

    @Test
    @DisplayName("non-admins cannot change the allow-list")
    void nonAdmin() {
        assertThatThrownBy(() -> gate.grant(WRITER, WRITER, Capability.ADMIN))
                .isInstanceOf(AuthorizationException.class);
        assertThat(gate.isAuthorized(WRITER, Capability.ADMIN)).isFalse();
    }
}
