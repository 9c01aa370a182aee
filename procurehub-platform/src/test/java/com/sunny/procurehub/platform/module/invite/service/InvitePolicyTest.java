package com.sunny.procurehub.platform.module.invite.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sunny.procurehub.platform.module.invite.entity.Invite;
import com.sunny.procurehub.platform.module.invite.enums.InviteRejection;
import com.sunny.procurehub.platform.module.invite.enums.InviteType;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class InvitePolicyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 12, 0);

    @Test
    void normalizeCode_shouldTrimAndUppercase() {
        assertEquals("AB12CD34", InvitePolicy.normalizeCode(" ab12cd34 "));
        assertTrue(InvitePolicy.isValidCodeFormat("AB12CD34"));
        assertFalse(InvitePolicy.isValidCodeFormat("AB12CD3"));
        assertFalse(InvitePolicy.isValidCodeFormat("ab12cd34"));
    }

    @Test
    void canUse_shouldRejectWhenExpiresAtEqualsNow() {
        Invite invite = invite(InviteType.LINK, null, 0, 5, NOW);

        assertEquals(Optional.of(InviteRejection.EXPIRED), InvitePolicy.canUse(invite, null, NOW));
    }

    @Test
    void canUse_shouldRejectWhenUseCountReachedMaxUses() {
        Invite invite = invite(InviteType.LINK, null, 5, 5, NOW.plusDays(1));

        assertEquals(Optional.of(InviteRejection.USED_UP), InvitePolicy.canUse(invite, null, NOW));
    }

    @Test
    void canUse_shouldMatchDirectInviteEmailIgnoringCase() {
        Invite invite = invite(InviteType.DIRECT, "alice@example.com", 0, 1, NOW.plusDays(1));

        assertEquals(Optional.empty(), InvitePolicy.canUse(invite, "Alice@Example.com", NOW));
        assertEquals(Optional.of(InviteRejection.EMAIL_MISMATCH), InvitePolicy.canUse(invite, "bob@example.com", NOW));
        assertEquals(Optional.of(InviteRejection.EMAIL_REQUIRED), InvitePolicy.canUse(invite, " ", NOW));
    }

    @Test
    void canUse_shouldIgnoreEmailForLinkInvite() {
        Invite invite = invite(InviteType.LINK, null, 4, 5, NOW.plusDays(1));

        assertEquals(Optional.empty(), InvitePolicy.canUse(invite, "anyone@example.com", NOW));
    }

    private Invite invite(InviteType type, String email, int useCount, int maxUses, LocalDateTime expiresAt) {
        Invite invite = new Invite();
        invite.setInviteType(type);
        invite.setEmail(email);
        invite.setUseCount(useCount);
        invite.setMaxUses(maxUses);
        invite.setExpiresAt(expiresAt);
        return invite;
    }
}
