package com.sunny.procurehub.platform.exception.translator;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.AlreadyExistsException;
import com.sunny.procurehub.common.exception.BadRequestException;
import com.sunny.procurehub.common.exception.InternalException;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import com.sunny.procurehub.common.exception.ServiceUnavailableException;
import com.sunny.procurehub.common.exception.db.DbConstraintViolationException;
import com.sunny.procurehub.common.exception.db.DbUnavailableException;
import com.sunny.procurehub.platform.exception.auth.EmailTakenException;
import com.sunny.procurehub.platform.exception.ledger.CreditAccountExistsException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DbExceptionTranslatorTest {

    private final DbExceptionTranslator translator = new DbExceptionTranslator();

    @Test
    void map_shouldResolveEmailDuplicateDuringRegistration() {
        ProcurehubRuntimeException mapped = translator.map(DbScene.USER_REGISTER, unique("uq_users_email_lower"));

        Assertions.assertInstanceOf(EmailTakenException.class, mapped);
    }

    @Test
    void map_shouldResolveDuplicateCreditAccount() {
        ProcurehubRuntimeException mapped = translator.map(DbScene.CREDIT_ACCOUNT_OPEN,
                unique("uq_credit_accounts_company"));

        Assertions.assertInstanceOf(CreditAccountExistsException.class, mapped);
    }

    @Test
    void map_shouldTreatDuplicateInviteUseAsInternalDefect() {
        ProcurehubRuntimeException mapped = translator.map(DbScene.INVITE_CONSUME, unique("uq_invite_uses_invite_user"));

        Assertions.assertInstanceOf(InternalException.class, mapped);
        Assertions.assertEquals(ErrorType.STORE_INTERNAL, mapped.getType());
    }

    @Test
    void map_shouldFallbackToGenericAlreadyExistsWhenConstraintUnknown() {
        ProcurehubRuntimeException mapped = translator.map(DbScene.GENERIC, unique("uq_unknown"));

        Assertions.assertInstanceOf(AlreadyExistsException.class, mapped);
        Assertions.assertEquals("数据已存在", mapped.getMessage());
    }

    @Test
    void map_shouldNotResolveEmailDuplicateOutsideRegistrationScene() {
        ProcurehubRuntimeException mapped = translator.map(DbScene.GENERIC, unique("uq_users_email_lower"));

        Assertions.assertInstanceOf(AlreadyExistsException.class, mapped);
    }

    @Test
    void map_shouldMapCheckViolationToBadRequest() {
        DbConstraintViolationException check = new DbConstraintViolationException(
                DbConstraintViolationException.Kind.CHECK, new RuntimeException("check"), 0, "23514",
                "chk_profiles_reputation");

        Assertions.assertInstanceOf(BadRequestException.class, translator.map(DbScene.GENERIC, check));
    }

    @Test
    void map_shouldMapTimeoutAndDeadlockToServiceUnavailable() {
        ProcurehubRuntimeException timeout = translator.map(DbScene.LEDGER, new DbUnavailableException(
                DbUnavailableException.Reason.QUERY_TIMEOUT, new RuntimeException("timeout"), 0, "57014", null));
        ProcurehubRuntimeException deadlock = translator.map(DbScene.LEDGER, new DbUnavailableException(
                DbUnavailableException.Reason.DEADLOCK, new RuntimeException("deadlock"), 0, "40P01", null));

        Assertions.assertInstanceOf(ServiceUnavailableException.class, timeout);
        Assertions.assertEquals(ErrorType.STORE_TIMEOUT, timeout.getType());
        Assertions.assertEquals(ErrorType.STORE_UNAVAILABLE, deadlock.getType());
    }

    private DbConstraintViolationException unique(String constraintName) {
        return new DbConstraintViolationException(DbConstraintViolationException.Kind.UNIQUE,
                new RuntimeException("duplicate"), 0, "23505", constraintName);
    }
}
