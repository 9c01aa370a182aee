package com.sunny.procurehub.platform.exception.translator;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.AlreadyExistsException;
import com.sunny.procurehub.common.exception.BadRequestException;
import com.sunny.procurehub.common.exception.InternalException;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import com.sunny.procurehub.common.exception.ServiceUnavailableException;
import com.sunny.procurehub.common.exception.db.DbConstraintViolationException;
import com.sunny.procurehub.common.exception.db.DbStorageException;
import com.sunny.procurehub.common.exception.db.DbUnavailableException;
import com.sunny.procurehub.platform.exception.auth.EmailTakenException;
import com.sunny.procurehub.platform.exception.ledger.CreditAccountExistsException;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * 平台 DB 异常业务转换器
 * 按场景与约束名把存储异常翻译为领域异常
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Component
public class DbExceptionTranslator {

    public static final String UQ_USERS_EMAIL = "uq_users_email_lower";
    public static final String UQ_CREDIT_ACCOUNTS_COMPANY = "uq_credit_accounts_company";
    public static final String UQ_INVITE_USES = "uq_invite_uses_invite_user";

    public ProcurehubRuntimeException map(DbScene scene, DbStorageException dbException) {
        if (dbException instanceof DbConstraintViolationException violation) {
            if (violation.isUnique()) {
                return mapUnique(scene, violation);
            }
            return new BadRequestException(dbException, ErrorType.STORE_CONSTRAINT_VIOLATION,
                    constraintContext(violation), "参数错误");
        }

        if (dbException instanceof DbUnavailableException unavailable) {
            if (unavailable.getReason() == DbUnavailableException.Reason.QUERY_TIMEOUT) {
                return new ServiceUnavailableException(dbException, ErrorType.STORE_TIMEOUT, Map.of(), "存储操作超时");
            }
            return new ServiceUnavailableException(dbException, ErrorType.STORE_UNAVAILABLE, Map.of(), "存储暂不可用");
        }

        return new InternalException(dbException, ErrorType.STORE_INTERNAL, Map.of(), "服务器内部错误");
    }

    private ProcurehubRuntimeException mapUnique(DbScene scene, DbConstraintViolationException violation) {
        String constraintName = violation.getConstraintName();
        if (scene == DbScene.USER_REGISTER && UQ_USERS_EMAIL.equals(constraintName)) {
            return new EmailTakenException(violation);
        }

        if (scene == DbScene.CREDIT_ACCOUNT_OPEN && UQ_CREDIT_ACCOUNTS_COMPANY.equals(constraintName)) {
            return new CreditAccountExistsException(violation);
        }

        // 同一用户重复消费同一邀请属于程序缺陷，不是并发争用
        if (UQ_INVITE_USES.equals(constraintName)) {
            return new InternalException(violation, ErrorType.STORE_INTERNAL, constraintContext(violation),
                    "邀请使用记录重复");
        }

        return new AlreadyExistsException(violation, ErrorType.ALREADY_EXISTS, constraintContext(violation), "数据已存在");
    }

    private Map<String, String> constraintContext(DbConstraintViolationException violation) {
        Map<String, String> context = new HashMap<>();
        context.put("kind", violation.getKind().name());
        if (violation.getConstraintName() != null) {
            context.put("constraint", violation.getConstraintName());
        }
        return context;
    }
}
