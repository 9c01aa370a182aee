package com.sunny.procurehub.platform.storage;

import com.sunny.procurehub.common.constant.ErrorType;
import com.sunny.procurehub.common.exception.ProcurehubRuntimeException;
import com.sunny.procurehub.common.exception.ServiceUnavailableException;
import com.sunny.procurehub.common.exception.db.DbStorageException;
import com.sunny.procurehub.common.exception.db.SQLExceptionUtils;
import com.sunny.procurehub.platform.exception.translator.DbExceptionTranslator;
import com.sunny.procurehub.platform.exception.translator.DbScene;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 事务执行器
 * 负责事务边界、瞬时故障重试、存储异常翻译与保存点唯一插入
 *
 * <p>已处于事务中时直接加入外层事务，不再单独重试，由最外层统一重试整个工作单元。
 *
 * @author Sunny
 * @date 2026-03-02
 */
@Slf4j
@Component
@DependsOn("sqlExceptionConverter")
public class TransactionExecutor {

    private static final long BASE_BACKOFF_MILLIS = 50L;

    private final TransactionTemplate requiredTemplate;
    private final TransactionTemplate nestedTemplate;
    private final DbExceptionTranslator dbExceptionTranslator;
    private final int maxAttempts;

    public TransactionExecutor(PlatformTransactionManager transactionManager,
                               DbExceptionTranslator dbExceptionTranslator,
                               @Value("${storage.transaction.timeout-seconds:5}") int timeoutSeconds,
                               @Value("${storage.transaction.max-attempts:3}") int maxAttempts) {
        this.requiredTemplate = new TransactionTemplate(transactionManager);
        this.requiredTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiredTemplate.setTimeout(timeoutSeconds);
        this.nestedTemplate = new TransactionTemplate(transactionManager);
        this.nestedTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        this.dbExceptionTranslator = dbExceptionTranslator;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public <T> T execute(DbScene scene, Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return translate(scene, work);
        }

        int attempt = 1;
        while (true) {
            try {
                return requiredTemplate.execute(status -> work.get());
            } catch (RuntimeException ex) {
                DbStorageException dbException = SQLExceptionUtils.resolve(ex);
                if (dbException != null && dbException.isRetryable() && attempt < maxAttempts) {
                    log.warn("storage_event event=transaction_retry scene={} attempt={} type={}",
                            scene, attempt, dbException.getType());
                    backoff(attempt);
                    attempt++;
                    continue;
                }
                throw toDomainException(scene, ex, dbException);
            }
        }
    }

    public void run(DbScene scene, Runnable work) {
        execute(scene, () -> {
            work.run();
            return null;
        });
    }

    /**
     * 在保存点内执行插入，唯一约束冲突时回滚到保存点并返回 conflict，外层事务继续可用。
     * 其他存储异常原样抛出，交给外层事务处理。
     */
    public InsertResult insertOrConflict(Runnable insert) {
        try {
            nestedTemplate.executeWithoutResult(status -> insert.run());
            return InsertResult.inserted();
        } catch (RuntimeException ex) {
            return SQLExceptionUtils.uniqueViolation(ex)
                    .map(InsertResult::conflict)
                    .orElseThrow(() -> ex);
        }
    }

    private <T> T translate(DbScene scene, Supplier<T> work) {
        try {
            return work.get();
        } catch (RuntimeException ex) {
            throw toDomainException(scene, ex, SQLExceptionUtils.resolve(ex));
        }
    }

    private RuntimeException toDomainException(DbScene scene, RuntimeException original, DbStorageException dbException) {
        if (dbException != null) {
            ProcurehubRuntimeException mapped = dbExceptionTranslator.map(scene, dbException);
            if (mapped.getCode() >= 500) {
                log.error("storage_event event=transaction_failed scene={} type={} sqlState={} constraint={}",
                        scene, mapped.getType(), dbException.getSqlState(), dbException.getConstraintName(), original);
            }
            return mapped;
        }
        if (original instanceof TransactionTimedOutException) {
            log.error("storage_event event=transaction_timeout scene={}", scene, original);
            return new ServiceUnavailableException(original, ErrorType.STORE_TIMEOUT, Map.of(), "存储操作超时");
        }
        return original;
    }

    private void backoff(int attempt) {
        long delay = BASE_BACKOFF_MILLIS * (1L << (attempt - 1));
        long jitter = ThreadLocalRandom.current().nextLong(delay + 1);
        try {
            Thread.sleep(delay + jitter);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(ex, ErrorType.STORE_UNAVAILABLE, Map.of(), "存储暂不可用");
        }
    }
}
