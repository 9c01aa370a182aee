package com.sunny.procurehub.common.exception.db;

import com.sunny.procurehub.common.exception.ConflictException;
import com.sunny.procurehub.common.exception.db.dialect.H2ExceptionConverter;
import com.sunny.procurehub.common.exception.db.dialect.PostgreSQLExceptionConverter;
import java.sql.SQLException;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SQLExceptionConverterFactoryTest {

    @AfterEach
    void tearDown() {
        SQLExceptionUtils.initialize(null);
    }

    @Test
    void detect_shouldPreferH2EvenInPostgresCompatibilityMode() {
        Assertions.assertEquals(SqlDialect.POSTGRESQL,
                SqlDialect.detect("jdbc:postgresql://localhost:5432/procurehub", null));
        Assertions.assertEquals(SqlDialect.POSTGRESQL, SqlDialect.detect(null, "PostgreSQL JDBC Driver"));
        Assertions.assertEquals(SqlDialect.H2, SqlDialect.detect("jdbc:h2:mem:procurehub;MODE=PostgreSQL", null));
        Assertions.assertEquals(SqlDialect.POSTGRESQL, SqlDialect.detect("jdbc:unknown://host/db", "Unknown Driver"));
    }

    @Test
    void create_shouldReturnConverterForDialect() {
        Assertions.assertInstanceOf(PostgreSQLExceptionConverter.class,
                SQLExceptionConverterFactory.create(SqlDialect.POSTGRESQL));
        Assertions.assertInstanceOf(H2ExceptionConverter.class, SQLExceptionConverterFactory.create(SqlDialect.H2));
        Assertions.assertEquals(SqlDialect.POSTGRESQL,
                SQLExceptionConverterFactory.create((javax.sql.DataSource) null).dialect());
    }

    @Test
    void translate_shouldUseInitializedConverter() {
        SQLExceptionUtils.initialize(new H2ExceptionConverter());
        SQLException sqlException = new SQLException("Timeout trying to lock table", "HYT00", 50200);

        DbStorageException ex = SQLExceptionUtils.translate(new RuntimeException("wrapped", sqlException));

        Assertions.assertEquals(SqlDialect.H2, SQLExceptionUtils.currentDialect());
        Assertions.assertInstanceOf(DbUnavailableException.class, ex);
        Assertions.assertEquals(DbUnavailableException.Reason.LOCK_TIMEOUT, ((DbUnavailableException) ex).getReason());
    }

    @Test
    void translate_shouldReturnNullWithoutSqlException() {
        Assertions.assertNull(SQLExceptionUtils.translate(new IllegalStateException("plain")));
        Assertions.assertNull(SQLExceptionUtils.translate(null));
    }

    @Test
    void resolve_shouldPassThroughStorageExceptionsAndSkipDomainErrors() {
        DbUnavailableException deadlock = new DbUnavailableException(DbUnavailableException.Reason.DEADLOCK,
                new RuntimeException("deadlock"), 0, "40P01", null);

        Assertions.assertSame(deadlock, SQLExceptionUtils.resolve(deadlock));
        Assertions.assertNull(SQLExceptionUtils.resolve(new ConflictException("幂等键已被其他操作使用")));
        Assertions.assertInstanceOf(DbUnavailableException.class, SQLExceptionUtils.resolve(
                new RuntimeException("wrapped", new SQLException("deadlock detected", "40P01"))));
    }

    @Test
    void uniqueViolation_shouldReportConstraintOfIdempotencyKeyConflict() {
        SQLException duplicate = new SQLException(
                "ERROR: duplicate key value violates unique constraint \"uq_ledger_idempotency\"", "23505");
        SQLException check = new SQLException(
                "ERROR: new row violates check constraint \"chk_ledger_amount\"", "23514");

        Assertions.assertEquals(Optional.of("uq_ledger_idempotency"),
                SQLExceptionUtils.uniqueViolation(new RuntimeException("insert failed", duplicate)));
        Assertions.assertEquals(Optional.empty(),
                SQLExceptionUtils.uniqueViolation(new RuntimeException("insert failed", check)));
        Assertions.assertEquals(Optional.empty(), SQLExceptionUtils.uniqueViolation(new IllegalStateException()));
    }
}
