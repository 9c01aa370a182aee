package com.sunny.procurehub.common.exception.db;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 约束名称提取器
 * 从驱动异常消息中解析约束或唯一索引名
 *
 * @author Sunny
 * @date 2026-02-26
 */
public final class ConstraintNameExtractor {

    // PostgreSQL: duplicate key value violates unique constraint "uq_users_email_lower"
    private static final Pattern CONSTRAINT_PATTERN = Pattern.compile(
            "constraint\\s+[`\"']([a-zA-Z0-9_.$-]+)[`\"']",
            Pattern.CASE_INSENSITIVE);

    // H2: Unique index or primary key violation: "PUBLIC.UQ_USERS_EMAIL_LOWER ON PUBLIC.USERS(...)"
    private static final Pattern H2_INDEX_PATTERN = Pattern.compile(
            "violation:\\s*\"(?:[a-zA-Z0-9_]+\\.)?([a-zA-Z0-9_]+)\\s+ON\\s",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern H2_INDEX_SUFFIX = Pattern.compile("_index_[0-9a-f]+$");

    private ConstraintNameExtractor() {
    }

    public static Optional<String> extract(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            Optional<String> fromMessage = extract(cursor.getMessage());
            if (fromMessage.isPresent()) {
                return fromMessage;
            }
            cursor = cursor.getCause();
        }
        return Optional.empty();
    }

    public static Optional<String> extract(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }

        Optional<String> fromH2 = match(H2_INDEX_PATTERN, message)
                .map(name -> H2_INDEX_SUFFIX.matcher(name).replaceFirst(""));
        if (fromH2.isPresent()) {
            return fromH2;
        }

        return match(CONSTRAINT_PATTERN, message);
    }

    private static Optional<String> match(Pattern pattern, String message) {
        Matcher matcher = pattern.matcher(message);
        if (!matcher.find()) {
            return Optional.empty();
        }

        String name = matcher.group(1);
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }

        return Optional.of(name.toLowerCase(Locale.ROOT));
    }
}
