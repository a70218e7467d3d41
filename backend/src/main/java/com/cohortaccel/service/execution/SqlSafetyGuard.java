package com.cohortaccel.service.execution;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only check applied before any statement reaches the data store.
 * Comments and string literals are stripped first so criteria descriptions
 * cannot trip the keyword scan.
 */
@Component
public class SqlSafetyGuard {

    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern DESTRUCTIVE = Pattern.compile(
        "\\b(drop|delete|truncate|update|insert|alter|merge|create|grant|revoke|call|execute)\\b");

    /**
     * @return the reason the statement is rejected, or empty when it is a single read-only query
     */
    public Optional<String> findViolation(String sql) {
        if (sql == null || sql.isBlank()) {
            return Optional.of("Empty statement");
        }
        String stripped = STRING_LITERAL.matcher(
            BLOCK_COMMENT.matcher(LINE_COMMENT.matcher(sql).replaceAll(" ")).replaceAll(" ")
        ).replaceAll("''").trim().toLowerCase(Locale.ROOT);

        if (!(stripped.startsWith("select") || stripped.startsWith("with"))) {
            return Optional.of("Only select/with queries are allowed");
        }
        String body = stripped.endsWith(";") ? stripped.substring(0, stripped.length() - 1) : stripped;
        if (body.contains(";")) {
            return Optional.of("Multiple statements are not allowed");
        }
        Matcher matcher = DESTRUCTIVE.matcher(body);
        if (matcher.find()) {
            return Optional.of("Destructive keyword '" + matcher.group(1) + "' is not allowed");
        }
        return Optional.empty();
    }
}
