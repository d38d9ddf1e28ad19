package com.ryuqq.fleet.core.fact;

import java.util.List;
import java.util.regex.Pattern;

/**
 * POSIX 셸 인자 인용.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class ShellQuote {

    private static final Pattern SAFE = Pattern.compile("^[a-zA-Z0-9_@%+=:,./\\-]+$");

    private ShellQuote() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단일 인자 인용.
     *
     * @param value 인자
     * @return 안전한 문자만 있으면 그대로, 아니면 작은따옴표로 감싼 값
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static String quote(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (!value.isEmpty() && SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /**
     * 인자 목록을 인용하여 공백으로 연결.
     *
     * @param values 인자 목록
     * @return 연결된 문자열
     */
    public static String join(List<String> values) {
        StringBuilder builder = new StringBuilder();
        for (String value : values) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(quote(value));
        }
        return builder.toString();
    }
}
