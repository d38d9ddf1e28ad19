package com.ryuqq.fleet.core.inventory;

import com.ryuqq.fleet.core.model.HostName;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Host 선택 패턴 매칭.
 *
 * <p>패턴은 Host 이름, 그룹 이름, 또는 Host 이름 glob입니다.
 * glob은 {@code *}(임의 문자열)와 {@code ?}(임의 한 문자)만 지원합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
final class HostPatterns {

    private HostPatterns() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean matches(String pattern, HostName name, List<String> groups) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String trimmed = pattern.trim();
        if (trimmed.equals(name.getValue()) || groups.contains(trimmed)
            || InventoryDefinition.ALL_GROUP.equals(trimmed)) {
            return true;
        }
        if (trimmed.indexOf('*') < 0 && trimmed.indexOf('?') < 0) {
            return false;
        }
        return globToRegex(trimmed).matcher(name.getValue()).matches();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }
}
