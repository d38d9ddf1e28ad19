package com.ryuqq.fleet.core.fact.value;

import java.util.List;

/**
 * crontab 항목.
 *
 * <p>시간 필드는 crontab 원문 그대로 보관합니다 (예: "*", "5", "*&#47;10").</p>
 *
 * @param minute 분
 * @param hour 시
 * @param month 월
 * @param dayOfMonth 일
 * @param dayOfWeek 요일
 * @param comments 항목 바로 앞의 주석/빈 줄
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public record CronEntry(
    String minute,
    String hour,
    String month,
    String dayOfMonth,
    String dayOfWeek,
    List<String> comments
) {

    public CronEntry {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}
