package com.ryuqq.fleet.cli.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.PrintWriter;
import java.util.Map;

/**
 * Host별 Fact 값을 JSON 객체로 출력.
 *
 * <p>값이 없는 Host는 {@code null}로 출력하며, 날짜 Fact는 ISO-8601 문자열이 됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class FactResultWriter {

    private final ObjectMapper jsonMapper;

    public FactResultWriter() {
        this(defaultMapper());
    }

    public FactResultWriter(ObjectMapper jsonMapper) {
        if (jsonMapper == null) {
            throw new IllegalArgumentException("jsonMapper cannot be null");
        }
        this.jsonMapper = jsonMapper;
    }

    /**
     * 출력용 ObjectMapper 생성 (들여쓰기, java.time 지원).
     *
     * @return ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Fact 값 JSON 변환.
     *
     * @param values Host 이름 → Fact 값 (null 허용, 순서 유지)
     * @return JSON 문자열
     * @throws IllegalStateException 값을 직렬화할 수 없는 경우
     */
    public String toJson(Map<String, Object> values) {
        try {
            return jsonMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fact values: " + e.getOriginalMessage(), e);
        }
    }

    public void write(Map<String, Object> values, PrintWriter out) {
        out.println(toJson(values));
        out.flush();
    }
}
