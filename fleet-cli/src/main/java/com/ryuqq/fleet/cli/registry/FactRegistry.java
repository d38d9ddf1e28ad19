package com.ryuqq.fleet.cli.registry;

import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.fact.Fact;
import com.ryuqq.fleet.core.fact.PackageFacts;
import com.ryuqq.fleet.core.fact.ServerFacts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fact 이름 → Fact 정의 등록부.
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class FactRegistry {

    private final Map<String, Fact<?>> facts = new TreeMap<>();

    /**
     * 서버 Fact와 패키지 Fact가 등록된 Registry 생성.
     *
     * @return FactRegistry
     */
    public static FactRegistry defaults() {
        FactRegistry registry = new FactRegistry();
        List<Fact<?>> all = new ArrayList<>(ServerFacts.all());
        all.addAll(PackageFacts.all());
        for (Fact<?> fact : all) {
            registry.register(fact);
        }
        return registry;
    }

    /**
     * Fact 등록.
     *
     * @param fact Fact 정의
     * @throws IllegalArgumentException null이거나 같은 이름이 이미 등록된 경우
     */
    public void register(Fact<?> fact) {
        if (fact == null) {
            throw new IllegalArgumentException("fact cannot be null");
        }
        if (facts.putIfAbsent(fact.getName(), fact) != null) {
            throw new IllegalArgumentException("Fact already registered: " + fact.getName());
        }
    }

    /**
     * Fact 조회.
     *
     * @param name Fact 이름
     * @return Fact 정의
     * @throws DefinitionException 등록되지 않은 이름인 경우
     */
    public Fact<?> get(String name) {
        Fact<?> fact = facts.get(name);
        if (fact == null) {
            throw new DefinitionException("Unknown fact: " + name);
        }
        return fact;
    }

    public List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(facts.keySet()));
    }
}
