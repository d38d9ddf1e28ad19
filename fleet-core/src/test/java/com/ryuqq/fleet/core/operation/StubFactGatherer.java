package com.ryuqq.fleet.core.operation;

import com.ryuqq.fleet.core.fact.Fact;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Host;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fact 이름별 고정 값을 반환하는 테스트용 FactGatherer.
 */
class StubFactGatherer implements FactGatherer {

    private final Map<String, Object> values = new HashMap<>();
    private final List<String> requested = new ArrayList<>();

    StubFactGatherer with(Fact<?> fact, Object value) {
        values.put(fact.getName(), value);
        return this;
    }

    List<String> requested() {
        return requested;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(Host host, Fact<T> fact, List<String> args) {
        requested.add(fact.getName() + args);
        if (values.containsKey(fact.getName())) {
            return (T) values.get(fact.getName());
        }
        return fact.defaultValue();
    }
}
