package com.ryuqq.fleet.application.fact;

import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.fact.Fact;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.fact.FactKey;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.FactCache;
import com.ryuqq.fleet.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Transport와 {@link FactCache}를 사용하는 기본 Fact 조회기.
 *
 * <p><strong>조회 흐름:</strong></p>
 * <pre>
 * get(host, fact, args)
 *   ├─ 파생 Fact → 기반 Fact 조회 후 변환
 *   └─ cache.getOrLoad(FactKey)
 *        ├─ probe 명령 (있으면) → 실패 시 defaultValue()
 *        ├─ Fact 명령 → 0이 아닌 종료 시 GatherException
 *        └─ parse(stdout)
 * </pre>
 *
 * <p>모든 명령은 {@link CommandKind#FACT_PROBE}로 실행되므로 dry-run에서도 허용됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class DefaultFactGatherer implements FactGatherer {

    private static final Logger log = LoggerFactory.getLogger(DefaultFactGatherer.class);

    private final Transport transport;
    private final FactCache cache;
    private final boolean debugFacts;

    public DefaultFactGatherer(Transport transport, FactCache cache) {
        this(transport, cache, false);
    }

    /**
     * 생성자.
     *
     * @param transport 명령 실행 Transport
     * @param cache 실행 단위 Fact 캐시
     * @param debugFacts true면 조회한 Fact 값을 INFO로 출력
     */
    public DefaultFactGatherer(Transport transport, FactCache cache, boolean debugFacts) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        this.transport = transport;
        this.cache = cache;
        this.debugFacts = debugFacts;
    }

    @Override
    public <T> T get(Host host, Fact<T> fact, List<String> args) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (fact == null) {
            throw new IllegalArgumentException("fact cannot be null");
        }
        List<String> factArgs = args == null ? List.of() : List.copyOf(args);

        if (fact.isDerived()) {
            Fact<?> base = fact.getBase().orElseThrow();
            Object baseValue = get(host, base, factArgs);
            return fact.fromBase(baseValue);
        }

        FactKey key = new FactKey(host.getName(), fact.getName(), factArgs);
        return cache.getOrLoad(key, () -> load(host, fact, factArgs));
    }

    private <T> T load(Host host, Fact<T> fact, List<String> args) {
        Optional<String> probe = fact.buildProbe(args);
        if (probe.isPresent()) {
            CommandResult probeResult = execute(host, fact, probe.get());
            if (!probeResult.isSuccess()) {
                log.debug("Fact {} absent on {} (probe exit {}), using default",
                    fact.getName(), host.getName(), probeResult.exitCode());
                return fact.defaultValue();
            }
        }

        CommandResult result = execute(host, fact, fact.buildCommand(args));
        if (!result.isSuccess()) {
            throw new GatherException(host.getName(), fact.getName(),
                "command exited with " + result.exitCode() + stderrSuffix(result));
        }

        T value;
        try {
            value = fact.parse(result.stdout());
        } catch (RuntimeException e) {
            throw new GatherException(host.getName(), fact.getName(), e);
        }
        if (debugFacts) {
            log.info("Fact {}{} on {} = {}", fact.getName(), args.isEmpty() ? "" : args, host.getName(), value);
        }
        return value;
    }

    private CommandResult execute(Host host, Fact<?> fact, String command) {
        try {
            return transport.execute(host, command, CommandKind.FACT_PROBE);
        } catch (TransportException e) {
            throw new GatherException(host.getName(), fact.getName(), e);
        }
    }

    private static String stderrSuffix(CommandResult result) {
        if (result.stderr().isEmpty()) {
            return "";
        }
        return ": " + String.join(" ", result.stderr());
    }
}
