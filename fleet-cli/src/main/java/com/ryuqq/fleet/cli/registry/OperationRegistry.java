package com.ryuqq.fleet.cli.registry;

import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.operation.AptPackagesOperation;
import com.ryuqq.fleet.core.operation.GroupOperation;
import com.ryuqq.fleet.core.operation.NpmPackagesOperation;
import com.ryuqq.fleet.core.operation.Operation;
import com.ryuqq.fleet.core.operation.ShellOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Operation 타입 이름 → Operation 생성기 등록부.
 *
 * <p>각 타입은 명령행 위치 인자를 받을 "주 인자" 이름을 가집니다.
 * 예를 들어 {@code server.shell 'echo hi'}의 위치 인자는 {@code commands}로,
 * {@code apt.packages nginx}의 위치 인자는 {@code packages}로 전달됩니다.</p>
 *
 * <p><strong>기본 등록 타입:</strong></p>
 * <ul>
 *   <li>server.shell: commands</li>
 *   <li>server.group: group, present, system</li>
 *   <li>apt.packages: packages, present, update</li>
 *   <li>npm.packages: packages, present, directory</li>
 * </ul>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class OperationRegistry {

    private record Entry(String primaryArgument, Function<OperationArguments, Operation> factory) {
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * 기본 Operation이 등록된 Registry 생성.
     *
     * @return OperationRegistry
     */
    public static OperationRegistry defaults() {
        OperationRegistry registry = new OperationRegistry();
        registry.register(ShellOperation.TYPE, "commands",
            args -> new ShellOperation(args.strings("commands")));
        registry.register(GroupOperation.TYPE, "group",
            args -> new GroupOperation(args.requiredString("group"), args.bool("present", true),
                args.bool("system", false)));
        registry.register(AptPackagesOperation.TYPE, "packages",
            args -> new AptPackagesOperation(args.strings("packages"), args.bool("present", true),
                args.bool("update", false)));
        registry.register(NpmPackagesOperation.TYPE, "packages",
            args -> new NpmPackagesOperation(args.strings("packages"), args.bool("present", true),
                args.optionalString("directory")));
        return registry;
    }

    /**
     * Operation 타입 등록.
     *
     * @param type 타입 이름 (예: server.shell)
     * @param primaryArgument 위치 인자를 받을 인자 이름
     * @param factory 인자 → Operation
     * @throws IllegalArgumentException 인자가 null이거나 이미 등록된 타입인 경우
     */
    public void register(String type, String primaryArgument, Function<OperationArguments, Operation> factory) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (primaryArgument == null || primaryArgument.isBlank()) {
            throw new IllegalArgumentException("primaryArgument cannot be null or blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (entries.putIfAbsent(type, new Entry(primaryArgument, factory)) != null) {
            throw new IllegalArgumentException("Operation already registered: " + type);
        }
    }

    public boolean contains(String type) {
        return entries.containsKey(type);
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * 인자 Map으로 Operation 생성.
     *
     * @param type 타입 이름
     * @param args 인자 Map
     * @return Operation
     * @throws DefinitionException 알 수 없는 타입이거나 인자가 잘못된 경우
     */
    public Operation create(String type, Map<String, Object> args) {
        Entry entry = find(type)
            .orElseThrow(() -> new DefinitionException("Unknown operation: " + type));
        try {
            return entry.factory().apply(new OperationArguments(type, args));
        } catch (IllegalArgumentException e) {
            throw new DefinitionException("Invalid arguments for " + type + ": " + e.getMessage(), e);
        }
    }

    /**
     * 명령행 토큰으로 Operation 생성.
     *
     * <p>{@code key=value} 형식의 토큰은 이름 있는 인자가 되고, 나머지 토큰은 주 인자 목록이 됩니다.</p>
     *
     * @param type 타입 이름
     * @param tokens 명령행 토큰
     * @return Operation
     * @throws DefinitionException 알 수 없는 타입이거나 인자가 잘못된 경우
     */
    public Operation createFromTokens(String type, List<String> tokens) {
        Entry entry = find(type)
            .orElseThrow(() -> new DefinitionException("Unknown operation: " + type));
        Map<String, Object> args = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        for (String token : tokens) {
            int separator = token.indexOf('=');
            if (separator > 0 && token.substring(0, separator).matches("[a-z_]+")) {
                args.put(token.substring(0, separator), token.substring(separator + 1));
            } else {
                positional.add(token);
            }
        }
        if (!positional.isEmpty()) {
            args.put(entry.primaryArgument(), positional.size() == 1 ? positional.get(0) : positional);
        }
        return create(type, args);
    }

    private Optional<Entry> find(String type) {
        return Optional.ofNullable(entries.get(type));
    }
}
