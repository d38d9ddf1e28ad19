package com.ryuqq.fleet.core.fact;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Host Fact 정의.
 *
 * <p>Fact는 클래스 계층이 아니라 하나의 값 타입이며, 다음 기능 집합을 보유합니다:</p>
 * <ul>
 *   <li>명령 생성: 인자 목록 → 셸 명령 문자열</li>
 *   <li>파싱: 표준 출력 줄 목록 → 구조화된 값</li>
 *   <li>기본값: 필요한 도구나 자원이 없을 때 반환할 값</li>
 *   <li>존재 확인(선택): Fact 명령 실행 전에 도구/파일 존재 여부를 확인하는 명령</li>
 *   <li>파생(선택): 다른 Fact의 값을 변환하여 얻는 Fact</li>
 * </ul>
 *
 * <p><strong>존재 확인 2단계 조회:</strong></p>
 * <pre>
 * 1. probe 명령 실행 (예: command -v dpkg)
 *    - 0이 아닌 종료 → 도구 없음 → defaultValue() 반환 (오류 아님)
 * 2. Fact 명령 실행
 *    - 0이 아닌 종료 또는 Transport 실패 → GatherException
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Fact&lt;Map&lt;String, List&lt;String&gt;&gt;&gt; debPackages = Fact.&lt;Map&lt;String, List&lt;String&gt;&gt;&gt;of("deb_packages", "dpkg -l",
 *         PackageParsers::parseDebPackages, Map::of)
 *     .requiringTool("dpkg");
 * </pre>
 *
 * @param <T> Fact 값 타입
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class Fact<T> {

    private final String name;
    private final Function<List<String>, String> commandBuilder;
    private final Function<List<String>, String> probeBuilder;
    private final Function<List<String>, T> parser;
    private final Supplier<T> defaultSupplier;
    private final Fact<?> base;
    private final Function<Object, T> mapper;

    private Fact(
        String name,
        Function<List<String>, String> commandBuilder,
        Function<List<String>, String> probeBuilder,
        Function<List<String>, T> parser,
        Supplier<T> defaultSupplier,
        Fact<?> base,
        Function<Object, T> mapper
    ) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (base == null) {
            if (commandBuilder == null) {
                throw new IllegalArgumentException("commandBuilder cannot be null");
            }
            if (parser == null) {
                throw new IllegalArgumentException("parser cannot be null");
            }
        } else if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.name = name;
        this.commandBuilder = commandBuilder;
        this.probeBuilder = probeBuilder;
        this.parser = parser;
        this.defaultSupplier = defaultSupplier == null ? () -> null : defaultSupplier;
        this.base = base;
        this.mapper = mapper;
    }

    /**
     * 고정 명령 Fact 생성.
     *
     * @param name Fact 이름
     * @param command 셸 명령
     * @param parser 출력 파서
     * @param defaultSupplier 기본값 공급자 (null이면 기본값 null)
     * @param <T> Fact 값 타입
     * @return Fact 인스턴스
     */
    public static <T> Fact<T> of(
        String name,
        String command,
        Function<List<String>, T> parser,
        Supplier<T> defaultSupplier
    ) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be null or blank");
        }
        return new Fact<>(name, args -> command, null, parser, defaultSupplier, null, null);
    }

    /**
     * 인자에 따라 명령이 달라지는 Fact 생성.
     *
     * @param name Fact 이름
     * @param commandBuilder 인자 → 셸 명령
     * @param parser 출력 파서
     * @param defaultSupplier 기본값 공급자 (null이면 기본값 null)
     * @param <T> Fact 값 타입
     * @return Fact 인스턴스
     */
    public static <T> Fact<T> withArgs(
        String name,
        Function<List<String>, String> commandBuilder,
        Function<List<String>, T> parser,
        Supplier<T> defaultSupplier
    ) {
        return new Fact<>(name, commandBuilder, null, parser, defaultSupplier, null, null);
    }

    /**
     * 다른 Fact의 값을 변환하는 파생 Fact 생성.
     *
     * <p>파생 Fact는 자체 명령이 없으며, 기반 Fact를 같은 인자로 조회한 뒤 mapper를 적용합니다.
     * 기반 Fact의 캐시를 공유하므로 추가 원격 호출이 발생하지 않습니다.</p>
     *
     * @param name Fact 이름
     * @param base 기반 Fact
     * @param mapper 기반 값 → 파생 값
     * @param <B> 기반 Fact 값 타입
     * @param <T> 파생 Fact 값 타입
     * @return 파생 Fact 인스턴스
     */
    @SuppressWarnings("unchecked")
    public static <B, T> Fact<T> derived(String name, Fact<B> base, Function<? super B, ? extends T> mapper) {
        if (base == null) {
            throw new IllegalArgumentException("base cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        Function<Object, T> erased = value -> mapper.apply((B) value);
        return new Fact<>(name, null, null, null, null, base, erased);
    }

    /**
     * 도구 존재 확인을 추가한 Fact 생성.
     *
     * @param tool 필요한 실행 파일 이름
     * @return 새 Fact 인스턴스
     */
    public Fact<T> requiringTool(String tool) {
        if (tool == null || tool.isBlank()) {
            throw new IllegalArgumentException("tool cannot be null or blank");
        }
        return withProbe(args -> "command -v " + ShellQuote.quote(tool));
    }

    /**
     * 파일 존재 확인을 추가한 Fact 생성.
     *
     * @param path 필요한 파일 경로
     * @return 새 Fact 인스턴스
     */
    public Fact<T> requiringPath(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        return withProbe(args -> "test -e " + ShellQuote.quote(path));
    }

    /**
     * 인자에 따라 달라지는 존재 확인 명령을 추가한 Fact 생성.
     *
     * @param probeBuilder 인자 → 존재 확인 명령
     * @return 새 Fact 인스턴스
     */
    public Fact<T> withProbe(Function<List<String>, String> probeBuilder) {
        if (isDerived()) {
            throw new IllegalStateException("Derived fact cannot declare a probe: " + name);
        }
        return new Fact<>(name, commandBuilder, probeBuilder, parser, defaultSupplier, null, null);
    }

    public String getName() {
        return name;
    }

    /**
     * Fact 명령 생성.
     *
     * @param args Fact 인자
     * @return 셸 명령
     * @throws IllegalStateException 파생 Fact인 경우
     */
    public String buildCommand(List<String> args) {
        if (isDerived()) {
            throw new IllegalStateException("Derived fact has no command: " + name);
        }
        return commandBuilder.apply(List.copyOf(args));
    }

    /**
     * 존재 확인 명령 생성.
     *
     * @param args Fact 인자
     * @return 존재 확인 명령 (없으면 empty)
     */
    public Optional<String> buildProbe(List<String> args) {
        if (probeBuilder == null) {
            return Optional.empty();
        }
        return Optional.of(probeBuilder.apply(List.copyOf(args)));
    }

    /**
     * 명령 출력 파싱.
     *
     * @param lines 표준 출력 줄 목록
     * @return 파싱된 값
     * @throws IllegalStateException 파생 Fact인 경우
     */
    public T parse(List<String> lines) {
        if (isDerived()) {
            throw new IllegalStateException("Derived fact has no parser: " + name);
        }
        return parser.apply(lines);
    }

    /**
     * 기본값 생성.
     *
     * @return 기본값 (null 가능)
     */
    public T defaultValue() {
        return defaultSupplier.get();
    }

    public boolean isDerived() {
        return base != null;
    }

    /**
     * 기반 Fact 조회.
     *
     * @return 기반 Fact (파생 Fact가 아니면 empty)
     */
    public Optional<Fact<?>> getBase() {
        return Optional.ofNullable(base);
    }

    /**
     * 기반 Fact 값을 파생 값으로 변환.
     *
     * @param baseValue 기반 Fact 값
     * @return 파생 값
     * @throws IllegalStateException 파생 Fact가 아닌 경우
     */
    public T fromBase(Object baseValue) {
        if (!isDerived()) {
            throw new IllegalStateException("Fact is not derived: " + name);
        }
        return mapper.apply(baseValue);
    }

    @Override
    public String toString() {
        return "Fact{" + name + '}';
    }
}
