package com.ryuqq.fleet.application.deploy;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deploy 정의 내 호출 위치 캡처.
 *
 * <p>{@link StackWalker}로 Deploy 정의 진입점({@link PlanEvaluator})부터 호출 지점까지의
 * 사용자 프레임을 모두 모아 "클래스.메서드:줄번호" 경로로 반환합니다.
 * 같은 helper 메서드라도 서로 다른 위치에서 호출되면 다른 호출 위치가 됩니다.</p>
 *
 * <pre>
 * com.acme.WebDeploy.define:12 &lt; com.acme.WebDeploy.install:40
 * </pre>
 *
 * <p>Deploy API 클래스와 JDK 프레임은 경로에서 제외합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
final class CallSites {

    static final String FRAME_SEPARATOR = " < ";

    private static final StackWalker WALKER = StackWalker.getInstance();

    private static final Set<String> API_CLASSES = Set.of(
        CallSites.class.getName(),
        DeployContext.class.getName()
    );

    private static final String ENTRY_CLASS = PlanEvaluator.class.getName();

    private CallSites() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String capture() {
        List<String> frames = WALKER.walk(stack -> stack
            .takeWhile(frame -> !ENTRY_CLASS.equals(frame.getClassName()))
            .filter(frame -> !API_CLASSES.contains(frame.getClassName()))
            .filter(frame -> !frame.getClassName().startsWith("java."))
            .map(frame -> frame.getClassName() + "." + frame.getMethodName() + ":" + frame.getLineNumber())
            .collect(Collectors.toList()));
        if (frames.isEmpty()) {
            return "<unknown>";
        }
        // 바깥 프레임부터
        Collections.reverse(frames);
        return String.join(FRAME_SEPARATOR, frames);
    }
}
