package com.ryuqq.fleet.application.deploy;

/**
 * Deploy 정의.
 *
 * <p>Deploy 정의는 한 번의 실행에서 정확히 한 번, 단일 스레드로 위에서 아래로 평가됩니다.
 * 정의 안에서 {@link DeployContext}를 통해 Operation을 기록하고 Fact를 조회합니다.
 * 이 순차 평가가 Plan 전역 순서의 유일한 근거입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Deploy deploy = ctx -&gt; {
 *     ctx.op("Install nginx", AptPackagesOperation.install("nginx"));
 *     ctx.onHosts(List.of("db"), db -&gt; db.op("Create group", GroupOperation.present("postgres")));
 *     ctx.forEachHost((host, hostCtx) -&gt; {
 *         if ("Ubuntu".equals(hostCtx.fact(host, ServerFacts.LINUX_NAME))) {
 *             hostCtx.op("Install ufw", AptPackagesOperation.install("ufw"));
 *         }
 *     });
 * };
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Deploy {

    /**
     * Deploy 정의 평가.
     *
     * @param context 평가 컨텍스트 (전체 인벤토리 범위)
     */
    void define(DeployContext context);
}
