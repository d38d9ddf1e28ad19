package com.ryuqq.fleet.cli.deploy;

import com.ryuqq.fleet.application.deploy.DeployContext;
import com.ryuqq.fleet.core.operation.Operation;

import java.util.List;
import java.util.function.Consumer;

/**
 * Deploy 파일의 한 단계.
 *
 * <p>파일을 읽을 때 Operation까지 생성해 두므로, 평가 단계에서는 인자 오류가 발생하지 않습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public sealed interface DeployStep permits DeployStep.OperationStep, DeployStep.IncludeStep {

    /**
     * 단계를 적용할 Host 패턴 (비어있으면 현재 범위 전체).
     *
     * @return Host/그룹 이름 또는 glob 목록
     */
    List<String> hosts();

    /**
     * 호출 위치 라벨 (예: deploy.yml#3).
     *
     * @return 라벨
     */
    String label();

    /**
     * 컨텍스트에 단계 기록.
     *
     * @param ctx 현재 Deploy 컨텍스트
     */
    void apply(DeployContext ctx);

    /**
     * Operation 기록 단계.
     *
     * @param name Operation 이름
     * @param operation 생성된 Operation
     * @param hosts Host 패턴
     * @param label 호출 위치 라벨
     */
    record OperationStep(String name, Operation operation, List<String> hosts, String label) implements DeployStep {

        public OperationStep {
            hosts = List.copyOf(hosts);
        }

        @Override
        public void apply(DeployContext ctx) {
            inScope(ctx, hosts, scoped -> scoped.op(name, operation, label));
        }
    }

    /**
     * 다른 Deploy 파일 include 단계.
     *
     * @param taskName 이름 접두어 (include한 파일 경로)
     * @param steps include한 파일의 단계
     * @param hosts Host 패턴
     * @param label 호출 위치 라벨
     */
    record IncludeStep(String taskName, List<DeployStep> steps, List<String> hosts, String label) implements DeployStep {

        public IncludeStep {
            steps = List.copyOf(steps);
            hosts = List.copyOf(hosts);
        }

        @Override
        public void apply(DeployContext ctx) {
            inScope(ctx, hosts, scoped -> scoped.include(taskName, label, nested -> {
                for (DeployStep step : steps) {
                    step.apply(nested);
                }
            }));
        }
    }

    private static void inScope(DeployContext ctx, List<String> hosts, Consumer<DeployContext> block) {
        if (hosts.isEmpty()) {
            block.accept(ctx);
        } else {
            ctx.onHosts(hosts, block);
        }
    }
}
