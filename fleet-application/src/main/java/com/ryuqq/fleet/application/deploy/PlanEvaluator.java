package com.ryuqq.fleet.application.deploy;

import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.exception.GatherException;
import com.ryuqq.fleet.core.fact.FactGatherer;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.plan.OperationRecorder;
import com.ryuqq.fleet.core.plan.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Deploy 정의를 평가하여 동결된 {@link Plan}을 만듭니다.
 *
 * <p>매 호출마다 새 {@link OperationRecorder}를 만들므로, 실행 간에 상태를 공유하지 않습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class PlanEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PlanEvaluator.class);

    /**
     * Deploy 정의 평가.
     *
     * @param deploy Deploy 정의
     * @param inventory 평가 대상 인벤토리
     * @param gatherer Fact 조회기
     * @return 동결된 Plan
     * @throws DefinitionException Deploy 정의 오류
     * @throws GatherException 정의가 처리하지 않은 Fact 조회 실패
     */
    public Plan evaluate(Deploy deploy, Inventory inventory, FactGatherer gatherer) {
        if (inventory == null) {
            throw new IllegalArgumentException("inventory cannot be null");
        }
        return evaluate(deploy, inventory, inventory.getHostNames(), gatherer);
    }

    /**
     * 일부 Host로 범위를 좁혀 Deploy 정의 평가.
     *
     * <p>Fact 조회와 Operation 기록은 {@code scope}의 Host에만 일어납니다.
     * 그룹과 Host 패턴은 여전히 {@code inventory} 전체에서 찾습니다.</p>
     *
     * @param deploy Deploy 정의
     * @param inventory 패턴 조회용 전체 인벤토리
     * @param scope 평가 대상 Host
     * @param gatherer Fact 조회기
     * @return 동결된 Plan
     * @throws DefinitionException Deploy 정의 오류
     * @throws GatherException 정의가 처리하지 않은 Fact 조회 실패
     */
    public Plan evaluate(Deploy deploy, Inventory inventory, Collection<HostName> scope, FactGatherer gatherer) {
        if (deploy == null) {
            throw new IllegalArgumentException("deploy cannot be null");
        }
        if (inventory == null) {
            throw new IllegalArgumentException("inventory cannot be null");
        }
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (gatherer == null) {
            throw new IllegalArgumentException("gatherer cannot be null");
        }

        OperationRecorder recorder = new OperationRecorder();
        recorder.begin();
        DeployContext root = DeployContext.root(new DeploySession(inventory, recorder, gatherer), scope);

        log.debug("Evaluating deploy over {} of {} hosts", scope.size(), inventory.size());
        deploy.define(root);

        Plan plan = recorder.finish();
        log.info("Plan ready: {} operations across {} hosts", plan.size(), plan.getHosts().size());
        return plan;
    }
}
