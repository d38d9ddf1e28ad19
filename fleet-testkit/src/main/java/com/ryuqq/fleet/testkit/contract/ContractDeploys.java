package com.ryuqq.fleet.testkit.contract;

import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.core.fact.ServerFacts;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.operation.AptPackagesOperation;
import com.ryuqq.fleet.core.operation.ShellOperation;

import java.util.List;

/**
 * 계약 테스트용 Deploy 정의 모음.
 *
 * <p>명령 문자열은 상수로 공개되어 {@link RecordingTransport} 응답 지정과 호출 검증에 사용합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class ContractDeploys {

    public static final String X_COMMAND = "echo x";
    public static final String Y_COMMAND = "echo y";
    public static final String WEB_RELOAD_COMMAND = "systemctl reload nginx";
    public static final String REPORT_COMMAND = "echo done";

    private ContractDeploys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전체 범위 Operation X 다음에 Host b 전용 Operation Y를 기록하는 Deploy.
     *
     * @return Deploy
     */
    public static Deploy scopedFollowUp() {
        return ctx -> {
            ctx.op("X", ShellOperation.of(X_COMMAND));
            ctx.onHosts(List.of("b"), scoped -> scoped.op("Y", ShellOperation.of(Y_COMMAND)));
        };
    }

    /**
     * 전체 범위 Operation X 다음에 전체 범위 Operation Y를 기록하는 Deploy.
     *
     * @return Deploy
     */
    public static Deploy twoGlobalSteps() {
        return ctx -> {
            ctx.op("X", ShellOperation.of(X_COMMAND));
            ctx.op("Y", ShellOperation.of(Y_COMMAND));
        };
    }

    /**
     * 범위 축소와 Host별 반복, include를 섞어 14개 Operation을 기록하는 Deploy.
     *
     * <p>대상 인벤토리: Host a~e, 그룹 web = {b, d}, db = {e}.</p>
     *
     * @return Deploy
     */
    public static Deploy fourteenSteps() {
        return ctx -> {
            ctx.op("Update apt", ShellOperation.of("apt-get update"));
            ctx.onHosts(List.of("web"), web -> {
                web.op("Install nginx", AptPackagesOperation.install("nginx"));
                web.op("Reload nginx", ShellOperation.of(WEB_RELOAD_COMMAND));
            });
            ctx.onHosts(List.of("db"), db -> db.op("Install postgres", ShellOperation.of("apt-get install -y postgresql")));
            ctx.include("tasks/users", users -> {
                users.op("Create deploy group", ShellOperation.of("groupadd -f deploy"));
                users.forEachHost((host, hostCtx) -> hostCtx.op("Create home",
                    ShellOperation.of("mkdir -p /srv/" + host.getName().getValue())));
            });
            ctx.forEachHost((host, hostCtx) -> {
                if (host.isInGroup("web")) {
                    hostCtx.op("Warm cache", ShellOperation.of("curl -s localhost"));
                }
            });
            ctx.onHost(ctx.inventory().get(HostName.of("c")),
                single -> single.op("Tune c", ShellOperation.of("sysctl -w vm.swappiness=10")));
            ctx.include("tasks/cleanup", cleanup -> cleanup.op("Clean tmp", ShellOperation.of("rm -rf /tmp/fleet")));
            ctx.op("Report", ShellOperation.of(REPORT_COMMAND));
        };
    }

    /**
     * 평가 중 같은 Host의 같은 Fact를 두 번 조회하고, 두 값이 같을 때만 Operation을 기록하는 Deploy.
     *
     * @return Deploy
     */
    public static Deploy factTwice() {
        return ctx -> ctx.forEachHost((host, hostCtx) -> {
            String first = hostCtx.fact(host, ServerFacts.OS);
            String second = hostCtx.fact(host, ServerFacts.OS);
            if (first != null && first.equals(second)) {
                hostCtx.op("Same os", ShellOperation.of("echo " + first));
            }
        });
    }
}
