package com.ryuqq.fleet.adapter.transport;

import com.ryuqq.fleet.core.inventory.Host;

import java.util.List;

/**
 * 로컬 셸로 명령을 실행하는 Transport.
 *
 * <p>명령은 {@code <shell> -c <command>} 형태로 실행되며, Host 이름은 로그에만 사용됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class LocalTransport extends ProcessTransport {

    public LocalTransport() {
        this(new TransportConfig());
    }

    public LocalTransport(TransportConfig config) {
        super(config);
    }

    @Override
    protected List<String> buildCommandLine(Host host, String command) {
        return List.of(config().shell(), "-c", command);
    }
}
