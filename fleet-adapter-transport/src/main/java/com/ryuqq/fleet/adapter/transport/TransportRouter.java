package com.ryuqq.fleet.adapter.transport;

import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.Transport;

/**
 * Host별로 로컬 또는 원격 Transport를 선택합니다.
 *
 * <p>Host 이름이 {@value #LOCAL_HOST}이거나 Host 데이터 {@code transport}가
 * {@code local}이면 로컬 Transport를, 그 외에는 원격 Transport를 사용합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class TransportRouter implements Transport {

    public static final String LOCAL_HOST = "@local";
    public static final String DATA_TRANSPORT = "transport";

    private final Transport local;
    private final Transport remote;

    public TransportRouter(Transport local, Transport remote) {
        if (local == null) {
            throw new IllegalArgumentException("local cannot be null");
        }
        if (remote == null) {
            throw new IllegalArgumentException("remote cannot be null");
        }
        this.local = local;
        this.remote = remote;
    }

    /**
     * 기본 구성 (LocalTransport + SshTransport).
     *
     * @param config Transport 설정
     * @return TransportRouter
     */
    public static TransportRouter of(TransportConfig config) {
        return new TransportRouter(new LocalTransport(config), new SshTransport(config));
    }

    @Override
    public CommandResult execute(Host host, String command, CommandKind kind) {
        return isLocal(host) ? local.execute(host, command, kind) : remote.execute(host, command, kind);
    }

    static boolean isLocal(Host host) {
        return LOCAL_HOST.equals(host.getName().getValue())
            || "local".equals(host.dataAsString(DATA_TRANSPORT, null));
    }
}
