package com.ryuqq.fleet.adapter.transport;

import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.spi.CommandResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 시스템 ssh 실행 파일로 원격 명령을 실행하는 Transport.
 *
 * <p><strong>Host 데이터:</strong></p>
 * <ul>
 *   <li>ssh_hostname: 접속 주소 (없으면 Host 이름)</li>
 *   <li>ssh_user: 접속 사용자</li>
 *   <li>ssh_port: 접속 포트</li>
 *   <li>ssh_key: 개인 키 파일 경로</li>
 * </ul>
 *
 * <p>ssh는 연결 실패 시 종료 코드 255를 반환하므로, 255는 명령 실패가 아니라
 * {@link TransportException}으로 처리합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class SshTransport extends ProcessTransport {

    static final int SSH_CONNECTION_ERROR = 255;

    public static final String DATA_HOSTNAME = "ssh_hostname";
    public static final String DATA_USER = "ssh_user";
    public static final String DATA_PORT = "ssh_port";
    public static final String DATA_KEY = "ssh_key";

    public SshTransport() {
        this(new TransportConfig());
    }

    public SshTransport(TransportConfig config) {
        super(config);
    }

    @Override
    protected List<String> buildCommandLine(Host host, String command) {
        List<String> args = new ArrayList<>();
        args.add(config().sshExecutable());
        args.addAll(config().sshOptions());

        String port = host.dataAsString(DATA_PORT, null);
        if (port != null) {
            args.add("-p");
            args.add(port);
        }
        String key = host.dataAsString(DATA_KEY, null);
        if (key != null) {
            args.add("-i");
            args.add(key);
        }

        String address = host.dataAsString(DATA_HOSTNAME, host.getName().getValue());
        String user = host.dataAsString(DATA_USER, null);
        args.add(user == null ? address : user + "@" + address);
        args.add(command);
        return args;
    }

    @Override
    protected CommandResult checkResult(Host host, CommandResult result) {
        if (result.exitCode() == SSH_CONNECTION_ERROR) {
            String detail = result.stderr().isEmpty() ? "no output" : String.join(" ", result.stderr());
            throw new TransportException(host.getName(), "SSH connection failed: " + detail);
        }
        return result;
    }
}
