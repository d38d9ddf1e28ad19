package com.ryuqq.fleet.adapter.transport;

import com.ryuqq.fleet.core.exception.CommandTimeoutException;
import com.ryuqq.fleet.core.exception.TransportException;
import com.ryuqq.fleet.core.inventory.Host;
import com.ryuqq.fleet.core.spi.CommandKind;
import com.ryuqq.fleet.core.spi.CommandResult;
import com.ryuqq.fleet.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 외부 프로세스로 명령을 실행하는 Transport의 기반 클래스.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * buildCommandLine(host, command) → ProcessBuilder.start()
 *   ↓
 * stdout/stderr 비동기 수집 (파이프 버퍼 교착 방지)
 *   ↓
 * waitFor(timeoutMs)
 *   ├─ 시간 초과 → destroyForcibly + CommandTimeoutException
 *   └─ 종료 → CommandResult(exitCode, stdout, stderr) → checkResult()
 * </pre>
 *
 * <p>서로 다른 Host에 대한 동시 호출에 안전합니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public abstract class ProcessTransport implements Transport {

    private static final Logger log = LoggerFactory.getLogger(ProcessTransport.class);

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "fleet-stream-reader");
        thread.setDaemon(true);
        return thread;
    });

    private final TransportConfig config;

    protected ProcessTransport(TransportConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    protected TransportConfig config() {
        return config;
    }

    /**
     * 실행할 프로세스 인자 생성.
     *
     * @param host 대상 Host
     * @param command 셸 명령
     * @return 프로세스 인자 목록
     */
    protected abstract List<String> buildCommandLine(Host host, String command);

    /**
     * 프로세스 종료 결과 검사.
     *
     * <p>기본 구현은 결과를 그대로 반환합니다. 연결 실패를 종료 코드로 알리는
     * Transport는 이 메서드에서 {@link TransportException}을 던집니다.</p>
     *
     * @param host 대상 Host
     * @param result 프로세스 결과
     * @return 명령 결과
     */
    protected CommandResult checkResult(Host host, CommandResult result) {
        return result;
    }

    @Override
    public CommandResult execute(Host host, String command, CommandKind kind) {
        if (host == null) {
            throw new IllegalArgumentException("host cannot be null");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command cannot be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }

        List<String> commandLine = buildCommandLine(host, command);
        log.debug("[{}] {} {}", host.getName(), kind, command);

        Process process;
        try {
            process = new ProcessBuilder(commandLine).start();
        } catch (IOException e) {
            throw new TransportException(host.getName(), "Failed to start " + commandLine.get(0), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TransportException(host.getName(), "Failed to close command input", e);
        }

        CompletableFuture<List<String>> stdout = readAsync(process.getInputStream());
        CompletableFuture<List<String>> stderr = readAsync(process.getErrorStream());

        try {
            if (!process.waitFor(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CommandTimeoutException(host.getName(), command, config.timeoutMs());
            }
            CommandResult result = new CommandResult(process.exitValue(), stdout.join(), stderr.join());
            log.debug("[{}] exit {}", host.getName(), result.exitCode());
            return checkResult(host, result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new TransportException(host.getName(), "Interrupted while running command", e);
        } catch (CompletionException e) {
            throw new TransportException(host.getName(), "Failed to read command output", e.getCause());
        }
    }

    private static CompletableFuture<List<String>> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> readLines(stream), STREAM_READERS);
    }

    private static List<String> readLines(InputStream stream) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return lines;
    }
}
