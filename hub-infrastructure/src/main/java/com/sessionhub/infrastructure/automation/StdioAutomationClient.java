package com.sessionhub.infrastructure.automation;

import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.domain.session.adapter.gateway.IAutomationEventListener;
import com.sessionhub.domain.session.model.valobj.AutomationEvent;
import com.sessionhub.types.enums.AutomationEventTypeEnum;
import com.sessionhub.types.enums.ResponseCode;
import com.sessionhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于子进程 stdio 的自动化客户端。
 * <p>
 * 子进程在 stdout 逐行输出事件，stderr 作为日志转发；
 * 销毁时先写入 {@code {"command":"destroy"}} 请求优雅退出，超时后强制结束。
 * 子进程意外退出会被转换为一次 disconnected 事件。
 * </p>
 */
@Slf4j
public class StdioAutomationClient implements IAutomationClient {

    private static final String DESTROY_COMMAND = "{\"command\":\"destroy\"}\n";
    private static final long DESTROY_GRACE_MS = 3_000L;

    private final String sessionId;
    private final String clientId;
    private final List<String> command;
    private final File workingDirectory;
    private final long initTimeoutMs;
    private final SidecarEventParser parser;
    private final ThreadFactory threadFactory;

    private final CountDownLatch initializedLatch = new CountDownLatch(1);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean destroyed = new AtomicBoolean(false);
    private volatile Process process;
    private volatile IAutomationEventListener listener;

    public StdioAutomationClient(String sessionId,
                                 String clientId,
                                 List<String> command,
                                 File workingDirectory,
                                 long initTimeoutMs,
                                 SidecarEventParser parser,
                                 ThreadFactory threadFactory) {
        this.sessionId = sessionId;
        this.clientId = clientId;
        this.command = new ArrayList<>(command);
        this.workingDirectory = workingDirectory;
        this.initTimeoutMs = initTimeoutMs;
        this.parser = parser;
        this.threadFactory = threadFactory;
    }

    @Override
    public String getClientId() {
        return clientId;
    }

    @Override
    public void initialize(IAutomationEventListener listener) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Automation client already initialized: " + clientId);
        }
        this.listener = listener;
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Failed to start automation process: " + ex.getMessage(), ex);
        }
        threadFactory.newThread(this::pumpStdout).start();
        threadFactory.newThread(this::pumpStderr).start();
        log.info("Automation process started. sessionId={}, clientId={}, pid={}", sessionId, clientId, process.pid());

        boolean initialized;
        try {
            initialized = initializedLatch.await(initTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            destroy();
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Interrupted while initializing automation client", ex);
        }
        if (!initialized || !process.isAlive()) {
            destroy();
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Automation process did not initialize within " + initTimeoutMs + "ms");
        }
    }

    @Override
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        initializedLatch.countDown();
        Process current = process;
        if (current == null) {
            return;
        }
        try {
            OutputStream stdin = current.getOutputStream();
            stdin.write(DESTROY_COMMAND.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
            stdin.close();
        } catch (IOException ex) {
            log.debug("Failed to send destroy command. sessionId={}, error={}", sessionId, ex.getMessage());
        }
        current.destroy();
        current.onExit()
                .completeOnTimeout(current, DESTROY_GRACE_MS, TimeUnit.MILLISECONDS)
                .thenAccept(exited -> {
                    if (exited.isAlive()) {
                        log.warn("Automation process ignored destroy, killing. sessionId={}", sessionId);
                        exited.destroyForcibly();
                    }
                });
        log.info("Automation client destroyed. sessionId={}, clientId={}", sessionId, clientId);
    }

    private void pumpStdout() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException ex) {
            if (!destroyed.get()) {
                log.warn("Automation stdout closed unexpectedly. sessionId={}, error={}", sessionId, ex.getMessage());
            }
        }
        initializedLatch.countDown();
        if (!destroyed.get()) {
            log.warn("Automation process exited. sessionId={}, clientId={}", sessionId, clientId);
            dispatch(AutomationEvent.builder()
                    .type(AutomationEventTypeEnum.DISCONNECTED)
                    .reason("automation process exited")
                    .build());
        }
    }

    private void pumpStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (StringUtils.isNotBlank(line)) {
                    log.warn("Automation stderr. sessionId={}: {}", sessionId, line);
                }
            }
        } catch (IOException ex) {
            log.debug("Automation stderr closed. sessionId={}", sessionId);
        }
    }

    private void handleLine(String line) {
        Map<String, Object> payload = parser.readLine(line);
        if (payload == null) {
            if (StringUtils.isNotBlank(line)) {
                log.debug("Automation stdout. sessionId={}: {}", sessionId, line);
            }
            return;
        }
        if (parser.isInitialized(payload)) {
            initializedLatch.countDown();
            return;
        }
        AutomationEvent event = parser.toEvent(payload);
        if (event == null) {
            log.debug("Ignore unknown automation event. sessionId={}, payload={}", sessionId, payload);
            return;
        }
        dispatch(event);
    }

    private void dispatch(AutomationEvent event) {
        IAutomationEventListener current = listener;
        if (current == null || destroyed.get()) {
            return;
        }
        try {
            current.onEvent(event);
        } catch (Exception ex) {
            log.warn("Automation event handling failed. sessionId={}, type={}, error={}",
                    sessionId, event.getType(), ex.getMessage(), ex);
        }
    }
}
