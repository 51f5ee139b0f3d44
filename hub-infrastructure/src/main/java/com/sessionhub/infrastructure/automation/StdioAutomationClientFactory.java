package com.sessionhub.infrastructure.automation;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.sessionhub.domain.session.adapter.gateway.IAutomationClient;
import com.sessionhub.domain.session.adapter.gateway.IAutomationClientFactory;
import com.sessionhub.infrastructure.util.JsonCodec;
import com.sessionhub.types.common.Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;

/**
 * 根据 session-hub.automation.* 配置创建 stdio 自动化客户端。
 * 子进程参数末尾追加 {@code --session-id} 与 {@code --client-id}。
 */
@Component
public class StdioAutomationClientFactory implements IAutomationClientFactory {

    private final String command;
    private final List<String> args;
    private final File workingDirectory;
    private final long initTimeoutMs;
    private final SidecarEventParser parser;
    private final ThreadFactory threadFactory;

    public StdioAutomationClientFactory(JsonCodec jsonCodec,
                                        @Value("${session-hub.automation.command:node}") String command,
                                        @Value("${session-hub.automation.args:}") String args,
                                        @Value("${session-hub.automation.working-directory:}") String workingDirectory,
                                        @Value("${session-hub.automation.init-timeout-ms:60000}") long initTimeoutMs) {
        this.command = command;
        this.args = splitArgs(args);
        this.workingDirectory = StringUtils.isBlank(workingDirectory) ? null : new File(workingDirectory);
        this.initTimeoutMs = Math.max(initTimeoutMs, 1_000L);
        this.parser = new SidecarEventParser(jsonCodec);
        this.threadFactory = new ThreadFactoryBuilder()
                .setNameFormat("automation-io-%d")
                .setDaemon(true)
                .build();
    }

    @Override
    public IAutomationClient create(String sessionId, String clientId) {
        if (StringUtils.isBlank(command)) {
            throw new IllegalStateException("Automation command is empty");
        }
        List<String> fullCommand = new ArrayList<>();
        fullCommand.add(command);
        fullCommand.addAll(args);
        fullCommand.add("--session-id");
        fullCommand.add(sessionId);
        fullCommand.add("--client-id");
        fullCommand.add(clientId);
        return new StdioAutomationClient(sessionId, clientId, fullCommand, workingDirectory,
                initTimeoutMs, parser, threadFactory);
    }

    private List<String> splitArgs(String raw) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(raw)) {
            return result;
        }
        for (String part : raw.split(Constants.SPLIT)) {
            if (StringUtils.isNotBlank(part)) {
                result.add(part.trim());
            }
        }
        return result;
    }
}
