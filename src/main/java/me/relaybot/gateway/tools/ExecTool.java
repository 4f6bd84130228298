package me.relaybot.gateway.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.component.ToolComponent;
import me.relaybot.gateway.domain.model.ToolDefinition;
import me.relaybot.gateway.domain.model.ToolResult;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Runs a shell command inside the tool workspace with a timeout, a blocklist
 * of destructive commands and a cap on captured output.
 */
@Component
@Slf4j
public class ExecTool implements ToolComponent {

    static final String TOOL_NAME = "exec";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final String PARAM_WORKDIR = "workdir";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";

    private static final int MAX_OUTPUT_LENGTH = 10_000;

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*",
            "mkfs", "dd if=/dev",
            ":(){ :|:& };:",
            "shutdown", "reboot", "halt", "poweroff",
            "passwd", "useradd", "userdel",
            "sudo su", "su -");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("rm\\s+(-[rf]+\\s+)?/(?!tmp)"),
            Pattern.compile(">(\\s*)/dev/sd"),
            Pattern.compile("curl.*\\|.*sh"),
            Pattern.compile("wget.*\\|.*sh"),
            Pattern.compile("/etc/shadow"));

    private final Path workspaceRoot;
    private final GatewayProperties.ExecToolProperties config;
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public ExecTool(GatewayProperties properties) {
        this.config = properties.getTools().getExec();
        this.workspaceRoot = Paths.get(config.getWorkspace().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(workspaceRoot);
            log.info("[Exec] Workspace: {}", workspaceRoot);
        } catch (IOException e) {
            log.error("[Exec] Failed to create workspace directory: {}", workspaceRoot, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Execute a shell command in the workspace directory and return its output.
                        Use it to run scripts, inspect files or install and configure software.
                        Commands time out after 30 seconds unless a timeout is given (max 300).""")
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Shell command to execute"),
                                PARAM_TIMEOUT, Map.of(
                                        PARAM_TYPE, "integer",
                                        PARAM_DESCRIPTION, "Timeout in seconds"),
                                PARAM_WORKDIR, Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Working directory relative to the workspace")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object rawCommand = parameters.get(PARAM_COMMAND);
            if (!(rawCommand instanceof String command) || command.isBlank()) {
                return ToolResult.failure("Missing required parameter: command");
            }
            log.info("[Exec] Command: '{}'", command.length() > 200 ? command.substring(0, 200) + "..." : command);

            String blocked = blockReason(command);
            if (blocked != null) {
                log.warn("[Exec] Blocked command: {}", command);
                return ToolResult.failure(blocked);
            }

            int timeout = config.getDefaultTimeout();
            if (parameters.get(PARAM_TIMEOUT) instanceof Number number) {
                timeout = Math.max(1, Math.min(number.intValue(), config.getMaxTimeout()));
            }

            Path workDir = workspaceRoot;
            if (parameters.get(PARAM_WORKDIR) instanceof String workdir && !workdir.isBlank()) {
                workDir = workspaceRoot.resolve(workdir).normalize();
                if (!workDir.startsWith(workspaceRoot)) {
                    return ToolResult.failure("Working directory must be within workspace");
                }
                if (!Files.isDirectory(workDir)) {
                    return ToolResult.failure("Working directory does not exist: " + workdir);
                }
            }

            return run(command, workDir, timeout);
        }, executor);
    }

    static String blockReason(String command) {
        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                return "Command blocked for security reasons";
            }
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return "Command blocked for security reasons";
            }
        }
        return null;
    }

    private ToolResult run(String command, Path workDir, int timeoutSeconds) {
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);

        try {
            Process process = pb.start();
            Future<String> outputFuture = executor.submit(() -> readOutput(process));

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return ToolResult.failure("Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                output = "[Output read timeout]";
            }
            if (output.length() > MAX_OUTPUT_LENGTH) {
                output = output.substring(0, MAX_OUTPUT_LENGTH) + "\n... (truncated, "
                        + (output.length() - MAX_OUTPUT_LENGTH) + " more chars)";
            }

            int exitCode = process.exitValue();
            Map<String, Object> data = Map.of("exitCode", exitCode, PARAM_WORKDIR, workDir.toString());
            if (exitCode == 0) {
                return ToolResult.success(output.isEmpty() ? "(no output)" : output, data);
            }
            return ToolResult.builder()
                    .success(false)
                    .output(output)
                    .data(data)
                    .error("Exit code: " + exitCode)
                    .build();
        } catch (IOException e) {
            return ToolResult.failure("Failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Command execution interrupted");
        } catch (ExecutionException e) {
            return ToolResult.failure("Error reading output: " + e.getMessage());
        }
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() <= MAX_OUTPUT_LENGTH) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    Path getWorkspaceRoot() {
        return workspaceRoot;
    }
}
