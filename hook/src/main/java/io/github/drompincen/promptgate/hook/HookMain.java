package io.github.drompincen.promptgate.hook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.promptgate.hook.client.HttpGatewayClient;
import io.github.drompincen.promptgate.hook.client.HttpSignalChannel;
import io.github.drompincen.promptgate.hook.policy.ClaudeSettingsLoader;
import io.github.drompincen.promptgate.hook.policy.ClaudeSettingsWriter;
import io.github.drompincen.promptgate.hook.policy.GatePolicy;
import io.github.drompincen.promptgate.hook.strategy.InterceptionStrategy;
import io.github.drompincen.promptgate.hook.strategy.LongPollInterceptionStrategy;
import io.github.drompincen.promptgate.hook.strategy.RedirectInterceptionStrategy;
import io.github.drompincen.promptgate.protocol.hook.HookOutput;
import io.github.drompincen.promptgate.protocol.json.ProtocolJson;
import io.github.drompincen.promptgate.protocol.signal.FileSentinelSignalChannel;
import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Entry point the agent runs for each hook event.
 * <pre>
 *   java -jar promptgate-hook.jar [pre-tool-use | confirm-plan] &lt; input.json
 * </pre>
 * Always exits 0; the decision is carried by stdout.
 */
public final class HookMain {

    private static final Logger log = LoggerFactory.getLogger(HookMain.class);

    // stands in for the session id when the environment could not be read
    private static final String UNCONFIGURED_SESSION = "unconfigured";

    private HookMain() {}

    public static void main(String[] args) {
        String command = args.length > 0 ? args[0] : "pre-tool-use";
        PrintStream out = System.out;
        try {
            out.println(run(command, readAll(System.in), System.getenv()));
        } catch (IOException e) {
            log.error("Cannot read hook input for {}", command, e);
            out.println("{}");
        }
        out.flush();
        System.exit(0);
    }

    /**
     * Runs one command. A failure while reading the environment or wiring the hook still has to deny
     * gated tools, so the input is then classified against the default policy alone.
     */
    static String run(String command, String stdin, Map<String, String> env) {
        try {
            return execute(command, stdin, HookSettings.fromEnvironment(env));
        } catch (RuntimeException e) {
            log.error("Hook {} failed during setup", command, e);
            return failClosed(command, stdin);
        }
    }

    static String failClosed(String command, String stdin) {
        ObjectMapper objectMapper = ProtocolJson.newObjectMapper();
        if ("confirm-plan".equals(command)) {
            try {
                return objectMapper.writeValueAsString(
                        new ConfirmPlanCommand.Result(false, HookRunner.INTERNAL_ERROR_REASON));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot encode confirm-plan result", e);
            }
        }
        InterceptionStrategy refuse = (sessionId, input, gate) -> HookOutput.deny(HookRunner.INTERNAL_ERROR_REASON);
        return new HookRunner(objectMapper, GatePolicy.defaults(), refuse, UNCONFIGURED_SESSION).run(stdin);
    }

    static String execute(String command, String stdin, HookSettings settings) {
        ObjectMapper objectMapper = ProtocolJson.newObjectMapper();
        HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        Path userHome = Path.of(System.getProperty("user.home"));
        LongPollInterceptionStrategy longPoll = new LongPollInterceptionStrategy(
                new HttpGatewayClient(httpClient, objectMapper, settings.backendUrl()), objectMapper,
                new ClaudeSettingsWriter(objectMapper, userHome, settings.projectPath()));

        switch (command) {
            case "confirm-plan":
                return new ConfirmPlanCommand(objectMapper, longPoll, settings.sessionId()).run(stdin);
            case "pre-tool-use":
                break;
            default:
                log.warn("Unknown command {}, treating as pre-tool-use", command);
        }

        InterceptionStrategy strategy = longPoll;
        if (settings.strategy() == HookSettings.Strategy.REDIRECT) {
            SignalChannel signals = settings.signalBackend() == HookSettings.SignalBackend.HTTP
                    ? new HttpSignalChannel(httpClient, objectMapper, settings.backendUrl())
                    : new FileSentinelSignalChannel(settings.signalDir());
            strategy = new RedirectInterceptionStrategy(signals, longPoll);
        }
        GatePolicy policy = settings.policy().withAllowPatterns(new ClaudeSettingsLoader(objectMapper)
                .loadAllowPatterns(userHome, settings.projectPath()));
        log.debug("Running pre-tool-use with {} strategy", settings.strategyName());
        return new HookRunner(objectMapper, policy, strategy, settings.sessionId()).run(stdin);
    }

    private static String readAll(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
