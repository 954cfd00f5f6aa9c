package io.github.drompincen.promptgate.runtime.signal;

import io.github.drompincen.promptgate.protocol.signal.FileSentinelSignalChannel;
import io.github.drompincen.promptgate.protocol.signal.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class SignalChannelConfig {

    private static final Logger log = LoggerFactory.getLogger(SignalChannelConfig.class);

    @Bean
    @ConditionalOnProperty(name = "promptgate.signal.backend", havingValue = "file", matchIfMissing = true)
    SignalChannel fileSentinelSignalChannel(
            @Value("${promptgate.signal.dir:${java.io.tmpdir}/promptgate-signals}") Path directory) {
        log.info("Plan approval sentinels in {}", directory);
        return new FileSentinelSignalChannel(directory);
    }
}
