package com.gitagent.server.config;

import com.gitagent.server.watch.WatchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds the {@code gitagent.*} properties into one {@link WatcherSettings} bean.
 */
@Configuration
public class WatcherConfig {

    private static final Logger log = LoggerFactory.getLogger(WatcherConfig.class);

    @Bean
    public WatcherSettings watcherSettings(
            @Value("${gitagent.watcher.mode:auto}") String mode,
            @Value("${gitagent.watcher.debounce:200ms}") Duration debounce,
            @Value("${gitagent.watcher.stop-timeout:2s}") Duration stopTimeout,
            @Value("${gitagent.watcher.poll-interval:1s}") Duration pollInterval,
            @Value("${gitagent.watcher.ignored-dirs:.git,__pycache__,node_modules,venv,.idea,.vscode}") String ignoredDirs,
            @Value("${gitagent.git.command-timeout:30s}") Duration gitCommandTimeout) {

        Set<String> ignored = Arrays.stream(ignoredDirs.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());

        WatcherSettings settings = new WatcherSettings(
                WatchMode.parse(mode), debounce, stopTimeout, pollInterval, ignored, gitCommandTimeout);
        log.info("Watcher settings: mode={} debounce={} pollInterval={} ignored={}",
                settings.mode(), settings.debounce(), settings.pollInterval(), settings.ignoredDirs());
        return settings;
    }
}
