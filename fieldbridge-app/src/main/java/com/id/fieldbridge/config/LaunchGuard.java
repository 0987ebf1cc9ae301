package com.id.fieldbridge.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Refuses to run the bridge unless the orchestrating startup sequence marked the launch as sanctioned.
 * A direct launch fails while the context is starting, before any transport connection is opened.
 */
@Component
@Slf4j
public class LaunchGuard {

    static final String DIAGNOSTIC = """
            PROTECTED EXECUTION: fieldbridge must be started through the sanctioned startup sequence, \
            which passes fieldbridge.launch.sanctioned=true (or FIELDBRIDGE_LAUNCH_SANCTIONED=true). \
            Direct execution is disabled to avoid data loss.""";

    private final AppConfig appConfig;

    public LaunchGuard(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    public void verify() {
        if (!appConfig.isLaunchSanctioned()) {
            log.error(DIAGNOSTIC);
            throw new IllegalStateException(DIAGNOSTIC);
        }
        log.debug("Launch sanctioned by startup sequence");
    }
}
