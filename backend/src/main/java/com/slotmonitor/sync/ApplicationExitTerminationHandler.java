package com.slotmonitor.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Shuts the application down with exit code 1 so the process supervisor sees the failure. The engine is never
 * restarted in-process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApplicationExitTerminationHandler implements EngineTerminationHandler {

    static final int EXIT_CODE = 1;

    private final ApplicationContext applicationContext;

    @Override
    public void onUnexpectedTermination(String component, Throwable cause) {
        log.error("Exiting: {} terminated", component);
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                "engine-termination-exit");
        exit.setDaemon(false);
        exit.start();
    }
}
