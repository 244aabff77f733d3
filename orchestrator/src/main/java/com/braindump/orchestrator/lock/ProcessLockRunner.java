package com.braindump.orchestrator.lock;

import jakarta.annotation.PreDestroy;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Takes the process lock once the application is up and gives it back on shutdown. */
@Component
public class ProcessLockRunner implements ApplicationRunner {

    private final ProcessLock lock;

    public ProcessLockRunner(ProcessLock lock) {
        this.lock = lock;
    }

    @Override
    public void run(ApplicationArguments args) {
        lock.acquire();
    }

    @PreDestroy
    public void release() {
        lock.release();
    }
}
