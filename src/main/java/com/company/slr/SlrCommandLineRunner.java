package com.company.slr;

import com.company.slr.service.IndicatorUpdater;
import com.company.slr.service.RetentionService;
import com.company.slr.service.UpdateCycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Executes the one-shot run modes and closes the context afterwards.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SlrCommandLineRunner implements ApplicationRunner {

    private final IndicatorUpdater indicatorUpdater;
    private final RetentionService retentionService;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(ApplicationArguments args) {
        RunMode mode = RunMode.fromArgs(args.getSourceArgs());
        if (!mode.isOneShot()) {
            return;
        }

        int exitCode = execute(mode);
        log.info("{} finished with exit code {}", mode.getFlag(), exitCode);

        ExitCodeGenerator generator = () -> exitCode;
        System.exit(SpringApplication.exit(context, generator));
    }

    int execute(RunMode mode) {
        switch (mode) {
            case UPDATER_ONCE: {
                UpdateCycleResult result = indicatorUpdater.runCycle();
                return result.isSkipped() || result.getFailed() > 0 ? 1 : 0;
            }
            case CLEANUP_ONLY: {
                retentionService.cleanupDeletedIndicators();
                retentionService.applyRetention();
                return 0;
            }
            default:
                return 0;
        }
    }
}
