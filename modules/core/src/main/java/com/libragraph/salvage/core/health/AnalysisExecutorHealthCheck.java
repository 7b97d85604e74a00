package com.libragraph.salvage.core.health;

import com.libragraph.salvage.core.analysis.AnalysisSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.util.concurrent.ExecutorService;

@Readiness
@ApplicationScoped
public class AnalysisExecutorHealthCheck implements HealthCheck {

    @Inject
    @Named("analysisExecutor")
    ExecutorService executor;

    @Inject
    AnalysisSettings settings;

    @Override
    public HealthCheckResponse call() {
        if (executor.isShutdown()) {
            return HealthCheckResponse.named("analysis-executor")
                    .down()
                    .withData("error", "executor shut down")
                    .build();
        }
        return HealthCheckResponse.named("analysis-executor")
                .up()
                .withData("workers", settings.workerCount())
                .build();
    }
}
