package com.evfinder.infrastructure.config;

import com.evfinder.application.usecase.RefreshValueBetsUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Kicks off the first refresh once the application is up.
 */
@Component
@ConditionalOnProperty(name = "evfinder.detection.refresh-on-startup", havingValue = "true", matchIfMissing = true)
public class StartupRefresh {

    private static final Logger logger = LoggerFactory.getLogger(StartupRefresh.class);

    private final RefreshValueBetsUseCase refreshValueBets;

    public StartupRefresh(RefreshValueBetsUseCase refreshValueBets) {
        this.refreshValueBets = refreshValueBets;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        logger.info("Starting initial value-bet refresh");
        refreshValueBets.startAsync();
    }
}
