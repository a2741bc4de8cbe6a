package com.secondhand.core;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.secondhand.acquisition.AcquisitionQueue;
import com.secondhand.authority.StateBroadcaster;
import com.secondhand.config.MarketConfig;
import com.secondhand.host.CreditScoreProvider;
import com.secondhand.host.HostServices;
import com.secondhand.host.ItemCustody;
import com.secondhand.host.MoneyLedger;
import com.secondhand.host.NotificationSink;
import com.secondhand.host.WeatherService;
import com.secondhand.inspection.InspectableListings;
import com.secondhand.util.Randomization;
import lombok.extern.slf4j.Slf4j;

/**
 * Guice module for one market session.
 *
 * <p>Services carry {@code @Singleton} themselves, so each injector built from this module
 * holds exactly one session's worth of state. The host collaborators and the config come in
 * through the constructor.
 */
@Slf4j
public class MarketModule extends AbstractModule {

    private final HostServices host;
    private final MarketConfig config;
    private final Randomization randomization;

    public MarketModule(HostServices host, MarketConfig config) {
        this(host, config, new Randomization());
    }

    /**
     * Constructor for testing with a seeded or mocked {@link Randomization}.
     */
    public MarketModule(HostServices host, MarketConfig config, Randomization randomization) {
        this.host = host;
        this.config = config;
        this.randomization = randomization;
    }

    @Override
    protected void configure() {
        bind(MarketConfig.class).toInstance(config);
        bind(Randomization.class).toInstance(randomization);
        bind(InspectableListings.class).to(AcquisitionQueue.class);
        log.debug("Market module configured with {}", config.getClass().getSimpleName());
    }

    @Provides
    @Singleton
    public MoneyLedger provideLedger() {
        return host.getLedger();
    }

    @Provides
    @Singleton
    public WeatherService provideWeather() {
        return host.getWeather();
    }

    @Provides
    @Singleton
    public NotificationSink provideNotifications() {
        return host.getNotifications();
    }

    @Provides
    @Singleton
    public ItemCustody provideCustody() {
        return host.getCustody();
    }

    @Provides
    @Singleton
    public CreditScoreProvider provideCreditScores() {
        return host.getCreditScores();
    }

    @Provides
    @Singleton
    public StateBroadcaster provideBroadcaster() {
        return host.getBroadcaster();
    }
}
