package com.labpulse.status;

import com.labpulse.crypto.CredentialCodec;
import com.labpulse.driver.Driver;
import com.labpulse.driver.DriverFactory;
import com.labpulse.driver.MonitorListing;
import com.labpulse.model.CardStatusMapping;
import com.labpulse.model.CycleSummary;
import com.labpulse.model.Integration;
import com.labpulse.model.ItemStatus;
import com.labpulse.persistence.CardStatusMappingRepository;
import com.labpulse.persistence.IntegrationRepository;
import com.labpulse.persistence.SettingsRepository;
import com.labpulse.poller.PollCycleListener;
import com.labpulse.stream.BroadcastRegistries;
import com.labpulse.stream.StreamBroadcastRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the card status map current and pushes changes on the {@code status} topic.
 *
 * <p>Runs after every poll cycle. Each distinct source integration is asked for its monitor listing once,
 * statuses are derived for every status card, and only cards whose status changed are broadcast. New
 * clients receive the whole map on connect. Cards are never removed from the map.
 */
@Component
public class StatusTracker implements PollCycleListener {
    private static final Logger log = LoggerFactory.getLogger(StatusTracker.class);

    public static final String STATUS_EVENT = "status";

    private final CardStatusMappingRepository cardRepository;
    private final SettingsRepository settingsRepository;
    private final IntegrationRepository integrationRepository;
    private final CredentialCodec credentialCodec;
    private final DriverFactory driverFactory;
    private final StreamBroadcastRegistry statusRegistry;

    private final Map<Long, ItemStatus> cardStatuses = new LinkedHashMap<>();

    public StatusTracker(
            CardStatusMappingRepository cardRepository,
            SettingsRepository settingsRepository,
            IntegrationRepository integrationRepository,
            CredentialCodec credentialCodec,
            DriverFactory driverFactory,
            BroadcastRegistries registries
    ) {
        this.cardRepository = cardRepository;
        this.settingsRepository = settingsRepository;
        this.integrationRepository = integrationRepository;
        this.credentialCodec = credentialCodec;
        this.driverFactory = driverFactory;
        this.statusRegistry = registries.status();
        this.statusRegistry.setInitialState(() -> statusRegistry.event(STATUS_EVENT, currentStatuses()));
    }

    @Override
    public void onCycleComplete(CycleSummary summary) {
        refresh();
    }

    /**
     * Re-derive every card's status and broadcast the changes.
     *
     * @return changed entries
     */
    public Map<Long, ItemStatus> refresh() {
        List<CardStatusMapping> cards = cardRepository.listStatusCards();
        Long globalSourceId = globalSourceId();

        Map<Long, Map<String, Boolean>> monitorsByIntegration = new LinkedHashMap<>();
        Map<Long, Boolean> reachable = new LinkedHashMap<>();
        Map<Long, ItemStatus> next;
        if (globalSourceId == null) {
            log.debug("No status source configured, all status cards are warning");
            next = new LinkedHashMap<>();
            for (CardStatusMapping card : cards) {
                next.put(card.getCardId(), ItemStatus.WARNING);
            }
        } else {
            for (Long sourceId : StatusDerivation.sourceIds(cards, globalSourceId)) {
                Optional<Map<String, Boolean>> monitors = listMonitors(sourceId);
                reachable.put(sourceId, monitors.isPresent());
                monitors.ifPresent(m -> monitorsByIntegration.put(sourceId, m));
            }
            next = StatusDerivation.deriveCardStatuses(cards, globalSourceId, monitorsByIntegration, reachable);
        }

        Map<Long, ItemStatus> changed;
        synchronized (cardStatuses) {
            changed = StatusDerivation.diff(cardStatuses, next);
            cardStatuses.putAll(next);
        }

        if (!changed.isEmpty()) {
            int delivered = statusRegistry.broadcast(STATUS_EVENT, changed);
            log.info("Card status changed: cards={}, clients={}", changed.size(), delivered);
        }
        return changed;
    }

    /**
     * @return copy of the current card status map
     */
    public Map<Long, ItemStatus> currentStatuses() {
        synchronized (cardStatuses) {
            return new LinkedHashMap<>(cardStatuses);
        }
    }

    private Long globalSourceId() {
        Optional<String> value = settingsRepository.get(SettingsRepository.STATUS_SOURCE_ID);
        if (value.isEmpty() || value.get().isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.get().trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid status source setting: value={}", value.get());
            return null;
        }
    }

    private Optional<Map<String, Boolean>> listMonitors(long integrationId) {
        Optional<Integration> integration = integrationRepository.findById(integrationId);
        if (integration.isEmpty()) {
            log.warn("Status source not found: integration_id={}", integrationId);
            return Optional.empty();
        }

        Integration source = integration.get();
        try {
            if (!source.hasCredentials()) {
                log.warn("Status source has no credentials: integration_id={}", integrationId);
                return Optional.empty();
            }
            Driver driver = driverFactory.create(source.getId(), source.getServiceType(),
                    credentialCodec.decrypt(source.getCredentials()));
            if (!(driver instanceof MonitorListing listing)) {
                log.warn("Status source cannot list monitors: integration_id={}, service_type={}",
                        integrationId, source.getServiceType());
                return Optional.empty();
            }
            Map<String, Boolean> monitors = StatusDerivation.fromMonitors(listing.fetchMonitorList());
            log.debug("Listed monitors: integration_id={}, name={}, monitors={}",
                    integrationId, source.getServiceName(), monitors.size());
            return Optional.of(monitors);
        } catch (RuntimeException e) {
            log.warn("Failed to list monitors: integration_id={}, reason={}", integrationId, e.getMessage());
            return Optional.empty();
        }
    }
}
