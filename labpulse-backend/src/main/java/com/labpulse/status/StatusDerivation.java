package com.labpulse.status;

import com.labpulse.model.CardStatusMapping;
import com.labpulse.model.ItemStatus;
import com.labpulse.model.MonitorState;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure functions turning monitor listings into per-card {@link ItemStatus} values.
 */
public final class StatusDerivation {

    private StatusDerivation() {
    }

    /**
     * Index a monitor listing by lower-cased name. A later duplicate wins.
     *
     * @param monitors monitors as reported by a driver
     * @return name to up flag
     */
    public static Map<String, Boolean> fromMonitors(Collection<MonitorState> monitors) {
        Map<String, Boolean> byName = new LinkedHashMap<>();
        if (monitors == null) {
            return byName;
        }
        for (MonitorState monitor : monitors) {
            if (monitor == null || monitor.getName() == null) {
                continue;
            }
            byName.put(normalize(monitor.getName()), monitor.isUp());
        }
        return byName;
    }

    /**
     * Integration a card reads its status from.
     *
     * @param card card
     * @param globalSourceId global status source, may be null
     * @return source id, or null when neither the card nor the global setting names one
     */
    public static Long sourceOf(CardStatusMapping card, Long globalSourceId) {
        return card.getStatusSourceId() != null ? card.getStatusSourceId() : globalSourceId;
    }

    /**
     * Distinct source integrations referenced by the given cards, global source first.
     *
     * @param cards status cards
     * @param globalSourceId global status source, may be null
     * @return source ids in first-seen order
     */
    public static Set<Long> sourceIds(List<CardStatusMapping> cards, Long globalSourceId) {
        Set<Long> ids = new LinkedHashSet<>();
        if (globalSourceId != null) {
            ids.add(globalSourceId);
        }
        for (CardStatusMapping card : cards) {
            Long source = sourceOf(card, globalSourceId);
            if (source != null && card.getMonitorName() != null && !card.getMonitorName().isBlank()) {
                ids.add(source);
            }
        }
        return ids;
    }

    /**
     * Derive the status of every card.
     *
     * <p>A card is {@code warning} when it has no monitor binding, when its source integration was
     * unreachable or never listed, or when the monitor is missing from the listing. Otherwise an up
     * monitor is {@code online} and a down monitor is {@code offline}.
     *
     * @param cards status cards
     * @param globalSourceId global status source, may be null
     * @param monitorsByIntegration listings indexed with {@link #fromMonitors(Collection)}
     * @param reachable whether each polled source answered
     * @return card id to status, in card order
     */
    public static Map<Long, ItemStatus> deriveCardStatuses(
            List<CardStatusMapping> cards,
            Long globalSourceId,
            Map<Long, Map<String, Boolean>> monitorsByIntegration,
            Map<Long, Boolean> reachable
    ) {
        Map<Long, ItemStatus> statuses = new LinkedHashMap<>();
        for (CardStatusMapping card : cards) {
            statuses.put(card.getCardId(), deriveOne(card, globalSourceId, monitorsByIntegration, reachable));
        }
        return statuses;
    }

    /**
     * Entries of {@code next} whose value differs from {@code previous}. Removed keys are not reported.
     *
     * @param previous previous map
     * @param next new map
     * @return changed entries, empty when nothing changed
     */
    public static Map<Long, ItemStatus> diff(Map<Long, ItemStatus> previous, Map<Long, ItemStatus> next) {
        Map<Long, ItemStatus> changed = new LinkedHashMap<>();
        for (Map.Entry<Long, ItemStatus> entry : next.entrySet()) {
            if (!Objects.equals(previous.get(entry.getKey()), entry.getValue())) {
                changed.put(entry.getKey(), entry.getValue());
            }
        }
        return changed;
    }

    private static ItemStatus deriveOne(
            CardStatusMapping card,
            Long globalSourceId,
            Map<Long, Map<String, Boolean>> monitorsByIntegration,
            Map<Long, Boolean> reachable
    ) {
        Long source = sourceOf(card, globalSourceId);
        String monitorName = card.getMonitorName();
        if (source == null || monitorName == null || monitorName.isBlank()) {
            return ItemStatus.WARNING;
        }
        if (Boolean.FALSE.equals(reachable.get(source))) {
            return ItemStatus.WARNING;
        }
        Map<String, Boolean> monitors = monitorsByIntegration.get(source);
        if (monitors == null) {
            return ItemStatus.WARNING;
        }
        Boolean up = monitors.get(normalize(monitorName));
        if (up == null) {
            return ItemStatus.WARNING;
        }
        return up ? ItemStatus.ONLINE : ItemStatus.OFFLINE;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
