package com.labpulse.status;

import com.labpulse.model.CardStatusMapping;
import com.labpulse.model.ItemStatus;
import com.labpulse.model.MonitorState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class StatusDerivationTest {

    @Test
    @DisplayName("Monitor names are indexed case-insensitively")
    void testFromMonitors() {
        Map<String, Boolean> index = StatusDerivation.fromMonitors(List.of(
                MonitorState.up("Plex"), MonitorState.down("Home Assistant ")));

        assertThat(index).containsEntry("plex", true).containsEntry("home assistant", false);
    }

    @Test
    @DisplayName("Cards map to online, offline or warning")
    void testDeriveCardStatuses() {
        List<CardStatusMapping> cards = List.of(
                card(1, null, "plex"),
                card(2, null, "Sonarr"),
                card(3, null, "missing"),
                card(4, null, null),
                card(5, 20L, "nginx"),
                card(6, 30L, "anything"));
        Map<Long, Map<String, Boolean>> monitors = Map.of(
                10L, Map.of("plex", true, "sonarr", false),
                20L, Map.of("nginx", true));
        Map<Long, Boolean> reachable = Map.of(10L, true, 20L, true, 30L, false);

        Map<Long, ItemStatus> statuses = StatusDerivation.deriveCardStatuses(cards, 10L, monitors, reachable);

        assertThat(statuses).containsExactly(
                entry(1L, ItemStatus.ONLINE),
                entry(2L, ItemStatus.OFFLINE),
                entry(3L, ItemStatus.WARNING),
                entry(4L, ItemStatus.WARNING),
                entry(5L, ItemStatus.ONLINE),
                entry(6L, ItemStatus.WARNING));
    }

    @Test
    @DisplayName("A reachable source that was never listed yields warning")
    void testMissingListing() {
        Map<Long, ItemStatus> statuses = StatusDerivation.deriveCardStatuses(
                List.of(card(1, 99L, "plex")), null, Map.of(), Map.of());

        assertThat(statuses).containsExactly(entry(1L, ItemStatus.WARNING));
    }

    @Test
    @DisplayName("Diff reports only changed or new entries and never removals")
    void testDiff() {
        Map<Long, ItemStatus> previous = new LinkedHashMap<>();
        previous.put(1L, ItemStatus.ONLINE);
        previous.put(2L, ItemStatus.WARNING);
        previous.put(3L, ItemStatus.OFFLINE);
        Map<Long, ItemStatus> next = new LinkedHashMap<>();
        next.put(1L, ItemStatus.ONLINE);
        next.put(2L, ItemStatus.OFFLINE);
        next.put(4L, ItemStatus.WARNING);

        assertThat(StatusDerivation.diff(previous, next))
                .containsExactly(entry(2L, ItemStatus.OFFLINE), entry(4L, ItemStatus.WARNING));
        assertThat(StatusDerivation.diff(next, next)).isEmpty();
    }

    @Test
    @DisplayName("Source ids are distinct with the global source first")
    void testSourceIds() {
        List<CardStatusMapping> cards = List.of(card(1, 5L, "a"), card(2, null, "b"), card(3, 5L, "c"), card(4, 6L, null));

        assertThat(StatusDerivation.sourceIds(cards, 9L)).containsExactly(9L, 5L);
    }

    private static CardStatusMapping card(long id, Long source, String monitor) {
        return CardStatusMapping.builder().cardId(id).statusSourceId(source).monitorName(monitor).build();
    }
}
