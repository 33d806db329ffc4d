package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.repository.GameWeaponRepository;
import com.statsdb.statsdb_api.repository.WeaponScope;
import com.statsdb.statsdb_api.repository.WeaponTotals;
import com.statsdb.statsdb_api.view.WeaponSummary;
import com.statsdb.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WeaponServiceTest {

    @Mock private GameWeaponRepository weaponRepository;

    private WeaponService service;

    @BeforeEach
    void setUp() {
        service = new WeaponService(TestFixtures.catalog(), weaponRepository);
    }

    @Test
    @DisplayName("allFromPlayer_everyCatalogWeaponPresent_missingOnesZeroed")
    void allFromPlayer_everyCatalogWeaponPresent_missingOnesZeroed() {
        when(weaponRepository.sumByWeapon(any(WeaponScope.class)))
                .thenReturn(List.of(TestFixtures.weaponTotals("rifle", 90, 300, 400, 50)));

        List<WeaponSummary> weapons = service.allFromPlayer("Ace");

        assertEquals(13, weapons.size());
        assertEquals("claw", weapons.get(0).name());
        WeaponSummary rifle = weapons.stream().filter(w -> w.name().equals("rifle")).findFirst().orElseThrow();
        assertEquals(450, rifle.damage());
        assertEquals(90, rifle.time());
        WeaponSummary pistol = weapons.stream().filter(w -> w.name().equals("pistol")).findFirst().orElseThrow();
        assertEquals(0, pistol.damage());
        assertEquals(0, pistol.frags());
        assertEquals(0, pistol.toRecord().shots2());
    }

    @Test
    @DisplayName("passiveWeapon_timeIsLoadoutTime")
    void passiveWeapon_timeIsLoadoutTime() {
        when(weaponRepository.sumByWeapon(any(WeaponScope.class)))
                .thenReturn(List.of(TestFixtures.weaponTotals("melee", 5, 700, 20, 0)));

        WeaponSummary melee = service.fromPlayer("melee", "Ace");

        assertTrue(melee.passive());
        assertEquals(700, melee.time());
    }

    @Test
    @DisplayName("fromGamePlayer_scopesToGameAndHandle")
    void fromGamePlayer_scopesToGameAndHandle() {
        ArgumentCaptor<WeaponScope> scope = ArgumentCaptor.forClass(WeaponScope.class);
        when(weaponRepository.sumByWeapon(scope.capture())).thenReturn(List.of());

        WeaponSummary summary = service.fromGamePlayer("rocket", 12L, "Ace");

        assertEquals("rocket", scope.getValue().weapon());
        assertEquals("Ace", scope.getValue().handle());
        assertEquals(List.of(12L), List.copyOf(scope.getValue().gameIds()));
        assertEquals(0, summary.damage());
    }

    @Test
    @DisplayName("resolve_unknownWeapon_throwsNotFound")
    void resolve_unknownWeapon_throwsNotFound() {
        assertThrows(NotFoundException.class, () -> service.resolve("bfg"));
        verifyNoInteractions(weaponRepository);
    }

    @Test
    @DisplayName("count_matchesCatalog")
    void count_matchesCatalog() {
        assertEquals(13, service.count());
        assertEquals("melee", service.weaponList().get(12));
    }

    // =========================================================================
    // Scopes
    // =========================================================================

    @Nested
    @DisplayName("Scopes")
    class Scopes {

        private final GameFilter instagibOnly = new GameFilters(TestFixtures.catalog()).hasMutator("instagib");
        private final ArgumentCaptor<WeaponScope> scope = ArgumentCaptor.forClass(WeaponScope.class);

        @BeforeEach
        void captureScope() {
            lenient().when(weaponRepository.sumByWeapon(scope.capture())).thenReturn(List.of());
        }

        private void assertScope(String weapon, String handle, List<Long> gameIds, GameFilter filter) {
            WeaponScope captured = scope.getValue();
            assertEquals(weapon, captured.weapon());
            assertEquals(handle, captured.handle());
            assertEquals(gameIds, captured.gameIds() == null ? null : List.copyOf(captured.gameIds()));
            assertEquals(filter, captured.filter());
        }

        @Test
        @DisplayName("fromWeapon_everyGameEveryPlayer")
        void fromWeapon_everyGameEveryPlayer() {
            service.fromWeapon("rocket");
            assertScope("rocket", null, null, null);
        }

        @Test
        @DisplayName("fromPlayerGames_playerAndGames")
        void fromPlayerGames_playerAndGames() {
            WeaponSummary summary = service.fromPlayerGames("rifle", "Ace", List.of(4L, 9L));

            assertScope("rifle", "Ace", List.of(4L, 9L), null);
            assertEquals(0, summary.damage());
        }

        @Test
        @DisplayName("allFromPlayerGames_playerAndGames_everyWeapon")
        void allFromPlayerGames_playerAndGames_everyWeapon() {
            List<WeaponSummary> all = service.allFromPlayerGames("Ace", List.of(4L, 9L));

            assertScope(null, "Ace", List.of(4L, 9L), null);
            assertEquals(13, all.size());
        }

        @Test
        @DisplayName("fromGame_singleGame")
        void fromGame_singleGame() {
            service.fromGame("pistol", 5L);
            assertScope("pistol", null, List.of(5L), null);
        }

        @Test
        @DisplayName("allFromGame_singleGame_everyWeapon")
        void allFromGame_singleGame_everyWeapon() {
            assertEquals(13, service.allFromGame(5L).size());
            assertScope(null, null, List.of(5L), null);
        }

        @Test
        @DisplayName("fromGames_gameSet")
        void fromGames_gameSet() {
            service.fromGames("sword", List.of(1L, 2L, 3L));
            assertScope("sword", null, List.of(1L, 2L, 3L), null);
        }

        @Test
        @DisplayName("allFromGames_gameSet_everyWeapon")
        void allFromGames_gameSet_everyWeapon() {
            assertEquals(13, service.allFromGames(List.of(1L, 2L)).size());
            assertScope(null, null, List.of(1L, 2L), null);
        }

        @Test
        @DisplayName("fromFilter_rulesetFilterOnly")
        void fromFilter_rulesetFilterOnly() {
            service.fromFilter("rifle", instagibOnly);
            assertScope("rifle", null, null, instagibOnly);
        }

        @Test
        @DisplayName("allFromFilter_rulesetFilterOnly_everyWeapon")
        void allFromFilter_rulesetFilterOnly_everyWeapon() {
            assertEquals(13, service.allFromFilter(instagibOnly).size());
            assertScope(null, null, null, instagibOnly);
        }

        @Test
        @DisplayName("allFromGames_noGames_zeroedWithoutQuerying")
        void allFromGames_noGames_zeroedWithoutQuerying() {
            List<WeaponSummary> all = service.allFromGames(List.of());

            assertEquals(TestFixtures.catalog().weaponNames(), all.stream().map(WeaponSummary::name).toList());
            assertTrue(all.stream().allMatch(w -> w.totals().equals(WeaponTotals.zero(w.name()))));
            verifyNoInteractions(weaponRepository);
        }

        @Test
        @DisplayName("fromPlayerGames_noGames_zeroedWithoutQuerying")
        void fromPlayerGames_noGames_zeroedWithoutQuerying() {
            WeaponSummary rifle = service.fromPlayerGames("rifle", "Ace", List.of());

            assertEquals(WeaponTotals.zero("rifle"), rifle.totals());
            verifyNoInteractions(weaponRepository);
        }
    }
}
