package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;
import com.statsdb.statsdb_api.model.Game;
import com.statsdb.statsdb_api.model.GamePlayer;
import com.statsdb.statsdb_api.model.GameServer;
import com.statsdb.statsdb_api.repository.GamePlayerRepository;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.repository.GameServerRepository;
import com.statsdb.statsdb_api.view.MapView;
import com.statsdb.statsdb_api.view.ModeView;
import com.statsdb.statsdb_api.view.MutatorView;
import com.statsdb.statsdb_api.view.PlayerView;
import com.statsdb.statsdb_api.view.ServerView;
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
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Resolution, listing and pagination for every entity kind, with the
 * repositories mocked out.
 */
@ExtendWith(MockitoExtension.class)
class EntityServicesTest {

    @Mock private GameRepository gameRepository;
    @Mock private GamePlayerRepository playerRepository;
    @Mock private GameServerRepository serverRepository;

    private RulesetCatalog catalog;
    private GameFilters filters;

    @BeforeEach
    void setUp() {
        catalog = TestFixtures.catalog();
        filters = new GameFilters(catalog);
    }

    // =========================================================================
    // Players
    // =========================================================================

    @Nested
    @DisplayName("Players")
    class Players {

        private PlayerService service;

        @BeforeEach
        void setUp() {
            service = new PlayerService(playerRepository);
        }

        @Test
        @DisplayName("resolve_knownHandle_buildsFirstAndLatest")
        void resolve_knownHandle_buildsFirstAndLatest() {
            GamePlayer first = TestFixtures.buildGamePlayer(1L, "Ace");
            GamePlayer latest = TestFixtures.buildGamePlayer(3L, "Ace");
            when(playerRepository.findHandles()).thenReturn(List.of("Bolt", "Ace"));
            when(playerRepository.findGameIdsByHandle("Ace")).thenReturn(List.of(1L, 2L, 3L));
            when(playerRepository.findFirstByGameIdAndHandle(1L, "Ace")).thenReturn(Optional.of(first));
            when(playerRepository.findFirstByGameIdAndHandle(3L, "Ace")).thenReturn(Optional.of(latest));

            PlayerView view = service.resolve("Ace");

            assertEquals("Ace", view.handle());
            assertEquals(List.of(1L, 2L, 3L), view.gameIds());
            assertSame(first, view.first());
            assertSame(latest, view.latest());
        }

        @Test
        @DisplayName("resolve_unknownHandle_throwsNotFound")
        void resolve_unknownHandle_throwsNotFound() {
            when(playerRepository.findHandles()).thenReturn(List.of("Ace"));

            NotFoundException e = assertThrows(NotFoundException.class, () -> service.resolve("Nobody"));
            assertEquals("player", e.getKind());
            assertEquals("Nobody", e.getName());
            assertTrue(e.getMessage().contains("Nobody"));
            verify(playerRepository, never()).findGameIdsByHandle(anyString());
        }

        @Test
        @DisplayName("resolve_everyGameDeleted_hasNoFirstOrLatest")
        void resolve_everyGameDeleted_hasNoFirstOrLatest() {
            when(playerRepository.findHandles()).thenReturn(List.of("Ace"));
            when(playerRepository.findGameIdsByHandle("Ace")).thenReturn(List.of());

            PlayerView view = service.resolve("Ace");

            assertTrue(view.gameIds().isEmpty());
            assertNull(view.first());
            assertNull(view.latest());
        }

        @Test
        @DisplayName("count_usesDistinctHandleCount")
        void count_usesDistinctHandleCount() {
            when(playerRepository.countHandles()).thenReturn(42L);

            assertEquals(42, service.count());
            verify(playerRepository, never()).findHandles();
        }

        @Test
        @DisplayName("paginate_loadsOnlyRequestedPage")
        void paginate_loadsOnlyRequestedPage() {
            when(playerRepository.findHandles()).thenReturn(List.of("a", "b", "c", "d", "e"));
            when(playerRepository.countHandles()).thenReturn(5L);
            when(playerRepository.findGameIdsByHandle(anyString())).thenReturn(List.of());

            Pagination<PlayerView> page = service.paginate(1, 2);

            assertEquals(List.of("c", "d"), page.items().stream().map(PlayerView::handle).toList());
            assertEquals(5, page.total());
            verify(playerRepository, times(2)).findGameIdsByHandle(anyString());
        }

        @Test
        @DisplayName("gamePlayer_looksUpRowInGame")
        void gamePlayer_looksUpRowInGame() {
            GamePlayer row = TestFixtures.buildGamePlayer(7L, "Ace", 12);
            when(playerRepository.findFirstByGameIdAndHandle(7L, "Ace")).thenReturn(Optional.of(row));

            PlayerView ace = new PlayerView("Ace", List.of(7L), null, null);

            assertEquals(Optional.of(row), service.gamePlayer(ace, 7L));
        }
    }

    // =========================================================================
    // Servers
    // =========================================================================

    @Nested
    @DisplayName("Servers")
    class Servers {

        private ServerService service;

        @BeforeEach
        void setUp() {
            service = new ServerService(serverRepository);
        }

        @Test
        @DisplayName("resolve_firstAndLatestBelongToThisServer")
        void resolve_firstAndLatestBelongToThisServer() {
            GameServer first = TestFixtures.buildGameServer(4L, "alpha");
            GameServer latest = TestFixtures.buildGameServer(9L, "alpha");
            when(serverRepository.findHandles()).thenReturn(List.of("alpha"));
            when(serverRepository.findGameIdsByHandle("alpha")).thenReturn(List.of(4L, 9L));
            when(serverRepository.findFirstByGameIdAndHandle(4L, "alpha")).thenReturn(Optional.of(first));
            when(serverRepository.findFirstByGameIdAndHandle(9L, "alpha")).thenReturn(Optional.of(latest));

            ServerView view = service.resolve("alpha");

            assertSame(first, view.first());
            assertSame(latest, view.latest());
            assertEquals("alpha", view.toRecord().handle());
        }

        @Test
        @DisplayName("resolve_unknownServer_throwsNotFound")
        void resolve_unknownServer_throwsNotFound() {
            when(serverRepository.findHandles()).thenReturn(List.of());

            assertThrows(NotFoundException.class, () -> service.resolve("ghost"));
        }
    }

    // =========================================================================
    // Maps
    // =========================================================================

    @Nested
    @DisplayName("Maps")
    class Maps {

        private MapService service;

        @BeforeEach
        void setUp() {
            service = new MapService(gameRepository, playerRepository, filters);
        }

        @Test
        @DisplayName("resolve_computesGameAndPlayerTime")
        void resolve_computesGameAndPlayerTime() {
            Game g1 = TestFixtures.buildGame(1L, "maze");
            Game g2 = TestFixtures.buildGame(5L, "maze");
            when(gameRepository.findMapNames()).thenReturn(List.of("maze", "abyss"));
            when(gameRepository.findIdsByMap("maze")).thenReturn(List.of(1L, 5L));
            when(gameRepository.findById(1L)).thenReturn(Optional.of(g1));
            when(gameRepository.findById(5L)).thenReturn(Optional.of(g2));
            when(gameRepository.sumTimePlayedByMap("maze")).thenReturn(1200L);
            when(playerRepository.sumTimeActiveByMap("maze")).thenReturn(null);

            MapView view = service.resolve("maze");

            assertSame(g1, view.first());
            assertSame(g2, view.latest());
            assertEquals(1200, view.gameTime());
            assertEquals(0, view.playerTime());
        }

        @Test
        @DisplayName("resolve_unknownMap_throwsNotFound")
        void resolve_unknownMap_throwsNotFound() {
            when(gameRepository.findMapNames()).thenReturn(List.of("maze", "abyss"));

            NotFoundException e = assertThrows(NotFoundException.class, () -> service.resolve("nowhere"));
            assertEquals("map", e.getKind());
            assertEquals("nowhere", e.getName());
            verify(gameRepository, never()).findIdsByMap(anyString());
        }

        @Test
        @DisplayName("raceListing_filtersOnTimedRace")
        void raceListing_filtersOnTimedRace() {
            ArgumentCaptor<GameFilter> filter = ArgumentCaptor.forClass(GameFilter.class);
            when(gameRepository.findMapNamesMatching(filter.capture())).thenReturn(List.of("maze"));

            assertEquals(List.of("maze"), service.mapList(true));

            int race = catalog.modeIndex("race");
            int timed = catalog.mutatorMask("race", "timed");
            assertTrue(filter.getValue().matches(race, timed));
            assertFalse(filter.getValue().matches(race, 0));
            assertFalse(filter.getValue().matches(catalog.modeIndex("deathmatch"), timed));
            verify(gameRepository, never()).findMapNames();
        }

        @Test
        @DisplayName("paginate_race_countsRaceMapsOnly")
        void paginate_race_countsRaceMapsOnly() {
            when(gameRepository.findMapNamesMatching(any(GameFilter.class))).thenReturn(List.of("maze"));
            when(gameRepository.countMapNamesMatching(any(GameFilter.class))).thenReturn(1L);
            when(gameRepository.findIdsByMap("maze")).thenReturn(List.of());

            Pagination<MapView> page = service.paginate(0, 10, true);

            assertEquals(1, page.total());
            assertEquals("maze", page.items().get(0).name());
            verify(gameRepository, never()).countMapNames();
        }
    }

    // =========================================================================
    // Modes and mutators
    // =========================================================================

    @Nested
    @DisplayName("Modes and mutators")
    class ModesAndMutators {

        @Test
        @DisplayName("modes_listHidesDemoAndEdit")
        void modes_listHidesDemoAndEdit() {
            ModeService service = new ModeService(catalog, gameRepository, filters);

            assertEquals(List.of("deathmatch", "capture", "defend", "bomber", "race"), service.list());
            assertEquals(5, service.count());
            assertThrows(NotFoundException.class, () -> service.resolve("demo"));
        }

        @Test
        @DisplayName("mode_resolve_pushesModeFilterDown")
        void mode_resolve_pushesModeFilterDown() {
            ModeService service = new ModeService(catalog, gameRepository, filters);
            ArgumentCaptor<GameFilter> filter = ArgumentCaptor.forClass(GameFilter.class);
            when(gameRepository.findIdsMatching(filter.capture())).thenReturn(List.of(2L, 8L));

            ModeView view = service.resolve("capture");

            assertEquals(List.of(2L, 8L), view.gameIds());
            assertEquals("Capture the Flag", view.modeStr(false));
            assertEquals("capture", view.modeStr(true));
            assertEquals(catalog.modeIndex("capture"), filter.getValue().mode());
        }

        @Test
        @DisplayName("mutator_qualifiedName_resolvesAgainstItsMode")
        void mutator_qualifiedName_resolvesAgainstItsMode() {
            MutatorService service = new MutatorService(catalog, gameRepository, filters);
            ArgumentCaptor<GameFilter> filter = ArgumentCaptor.forClass(GameFilter.class);
            when(gameRepository.findIdsMatching(filter.capture())).thenReturn(List.of(3L));

            MutatorView view = service.resolve("race-timed");

            assertEquals(List.of(3L), view.gameIds());
            assertEquals(catalog.modeIndex("race"), filter.getValue().mode());
            assertEquals(catalog.mutatorMask("race", "timed"), filter.getValue().requiredMutators());
        }

        @Test
        @DisplayName("mutator_unknown_throwsNotFound")
        void mutator_unknown_throwsNotFound() {
            MutatorService service = new MutatorService(catalog, gameRepository, filters);

            assertThrows(NotFoundException.class, () -> service.resolve("timed"));
            verifyNoInteractions(gameRepository);
        }
    }
}
