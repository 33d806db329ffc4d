package com.statsdb.statsdb_api.repository;

import com.statsdb.statsdb_api.model.GamePlayer;
import com.statsdb.statsdb_api.service.GameFilter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface GamePlayerRepository extends JpaRepository<GamePlayer, Long> {

    // =========================================================================
    // Handle listings (anonymous rows have an empty handle and are skipped)
    // =========================================================================

    @Query("""
        SELECT gp.handle FROM GamePlayer gp
        WHERE gp.handle <> ''
        GROUP BY gp.handle
        ORDER BY MAX(gp.gameId) DESC
        """)
    List<String> findHandles();

    @Query("SELECT COUNT(DISTINCT gp.handle) FROM GamePlayer gp WHERE gp.handle <> ''")
    long countHandles();

    /**
     * Ascending ids of the games a handle played, restricted to games that
     * still exist.
     */
    @Query("""
        SELECT DISTINCT gp.gameId FROM GamePlayer gp
        WHERE gp.handle = :handle
        AND EXISTS (SELECT g.id FROM Game g WHERE g.id = gp.gameId)
        ORDER BY gp.gameId ASC
        """)
    List<Long> findGameIdsByHandle(@Param("handle") String handle);

    Optional<GamePlayer> findFirstByGameIdAndHandle(Long gameId, String handle);

    // =========================================================================
    // Aggregates
    // =========================================================================

    @Query("""
        SELECT COALESCE(SUM(gp.timeActive), 0) FROM GamePlayer gp
        WHERE gp.gameId IN (SELECT g.id FROM Game g WHERE g.map = :map)
        """)
    Long sumTimeActiveByMap(@Param("map") String map);

    @Query(value = """
        SELECT COALESCE(SUM(gp.frags), 0) AS frags,
               COALESCE(SUM(gp.deaths), 0) AS deaths,
               COALESCE(SUM(gp.time_alive), 0) AS alive
        FROM game_players gp JOIN games g ON g.id = gp.game_id
        WHERE gp.handle = :handle
        AND gp.game_id IN (:gameIds)
        """ + GameRepository.RULESET_FILTER, nativeQuery = true)
    PlayerTotals sumTotals(@Param("handle") String handle,
                           @Param("gameIds") Collection<Long> gameIds,
                           @Param("filter") GameFilter filter);

    /**
     * Best finished run per handle on a map, fastest first. Score 0 marks an
     * unfinished run. Ties on a handle's best score resolve to an arbitrary row.
     */
    @Query(value = """
        SELECT ranked.id, ranked.game_id, ranked.handle, ranked.name, ranked.score,
               ranked.frags, ranked.deaths, ranked.time_alive, ranked.time_active
        FROM (
            SELECT gp.*, ROW_NUMBER() OVER (PARTITION BY gp.handle ORDER BY gp.score ASC) AS rn
            FROM game_players gp JOIN games g ON g.id = gp.game_id
            WHERE g.map = :map
            AND gp.score > 0
            """ + GameRepository.RULESET_FILTER + """
        ) ranked
        WHERE ranked.rn = 1
        ORDER BY ranked.score ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<GamePlayer> findBestRuns(@Param("map") String map,
                                  @Param("filter") GameFilter filter,
                                  @Param("limit") int limit);
}
