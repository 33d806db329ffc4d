package com.statsdb.statsdb_api.repository;

import com.statsdb.statsdb_api.model.Game;
import com.statsdb.statsdb_api.service.GameFilter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface GameRepository extends JpaRepository<Game, Long> {

    /**
     * Ruleset predicate appended to native queries that join {@code games g}.
     * Expects a {@code filter} parameter of type GameFilter.
     */
    String RULESET_FILTER = """
         AND (:#{#filter.mode()} < 0 OR g.mode = :#{#filter.mode()})
         AND (g.mutators & :#{#filter.requiredMutators()}) = :#{#filter.requiredMutators()}
         AND (g.mutators & :#{#filter.excludedMutators()}) = 0
        """;

    // =========================================================================
    // Map listings
    // =========================================================================

    /** Distinct map names, most recently played first. */
    @Query("""
        SELECT g.map FROM Game g
        WHERE g.map <> ''
        GROUP BY g.map
        ORDER BY MAX(g.id) DESC
        """)
    List<String> findMapNames();

    @Query("SELECT COUNT(DISTINCT g.map) FROM Game g WHERE g.map <> ''")
    long countMapNames();

    @Query(value = """
        SELECT g.map FROM games g
        WHERE g.map <> ''
        """ + RULESET_FILTER + """
        GROUP BY g.map
        ORDER BY MAX(g.id) DESC
        """, nativeQuery = true)
    List<String> findMapNamesMatching(@Param("filter") GameFilter filter);

    @Query(value = """
        SELECT COUNT(DISTINCT g.map) FROM games g
        WHERE g.map <> ''
        """ + RULESET_FILTER, nativeQuery = true)
    long countMapNamesMatching(@Param("filter") GameFilter filter);

    // =========================================================================
    // Game id lookups
    // =========================================================================

    @Query("SELECT g.id FROM Game g WHERE g.map = :map ORDER BY g.id ASC")
    List<Long> findIdsByMap(@Param("map") String map);

    @Query(value = """
        SELECT g.id FROM games g
        WHERE 1 = 1
        """ + RULESET_FILTER + """
        ORDER BY g.id ASC
        """, nativeQuery = true)
    List<Long> findIdsMatching(@Param("filter") GameFilter filter);

    // =========================================================================
    // Full rows and aggregates
    // =========================================================================

    List<Game> findByIdInOrderByIdAsc(Collection<Long> ids);

    List<Game> findByIdInOrderByIdDesc(Collection<Long> ids);

    /** One map name per existing game in {@code ids}. */
    @Query("SELECT g.map FROM Game g WHERE g.id IN :ids")
    List<String> findMapsByIdIn(@Param("ids") Collection<Long> ids);

    @Query("SELECT COALESCE(SUM(g.timePlayed), 0) FROM Game g WHERE g.map = :map")
    Long sumTimePlayedByMap(@Param("map") String map);
}
