package com.statsdb.statsdb_api.view;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Anything that owns an ascending list of game ids.
 */
public interface GameHistory {

    /** Ascending by id, existing games only. */
    List<Long> gameIds();

    /**
     * The most recent {@code number} game ids, newest first. 0 or less means
     * all of them; asking for more than exist returns what there is.
     */
    default List<Long> lastGames(int number) {
        List<Long> reversed = new ArrayList<>(gameIds());
        Collections.reverse(reversed);
        if (number <= 0 || number >= reversed.size()) {
            return reversed;
        }
        return reversed.subList(0, number);
    }
}
