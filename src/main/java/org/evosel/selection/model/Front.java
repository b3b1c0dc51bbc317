package org.evosel.selection.model;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * One non-domination level: the ids of the individuals at dominance depth {@code rank}.
 *
 * @param rank    Dominance depth, 0 for the globally non-dominated level.
 * @param members Member ids in the order the assigner produced them.
 */
public record Front(int rank, IntList members) {

    public Front {
        members = IntLists.unmodifiable(members);
    }

    /**
     * @return Number of members.
     */
    public int size() {
        return members.size();
    }

    /**
     * @param id An individual key.
     * @return {@code true} if the individual belongs to this front.
     */
    public boolean contains(int id) {
        return members.contains(id);
    }
}
