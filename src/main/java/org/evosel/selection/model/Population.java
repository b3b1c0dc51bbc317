package org.evosel.selection.model;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable snapshot of the individuals handed to one sorting or selection call.
 * <p>
 * Individuals keep their insertion order, which is the order every algorithm in this library uses
 * for tie-breaking. Construction validates the caller contract: unique ids and one objective
 * dimensionality M shared by every member.
 */
public final class Population implements Iterable<Individual> {

    private static final Population EMPTY = new Population(List.of(), 0, newIndex(0));

    private final List<Individual> members;
    private final int objectiveCount;
    private final Int2IntOpenHashMap indexById;

    private Population(List<Individual> members, int objectiveCount, Int2IntOpenHashMap indexById) {
        this.members = members;
        this.objectiveCount = objectiveCount;
        this.indexById = indexById;
    }

    /**
     * Creates a population from the given individuals.
     *
     * @param individuals The individuals, in caller order.
     * @return The validated population.
     * @throws IllegalArgumentException on duplicate ids or mismatched objective dimensionality.
     */
    public static Population of(Collection<Individual> individuals) {
        if (individuals.isEmpty()) {
            return EMPTY;
        }
        List<Individual> copy = new ArrayList<>(individuals);
        Int2IntOpenHashMap indexById = newIndex(copy.size());
        int m = copy.get(0).fitness().dimension();
        for (int i = 0; i < copy.size(); i++) {
            Individual ind = copy.get(i);
            if (ind.fitness().dimension() != m) {
                throw new IllegalArgumentException("Individual " + ind.id() + " has " + ind.fitness().dimension()
                        + " objectives, expected " + m + " (from individual " + copy.get(0).id() + ")");
            }
            if (indexById.put(ind.id(), i) != -1) {
                throw new IllegalArgumentException("Duplicate individual id " + ind.id());
            }
        }
        return new Population(Collections.unmodifiableList(copy), m, indexById);
    }

    private static Int2IntOpenHashMap newIndex(int expected) {
        Int2IntOpenHashMap index = new Int2IntOpenHashMap(expected);
        index.defaultReturnValue(-1);
        return index;
    }

    /**
     * @param individuals The individuals, in caller order.
     * @return The validated population.
     */
    public static Population of(Individual... individuals) {
        return of(List.of(individuals));
    }

    /**
     * @return The empty population.
     */
    public static Population empty() {
        return EMPTY;
    }

    /**
     * @return Number of individuals N.
     */
    public int size() {
        return members.size();
    }

    /**
     * @return {@code true} if there are no individuals.
     */
    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * @return The shared objective count M, or 0 for an empty population.
     */
    public int objectiveCount() {
        return objectiveCount;
    }

    /**
     * @param index Position in insertion order.
     * @return The individual at {@code index}.
     */
    public Individual get(int index) {
        return members.get(index);
    }

    /**
     * @param id An individual key.
     * @return The individual with that key.
     * @throws IllegalArgumentException if no member has that key.
     */
    public Individual byId(int id) {
        int index = indexById.get(id);
        if (index < 0) {
            throw new IllegalArgumentException("No individual with id " + id);
        }
        return members.get(index);
    }

    /**
     * @param id An individual key.
     * @return Its position in insertion order, or -1.
     */
    public int indexOf(int id) {
        return indexById.get(id);
    }

    /**
     * @return Unmodifiable view of the members.
     */
    public List<Individual> members() {
        return members;
    }

    /**
     * Creates the sub-population made of the given positions, preserving their order.
     *
     * @param indices Positions in this population.
     * @return The sub-population.
     */
    public Population subset(IntList indices) {
        List<Individual> picked = new ArrayList<>(indices.size());
        for (int i = 0; i < indices.size(); i++) {
            picked.add(members.get(indices.getInt(i)));
        }
        return of(picked);
    }

    /**
     * @return The objective vectors as an N x M matrix. Rows are shared with the fitness records.
     */
    public double[][] objectiveMatrix() {
        double[][] matrix = new double[members.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = members.get(i).objectives();
        }
        return matrix;
    }

    @Override
    public Iterator<Individual> iterator() {
        return members.iterator();
    }

    @Override
    public String toString() {
        return "Population[size=" + members.size() + ", objectives=" + objectiveCount + "]";
    }
}
