package io.surfworks.songfolder.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffle-order helpers.
 */
public final class Permutations {

    private Permutations() {}

    /**
     * Check that {@code order} contains each of {@code 0..n-1} exactly once.
     */
    public static boolean isPermutation(List<Integer> order, int n) {
        if (order == null || order.size() != n) {
            return false;
        }
        boolean[] seen = new boolean[n];
        for (Integer value : order) {
            if (value == null || value < 0 || value >= n || seen[value]) {
                return false;
            }
            seen[value] = true;
        }
        return true;
    }

    /**
     * A uniformly random permutation of {@code 0..n-1}.
     */
    public static List<Integer> shuffled(int n, Random random) {
        List<Integer> order = identity(n);
        Collections.shuffle(order, random);
        return List.copyOf(order);
    }

    /**
     * A random permutation of {@code 0..n-1} whose first element is {@code first}.
     */
    public static List<Integer> shuffledWithFirst(int n, int first, Random random) {
        if (first < 0 || first >= n) {
            throw new IllegalArgumentException("first " + first + " out of range for " + n + " tracks");
        }
        List<Integer> rest = new ArrayList<>(n - 1);
        for (int i = 0; i < n; i++) {
            if (i != first) {
                rest.add(i);
            }
        }
        Collections.shuffle(rest, random);

        List<Integer> order = new ArrayList<>(n);
        order.add(first);
        order.addAll(rest);
        return List.copyOf(order);
    }

    static List<Integer> identity(int n) {
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        return order;
    }
}
