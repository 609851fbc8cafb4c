package com.mischwald.scorer.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * All trees of one player plus the instances that did not attach to any of them.
 * Instances are kept in an arena addressed by {@link CardInstance#getIndex()}.
 */
public class Forest {
    private final List<CardInstance> instances;
    private final List<Tree> trees;
    private final List<CardInstance> unattached;

    Forest(List<CardInstance> instances, List<Tree> trees) {
        this.instances = List.copyOf(instances);
        this.trees = List.copyOf(trees);

        boolean[] inTree = new boolean[instances.size()];
        for (Tree tree : trees) {
            for (CardInstance member : tree.members()) {
                inTree[member.getIndex()] = true;
            }
        }
        List<CardInstance> loose = new ArrayList<>();
        for (CardInstance instance : instances) {
            if (!inTree[instance.getIndex()]) {
                loose.add(instance);
            }
        }
        this.unattached = List.copyOf(loose);
    }

    public static Forest empty() {
        return new Forest(List.of(), List.of());
    }

    /**
     * Every instance in arena (input) order.
     */
    public List<CardInstance> getInstances() {
        return instances;
    }

    public CardInstance getInstance(int index) {
        return instances.get(index);
    }

    public int size() {
        return instances.size();
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }

    public List<Tree> getTrees() {
        return trees;
    }

    /**
     * Instances belonging to no tree, in input order.
     */
    public List<CardInstance> getUnattached() {
        return unattached;
    }

    /**
     * Every instance in scoring order: each tree's members, then the unattached ones.
     */
    public List<CardInstance> members() {
        List<CardInstance> result = new ArrayList<>(instances.size());
        for (Tree tree : trees) {
            result.addAll(tree.members());
        }
        result.addAll(unattached);
        return result;
    }
}
