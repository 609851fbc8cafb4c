package com.mischwald.scorer.scoring;

import com.mischwald.scorer.layout.CardInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Id-disjoint grouping used by unique table conditions, shared by all instances of one player.
 *
 * <p>The first instance to be grouped opens an empty group of its own; its matches are then
 * packed first-fit into groups that do not yet hold their id. Every match remembers its group,
 * and later instances that already have a group reuse it instead of regrouping.
 */
public class TableGroups {
    private final List<Set<String>> groupOf;

    public TableGroups(int instanceCount) {
        this.groupOf = new ArrayList<>(Collections.nCopies(instanceCount, null));
    }

    public boolean isGrouped(CardInstance card) {
        return groupOf.get(card.getIndex()) != null;
    }

    /**
     * Size of the instance's group, empty if it has none yet.
     */
    public OptionalInt groupSize(CardInstance card) {
        Set<String> group = groupOf.get(card.getIndex());
        return group != null ? OptionalInt.of(group.size()) : OptionalInt.empty();
    }

    /**
     * Pack the matches into groups on behalf of {@code self} and return the size of self's group.
     */
    public int assign(CardInstance self, List<CardInstance> matches) {
        Set<String> own = new HashSet<>();
        List<Set<String>> groups = new ArrayList<>();
        groups.add(own);
        groupOf.set(self.getIndex(), own);

        for (CardInstance match : matches) {
            Set<String> target = null;
            for (Set<String> group : groups) {
                if (!group.contains(match.getEntityId())) {
                    target = group;
                    break;
                }
            }
            if (target == null) {
                target = new HashSet<>();
                groups.add(target);
            }
            target.add(match.getEntityId());
            groupOf.set(match.getIndex(), target);
        }
        return groupOf.get(self.getIndex()).size();
    }
}
