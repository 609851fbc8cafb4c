package com.mischwald.scorer.layout;

import com.mischwald.scorer.card.CardDatabase;
import com.mischwald.scorer.geometry.Box;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns detector labels of the form {@code <entityId>:<treeSymbol>} into card instances.
 */
public class CardInstanceResolver {
    private static final Logger LOG = LoggerFactory.getLogger(CardInstanceResolver.class);

    public static final char SEPARATOR = ':';

    private final CardDatabase db;

    public CardInstanceResolver(CardDatabase db) {
        this.db = db;
    }

    /**
     * Resolve a box into an instance with the given arena index.
     * Labels without a separator yield no instance; unknown ids yield an instance without a definition.
     */
    public Optional<CardInstance> resolve(Box box, int index) {
        String entityId = entityIdOf(box.label());
        if (entityId == null) {
            LOG.debug("Dropping box with malformed label '{}'", box.label());
            return Optional.empty();
        }
        String label = box.label();
        String treeSymbol = label.substring(label.indexOf(SEPARATOR) + 1).trim();
        return Optional.of(new CardInstance(index, box, entityId, treeSymbol, db.findCard(entityId).orElse(null)));
    }

    /**
     * Whether the label names a card that anchors a tree.
     */
    public boolean isAnchor(Box box) {
        String entityId = entityIdOf(box.label());
        return entityId != null && db.isAnchor(entityId);
    }

    /**
     * Entity id part of a label, or null if the label has no separator.
     */
    static String entityIdOf(String label) {
        if (label == null) {
            return null;
        }
        int separator = label.indexOf(SEPARATOR);
        if (separator < 0) {
            return null;
        }
        return label.substring(0, separator).trim();
    }
}
