package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Card database that loads card definitions from JSON.
 * The document shape is {@code {"cards": [ ... ]}}.
 */
public class CardDatabase {
    private static final Logger LOG = LoggerFactory.getLogger(CardDatabase.class);

    /**
     * Tag that marks a card as the anchor of a tree.
     */
    public static final String ANCHOR_TAG = "Tree";

    private final Map<String, CardDefinition> cards;
    private final Set<String> anchorIds;

    private CardDatabase(Map<String, CardDefinition> cards) {
        this.cards = cards;
        Set<String> anchors = new LinkedHashSet<>();
        for (CardDefinition card : cards.values()) {
            if (card.hasTag(ANCHOR_TAG)) {
                anchors.add(card.getId());
            }
        }
        this.anchorIds = Collections.unmodifiableSet(anchors);
    }

    /**
     * Load cards from a JSON file.
     */
    public static CardDatabase fromFile(String path) throws CardDatabaseException {
        try {
            String content = Files.readString(Path.of(path));
            CardDatabase db = fromJson(content);
            LOG.info("Loaded {} card definitions from {}", db.cardCount(), path);
            return db;
        } catch (IOException e) {
            throw new CardDatabaseException("IO error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a classpath resource.
     */
    public static CardDatabase fromResource(String resourcePath) throws CardDatabaseException {
        try (InputStream is = CardDatabase.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new CardDatabaseException("Resource not found: " + resourcePath);
            }
            ObjectMapper mapper = newMapper();
            CardDatabase db = fromCardList(parse(mapper, mapper.readTree(is)));
            LOG.info("Loaded {} card definitions from classpath:{}", db.cardCount(), resourcePath);
            return db;
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Load cards from a JSON string.
     */
    public static CardDatabase fromJson(String json) throws CardDatabaseException {
        try {
            ObjectMapper mapper = newMapper();
            return fromCardList(parse(mapper, mapper.readTree(json)));
        } catch (IOException e) {
            throw new CardDatabaseException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    /**
     * Build a database from definitions already in memory.
     */
    public static CardDatabase of(List<CardDefinition> definitions) {
        return fromCardList(definitions);
    }

    private static ObjectMapper newMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Bind the card document, accepting score rule types in any letter case.
     */
    private static List<CardDefinition> parse(ObjectMapper mapper, JsonNode root)
            throws IOException, CardDatabaseException {
        for (JsonNode card : root.path("cards")) {
            JsonNode score = card.path("score");
            if (score.isObject() && score.path("type").isTextual()) {
                ((ObjectNode) score).put("type", score.get("type").asText().toLowerCase(Locale.ROOT));
            }
        }
        CardFile file = mapper.treeToValue(root, CardFile.class);
        if (file == null) {
            throw new CardDatabaseException("Card file is empty");
        }
        return file.cards;
    }

    private static CardDatabase fromCardList(List<CardDefinition> cardList) {
        Map<String, CardDefinition> cards = new LinkedHashMap<>();
        if (cardList != null) {
            for (CardDefinition card : cardList) {
                cards.put(card.getId(), card);
            }
        }
        return new CardDatabase(cards);
    }

    /**
     * Get a card by id.
     * @throws CardDatabaseException if the card is not found
     */
    public CardDefinition getCard(String id) throws CardDatabaseException {
        CardDefinition card = cards.get(id);
        if (card == null) {
            throw new CardDatabaseException("Card not found: " + id);
        }
        return card;
    }

    /**
     * Look up a card by id; unknown ids are a normal outcome while scoring.
     */
    public Optional<CardDefinition> findCard(String id) {
        return Optional.ofNullable(cards.get(id));
    }

    /**
     * Get total number of cards.
     */
    public int cardCount() {
        return cards.size();
    }

    /**
     * Check if a card exists.
     */
    public boolean hasCard(String id) {
        return cards.containsKey(id);
    }

    /**
     * Whether cards with this id anchor a tree.
     */
    public boolean isAnchor(String id) {
        return anchorIds.contains(id);
    }

    public Set<String> anchorIds() {
        return anchorIds;
    }

    private static final class CardFile {
        @JsonProperty("cards")
        private List<CardDefinition> cards;
    }
}
