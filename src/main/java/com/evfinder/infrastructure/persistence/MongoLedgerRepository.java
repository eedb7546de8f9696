package com.evfinder.infrastructure.persistence;

import com.evfinder.domain.model.BankrollLedger;
import com.evfinder.domain.ports.LedgerPersistenceException;
import com.evfinder.domain.ports.LedgerRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB implementation of LedgerRepository.
 *
 * The ledger is a single document keyed by ledger id; saves replace it whole with an upsert,
 * which MongoDB applies atomically.
 */
@Repository
@ConditionalOnProperty(name = "evfinder.ledger.store", havingValue = "mongo")
public class MongoLedgerRepository implements LedgerRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoLedgerRepository.class);
    private static final ObjectMapper OBJECT_MAPPER = LedgerJson.newMapper();
    private static final String ID_FIELD = "_id";

    private final MongoTemplate mongoTemplate;
    private final String collectionName;
    private final String ledgerId;

    public MongoLedgerRepository(
            MongoTemplate mongoTemplate,
            String mongoCollectionName,
            @Value("${evfinder.ledger.id:default}") String ledgerId) {
        this.mongoTemplate = mongoTemplate;
        this.collectionName = mongoCollectionName;
        this.ledgerId = ledgerId;
    }

    @Override
    public Optional<BankrollLedger> load() {
        try {
            Document doc = collection().find(Filters.eq(ID_FIELD, ledgerId)).first();
            if (doc == null) {
                return Optional.empty();
            }
            return Optional.of(documentToLedger(doc));
        } catch (MongoException | IllegalArgumentException e) {
            throw new LedgerPersistenceException("Failed to read ledger " + ledgerId, e);
        }
    }

    @Override
    public void save(BankrollLedger ledger) {
        try {
            collection().replaceOne(
                Filters.eq(ID_FIELD, ledgerId),
                ledgerToDocument(ledger, ledgerId),
                new ReplaceOptions().upsert(true)
            );
            logger.debug("Ledger {} saved ({} bets)", ledgerId, ledger.getBets().size());
        } catch (MongoException e) {
            throw new LedgerPersistenceException("Failed to write ledger " + ledgerId, e);
        }
    }

    private MongoCollection<Document> collection() {
        return mongoTemplate.getCollection(collectionName);
    }

    static Document ledgerToDocument(BankrollLedger ledger, String ledgerId) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(ledger, Map.class);
        Document doc = new Document(ID_FIELD, ledgerId);
        doc.putAll(map);
        return doc;
    }

    static BankrollLedger documentToLedger(Document doc) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : doc.entrySet()) {
            if (!ID_FIELD.equals(entry.getKey())) {
                values.put(entry.getKey(), plain(entry.getValue()));
            }
        }
        return OBJECT_MAPPER.convertValue(values, BankrollLedger.class);
    }

    /**
     * Replaces BSON-specific values (Decimal128) with types Jackson understands.
     */
    @SuppressWarnings("unchecked")
    private static Object plain(Object value) {
        if (value instanceof Decimal128 decimal) {
            return decimal.bigDecimalValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> converted = new LinkedHashMap<>();
            ((Map<String, Object>) map).forEach((key, nested) -> converted.put(key, plain(nested)));
            return converted;
        }
        if (value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object nested : list) {
                converted.add(plain(nested));
            }
            return converted;
        }
        return value;
    }
}
