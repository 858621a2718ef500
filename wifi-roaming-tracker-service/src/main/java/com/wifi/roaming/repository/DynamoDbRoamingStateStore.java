package com.wifi.roaming.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.exception.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

/**
 * DynamoDB implementation of {@link RoamingStateStore}.
 *
 * <p>The whole document is kept as a JSON string in a single item, so each save is one
 * {@code PutItem} and replaces the previous state atomically.
 */
@Repository
@ConditionalOnProperty(prefix = "roaming.store", name = "type", havingValue = "dynamodb")
public class DynamoDbRoamingStateStore implements RoamingStateStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbRoamingStateStore.class);

    private final DynamoDbTable<RoamingStateItem> stateTable;
    private final ObjectMapper objectMapper;
    private final String tableName;
    private final String stateId;

    public DynamoDbRoamingStateStore(
            DynamoDbEnhancedClient enhancedClient,
            ObjectMapper objectMapper,
            RoamingProperties properties) {
        this.objectMapper = objectMapper;
        this.tableName = properties.getStore().getDynamodb().getTableName();
        this.stateId = properties.getStore().getDynamodb().getStateId();
        this.stateTable = enhancedClient.table(tableName, TableSchema.fromBean(RoamingStateItem.class));
        logger.info("Initialized DynamoDbRoamingStateStore with table: {}, state id: {}", tableName, stateId);
    }

    @Override
    public Optional<RoamingStateDocument> load() {
        RoamingStateItem item;
        try {
            item = stateTable.getItem(Key.builder().partitionValue(stateId).build());
        } catch (SdkException e) {
            throw new StateStoreException("Failed to read roaming state from table " + tableName, e);
        }
        if (item == null || item.getDocument() == null) {
            logger.debug("No roaming state item '{}' in table {}", stateId, tableName);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(item.getDocument(), RoamingStateDocument.class));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new StateStoreException("Roaming state item '" + stateId + "' is not a valid document", e);
        }
    }

    @Override
    public void save(RoamingStateDocument document) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Failed to serialize roaming state", e);
        }

        RoamingStateItem item = RoamingStateItem.builder()
                .stateId(stateId)
                .document(json)
                .lastUpdated(document.lastUpdated() == null ? null : document.lastUpdated().toString())
                .build();
        try {
            stateTable.putItem(item);
        } catch (SdkException e) {
            throw new StateStoreException("Failed to write roaming state to table " + tableName, e);
        }
    }

    @Override
    public String describe() {
        return "dynamodb:" + tableName + "/" + stateId;
    }
}
