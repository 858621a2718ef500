package com.wifi.roaming.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wifi.roaming.config.RoamingProperties;
import com.wifi.roaming.dto.TrackerStatistics;
import com.wifi.roaming.exception.StateStoreException;
import com.wifi.roaming.support.RoamingTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DynamoDbRoamingStateStore against a mocked enhanced client.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DynamoDbRoamingStateStore Tests")
class DynamoDbRoamingStateStoreTest {

    // Test Constants
    private static final String TEST_TABLE_NAME = "test_wifi_roaming_state";
    private static final String TEST_STATE_ID = "home-network";
    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");

    @Mock
    private DynamoDbEnhancedClient mockEnhancedClient;

    @Mock
    private DynamoDbTable<RoamingStateItem> mockTable;

    private ObjectMapper objectMapper;
    private DynamoDbRoamingStateStore store;

    @BeforeEach
    void setUp() {
        RoamingProperties properties = new RoamingProperties();
        properties.getStore().getDynamodb().setTableName(TEST_TABLE_NAME);
        properties.getStore().getDynamodb().setStateId(TEST_STATE_ID);
        objectMapper = RoamingTestFixtures.objectMapper();

        when(mockEnhancedClient.table(eq(TEST_TABLE_NAME), any(TableSchema.class))).thenReturn(mockTable);
        store = new DynamoDbRoamingStateStore(mockEnhancedClient, objectMapper, properties);
    }

    @Test
    @DisplayName("should_PutSingleItemWithSerializedDocument_When_Saved")
    void should_PutSingleItemWithSerializedDocument_When_Saved() throws Exception {
        // Arrange
        RoamingStateDocument document = new RoamingStateDocument(List.of(), List.of(),
                new TrackerStatistics(0, 0, 0, 0, 0, NOW), NOW);
        ArgumentCaptor<RoamingStateItem> captor = ArgumentCaptor.forClass(RoamingStateItem.class);

        // Act
        store.save(document);

        // Assert
        verify(mockTable).putItem(captor.capture());
        RoamingStateItem item = captor.getValue();
        assertEquals(TEST_STATE_ID, item.getStateId());
        assertEquals("2024-05-01T08:00:00Z", item.getLastUpdated());
        assertEquals(document, objectMapper.readValue(item.getDocument(), RoamingStateDocument.class));
    }

    @Test
    @DisplayName("should_ReturnDocument_When_ItemExists")
    void should_ReturnDocument_When_ItemExists() throws Exception {
        // Arrange
        RoamingStateDocument document = new RoamingStateDocument(List.of(), List.of(), TrackerStatistics.empty(), NOW);
        RoamingStateItem item = RoamingStateItem.builder()
                .stateId(TEST_STATE_ID)
                .document(objectMapper.writeValueAsString(document))
                .lastUpdated(NOW.toString())
                .build();
        when(mockTable.getItem(any(Key.class))).thenReturn(item);

        // Act
        Optional<RoamingStateDocument> loaded = store.load();

        // Assert
        assertEquals(Optional.of(document), loaded);
    }

    @Test
    @DisplayName("should_ReturnEmpty_When_ItemMissing")
    void should_ReturnEmpty_When_ItemMissing() {
        when(mockTable.getItem(any(Key.class))).thenReturn(null);

        assertTrue(store.load().isEmpty());
    }

    @Test
    @DisplayName("should_ThrowStateStoreException_When_DocumentCorrupt")
    void should_ThrowStateStoreException_When_DocumentCorrupt() {
        RoamingStateItem item = RoamingStateItem.builder()
                .stateId(TEST_STATE_ID)
                .document("{not json")
                .build();
        when(mockTable.getItem(any(Key.class))).thenReturn(item);

        assertThrows(StateStoreException.class, () -> store.load());
    }

    @Test
    @DisplayName("should_ThrowStateStoreException_When_TableMissing")
    void should_ThrowStateStoreException_When_TableMissing() {
        // Arrange
        ResourceNotFoundException exception = ResourceNotFoundException.builder()
                .message("Requested resource not found")
                .build();
        doThrow(exception).when(mockTable).putItem(any(RoamingStateItem.class));
        RoamingStateDocument document = new RoamingStateDocument(List.of(), List.of(), TrackerStatistics.empty(), NOW);

        // Act & Assert
        StateStoreException thrown = assertThrows(StateStoreException.class, () -> store.save(document));
        assertTrue(thrown.getMessage().contains(TEST_TABLE_NAME));
    }

    @Test
    @DisplayName("should_DescribeTableAndStateId")
    void should_DescribeTableAndStateId() {
        assertEquals("dynamodb:" + TEST_TABLE_NAME + "/" + TEST_STATE_ID, store.describe());
    }
}
