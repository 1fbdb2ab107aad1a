package com.example.datadestruction.service;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.datadestruction.access.DynamoParticipantAccess;
import com.example.datadestruction.access.DynamoWarehouseAccess;
import com.example.datadestruction.config.BatchDestructionProperties;
import com.example.datadestruction.config.DestructionProperties;
import com.example.datadestruction.models.Participant;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Runs the scheduled job end to end against LocalStack: registry scan, flag gating and delete.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ScheduledDestructionJobIntegrationTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final String REGISTRY = "it.FlatConnect.participants_JP";
    private static final String DERIVED = "it.ForTestingOnly.roi_physical_activity";

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbClient dynamo;
    private DynamoDbTable<Participant> registry;
    private ScheduledDestructionJob job;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();

        registry = enhanced.table(REGISTRY, TableSchema.fromBean(Participant.class));
        registry.createTable();
        dynamo.createTable(b -> b.tableName(DERIVED)
                .keySchema(
                        KeySchemaElement.builder().attributeName("Connect_ID").keyType(KeyType.HASH).build(),
                        KeySchemaElement.builder().attributeName("week").keyType(KeyType.RANGE).build())
                .attributeDefinitions(
                        AttributeDefinition.builder().attributeName("Connect_ID")
                                .attributeType(ScalarAttributeType.S).build(),
                        AttributeDefinition.builder().attributeName("week")
                                .attributeType(ScalarAttributeType.S).build())
                .provisionedThroughput(ProvisionedThroughput.builder()
                        .readCapacityUnits(5L).writeCapacityUnits(5L).build()));
        dynamo.waiter().waitUntilTableExists(b -> b.tableName(REGISTRY));
        dynamo.waiter().waitUntilTableExists(b -> b.tableName(DERIVED));

        DestructionProperties destructionProperties = new DestructionProperties();
        destructionProperties.setProject("it");
        BatchDestructionProperties batchProperties = new BatchDestructionProperties();
        batchProperties.setEnabled(true);

        job = new ScheduledDestructionJob(
                Clock.fixed(Instant.parse("2025-03-04T07:30:00Z"), ZoneOffset.UTC),
                batchProperties,
                destructionProperties,
                new DynamoParticipantAccess(enhanced, destructionProperties, batchProperties),
                new DynamoWarehouseAccess(dynamo, destructionProperties));
    }

    @Test
    @DisplayName("deletes derived rows only for participants with both flags set")
    void deletesOnlyConfirmed() {
        registry.putItem(Participant.builder().connectId("3344744505")
                .destroyData(Participant.YES).dataDestroyed(Participant.YES).build());
        registry.putItem(Participant.builder().connectId("3860352953")
                .destroyData(Participant.YES).build());
        registry.putItem(Participant.builder().connectId("4806091014").build());

        derivedRow("3344744505", "2025-W01");
        derivedRow("3344744505", "2025-W02");
        derivedRow("3860352953", "2025-W01");
        derivedRow("4806091014", "2025-W01");

        job.destroyConfirmedParticipantData();

        assertEquals(Set.of("3860352953", "4806091014"), derivedIds());
    }

    private void derivedRow(String connectId, String week) {
        dynamo.putItem(r -> r.tableName(DERIVED).item(Map.of(
                "Connect_ID", AttributeValue.fromS(connectId),
                "week", AttributeValue.fromS(week))));
    }

    private Set<String> derivedIds() {
        Set<String> ids = new HashSet<>();
        dynamo.scanPaginator(r -> r.tableName(DERIVED).consistentRead(true))
                .items()
                .forEach(item -> ids.add(item.get("Connect_ID").s()));
        return ids;
    }
}
