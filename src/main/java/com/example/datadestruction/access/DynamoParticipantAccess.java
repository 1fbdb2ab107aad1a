package com.example.datadestruction.access;

import com.example.datadestruction.config.BatchDestructionProperties;
import com.example.datadestruction.config.DestructionProperties;
import com.example.datadestruction.models.Participant;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoParticipantAccess implements ParticipantAccess {

    private static final Expression CONFIRMED_DESTRUCTION = Expression.builder()
            .expression("#destroy = :yes AND #destroyed = :yes")
            .putExpressionName("#destroy", Participant.DESTROY_DATA_ATTRIBUTE)
            .putExpressionName("#destroyed", Participant.DATA_DESTROYED_ATTRIBUTE)
            .putExpressionValue(":yes", AttributeValue.fromS(Participant.YES))
            .build();

    private final DynamoDbTable<Participant> table;

    public DynamoParticipantAccess(DynamoDbEnhancedClient enhancedClient,
                                   DestructionProperties destructionProperties,
                                   BatchDestructionProperties batchProperties) {
        String tableName = destructionProperties.getProject()
                + "." + batchProperties.getRegistryDataset()
                + "." + batchProperties.getRegistryTable();
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(Participant.class));
    }

    @Override
    public List<Participant> findConfirmedDestructions() {
        return table.scan(r -> r.filterExpression(CONFIRMED_DESTRUCTION).consistentRead(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }
}
