package com.example.datadestruction.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Projection of a participant registry entry: the identifier plus the two destruction flags
 * maintained by the upstream system of record. Only the attributes the destruction job reads
 * are mapped.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // required by DynamoDB Enhanced Client
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Participant {

    public static final String CONNECT_ID_ATTRIBUTE = "Connect_ID";
    public static final String DESTROY_DATA_ATTRIBUTE = "d_831041022";
    public static final String DATA_DESTROYED_ATTRIBUTE = "d_861639549";

    // Concept id for "Yes"
    public static final String YES = "353358909";

    @NonNull
    private String connectId;

    private String destroyData;
    private String dataDestroyed;

    @DynamoDbPartitionKey
    @DynamoDbAttribute(CONNECT_ID_ATTRIBUTE)
    @JsonProperty(CONNECT_ID_ATTRIBUTE)
    public String getConnectId() { return connectId; }

    @DynamoDbAttribute(DESTROY_DATA_ATTRIBUTE)
    @JsonProperty(DESTROY_DATA_ATTRIBUTE)
    public String getDestroyData() { return destroyData; }

    @DynamoDbAttribute(DATA_DESTROYED_ATTRIBUTE)
    @JsonProperty(DATA_DESTROYED_ATTRIBUTE)
    public String getDataDestroyed() { return dataDestroyed; }

    /**
     * True only when destruction was requested and the upstream destruction has been confirmed.
     * Derived rows may be deleted for this participant only when this holds.
     */
    @DynamoDbIgnore
    @JsonIgnore
    public boolean isDestructionConfirmed() {
        return YES.equals(destroyData) && YES.equals(dataDestroyed);
    }
}
