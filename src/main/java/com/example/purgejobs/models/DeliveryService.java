package com.example.purgejobs.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class DeliveryService {

    @NonNull private Long id;
    @NonNull private String xmlId;
    @NonNull private Long tenantId;
    @NonNull private Long cdnId;
    @NonNull private String cdnName;

    // Primary origin; a delivery service without one cannot accept jobs.
    private String originProtocol;
    private String originFqdn;
    private Integer originPort;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("id")
    public Long getId() { return id; }

    @DynamoDbAttribute("xml_id")
    @DynamoDbSecondaryPartitionKey(indexNames = "delivery_services_by_xml_id")
    public String getXmlId() { return xmlId; }

    @DynamoDbAttribute("tenant_id")
    public Long getTenantId() { return tenantId; }

    @DynamoDbAttribute("cdn_id")
    public Long getCdnId() { return cdnId; }

    @DynamoDbAttribute("cdn_name")
    public String getCdnName() { return cdnName; }

    @DynamoDbAttribute("origin_protocol")
    public String getOriginProtocol() { return originProtocol; }

    @DynamoDbAttribute("origin_fqdn")
    public String getOriginFqdn() { return originFqdn; }

    @DynamoDbAttribute("origin_port")
    public Integer getOriginPort() { return originPort; }

    public boolean hasPrimaryOrigin() {
        return originProtocol != null && !originProtocol.isBlank()
                && originFqdn != null && !originFqdn.isBlank();
    }

    /**
     * Renders the primary origin as {@code protocol://fqdn[:port]}.
     *
     * @throws IllegalStateException if no primary origin is configured
     */
    public String primaryOrigin() {
        if (!hasPrimaryOrigin()) {
            throw new IllegalStateException("Delivery service " + xmlId + " has no primary origin");
        }
        String origin = originProtocol + "://" + originFqdn;
        return originPort == null ? origin : origin + ":" + originPort;
    }
}
