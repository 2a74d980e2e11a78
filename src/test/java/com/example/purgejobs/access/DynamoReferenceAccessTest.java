package com.example.purgejobs.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.purgejobs.models.CdnLock;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.Parameter;
import com.example.purgejobs.models.Server;
import com.example.purgejobs.models.Tenant;
import com.example.purgejobs.models.User;
import java.util.List;
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
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Lookups the engine makes against the tables it only reads.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoReferenceAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbEnhancedClient enhancedClient;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        DynamoDbClient dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();

        LocalStackTables.ensureTable(dynamo, "delivery_services", "id", ScalarAttributeType.N, null,
                "delivery_services_by_xml_id", "xml_id", ScalarAttributeType.S);
        LocalStackTables.ensureTable(dynamo, "users", "id", ScalarAttributeType.N, null,
                "users_by_username", "username", ScalarAttributeType.S);
        LocalStackTables.ensureTable(dynamo, "servers", "id", ScalarAttributeType.N, null,
                "servers_by_cdn", "cdn_id", ScalarAttributeType.N);
        LocalStackTables.ensureTable(dynamo, "tenants", "id", ScalarAttributeType.N);
        LocalStackTables.ensureTable(dynamo, "parameters", "name", ScalarAttributeType.S, "config_file",
                null, null, null);
        LocalStackTables.ensureTable(dynamo, "cdn_locks", "cdn_name", ScalarAttributeType.S);

        enhancedClient.table("delivery_services", TableSchema.fromBean(DeliveryService.class))
                .putItem(DeliveryService.builder().id(5L).xmlId("demo-ds").tenantId(2L).cdnId(100L).cdnName("cdn-a")
                        .originProtocol("http").originFqdn("origin.example.com").build());
        enhancedClient.table("delivery_services", TableSchema.fromBean(DeliveryService.class))
                .putItem(DeliveryService.builder().id(6L).xmlId("other-ds").tenantId(3L).cdnId(100L).cdnName("cdn-a")
                        .build());
        enhancedClient.table("users", TableSchema.fromBean(User.class))
                .putItem(User.builder().id(11L).username("alice").tenantId(2L).build());
        enhancedClient.table("servers", TableSchema.fromBean(Server.class))
                .putItem(Server.builder().id(1L).hostName("edge-1").cdnId(100L).status("REPORTED").profile("EDGE").build());
        enhancedClient.table("servers", TableSchema.fromBean(Server.class))
                .putItem(Server.builder().id(2L).hostName("edge-2").cdnId(200L).status("REPORTED").profile("EDGE").build());
        enhancedClient.table("tenants", TableSchema.fromBean(Tenant.class))
                .putItem(Tenant.builder().id(1L).name("root").build());
        enhancedClient.table("tenants", TableSchema.fromBean(Tenant.class))
                .putItem(Tenant.builder().id(2L).name("child").parentId(1L).build());
        enhancedClient.table("parameters", TableSchema.fromBean(Parameter.class))
                .putItem(Parameter.builder().name(Parameter.LOCATION).configFile(Parameter.REGEX_REVALIDATE_CONFIG_FILE)
                        .value("/etc/trafficserver").profiles(Set.of("EDGE", "MID")).build());
        enhancedClient.table("cdn_locks", TableSchema.fromBean(CdnLock.class))
                .putItem(CdnLock.builder().cdnName("cdn-a").userName("admin").soft(false).message("maintenance").build());
    }

    @Test
    @DisplayName("delivery services resolve by id, by xmlId and by tenant")
    void deliveryServices() {
        DeliveryServiceAccess access = new DynamoDeliveryServiceAccess(enhancedClient);

        assertEquals("demo-ds", access.findById(5L).orElseThrow().getXmlId());
        assertEquals(5L, access.findByXmlId("demo-ds").orElseThrow().getId());
        assertTrue(access.findByXmlId("ghost").isEmpty());
        assertEquals(List.of(6L), access.findAllByTenantIds(Set.of(3L)).stream().map(DeliveryService::getId).toList());
        assertTrue(access.findAllByTenantIds(Set.of()).isEmpty());
    }

    @Test
    @DisplayName("users resolve by id and by username")
    void users() {
        UserAccess access = new DynamoUserAccess(enhancedClient);

        assertEquals("alice", access.findById(11L).orElseThrow().getUsername());
        assertEquals(11L, access.findByUsername("alice").orElseThrow().getId());
        assertTrue(access.findByUsername("ghost").isEmpty());
    }

    @Test
    @DisplayName("servers are listed per CDN")
    void servers() {
        ServerAccess access = new DynamoServerAccess(enhancedClient);

        List<Server> servers = access.findAllByCdnId(100L);

        assertEquals(1, servers.size());
        assertEquals("edge-1", servers.get(0).getHostName());
    }

    @Test
    @DisplayName("tenants, parameters and locks are readable")
    void tenantsParametersAndLocks() {
        assertEquals(2, new DynamoTenantAccess(enhancedClient).findAll().size());
        assertEquals(1L, new DynamoTenantAccess(enhancedClient).findById(2L).orElseThrow().getParentId());

        Parameter location = new DynamoParameterAccess(enhancedClient)
                .find(Parameter.LOCATION, Parameter.REGEX_REVALIDATE_CONFIG_FILE).orElseThrow();
        assertEquals(Set.of("EDGE", "MID"), location.getProfiles());
        assertFalse(new DynamoParameterAccess(enhancedClient)
                .find(Parameter.USE_REVAL_PENDING, Parameter.GLOBAL_CONFIG_FILE).isPresent());

        CdnLock lock = new DynamoCdnLockAccess(enhancedClient).findByCdnName("cdn-a").orElseThrow();
        assertTrue(lock.blocks("alice"));
        assertTrue(new DynamoCdnLockAccess(enhancedClient).findByCdnName("cdn-b").isEmpty());
    }
}
