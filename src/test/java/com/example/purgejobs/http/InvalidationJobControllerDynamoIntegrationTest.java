package com.example.purgejobs.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.purgejobs.access.DynamoCdnLockAccess;
import com.example.purgejobs.access.DynamoCdnRevalidationAccess;
import com.example.purgejobs.access.DynamoDeletionLogAccess;
import com.example.purgejobs.access.DynamoDeliveryServiceAccess;
import com.example.purgejobs.access.DynamoInvalidationJobAccess;
import com.example.purgejobs.access.DynamoJobSequenceAccess;
import com.example.purgejobs.access.DynamoParameterAccess;
import com.example.purgejobs.access.DynamoServerAccess;
import com.example.purgejobs.access.DynamoTenantAccess;
import com.example.purgejobs.access.DynamoTransactionAccess;
import com.example.purgejobs.access.DynamoUserAccess;
import com.example.purgejobs.access.InvalidationJobAccess;
import com.example.purgejobs.access.LocalStackTables;
import com.example.purgejobs.config.JobsProperties;
import com.example.purgejobs.models.CdnRevalidation;
import com.example.purgejobs.models.ChangeLogEntry;
import com.example.purgejobs.models.DeletionMarker;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.DeliveryServiceRef;
import com.example.purgejobs.models.Parameter;
import com.example.purgejobs.models.RevalidationFlag;
import com.example.purgejobs.models.Server;
import com.example.purgejobs.models.Tenant;
import com.example.purgejobs.models.User;
import com.example.purgejobs.requests.CreateJobHttpRequest;
import com.example.purgejobs.requests.ReplaceJobHttpRequest;
import com.example.purgejobs.service.CdnLockGuard;
import com.example.purgejobs.service.ChangeLogService;
import com.example.purgejobs.service.ConflictValidator;
import com.example.purgejobs.service.GlobalParameters;
import com.example.purgejobs.service.InvalidationJobService;
import com.example.purgejobs.service.JobQueryService;
import com.example.purgejobs.service.PurgeJobsException;
import com.example.purgejobs.service.RevalidationFlagPropagator;
import com.example.purgejobs.service.TenantAuthorizationGate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Full-stack flow against LocalStack: controller → services → Dynamo access → DynamoDB.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class InvalidationJobControllerDynamoIntegrationTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Instant NOW = Instant.parse("2024-12-31T22:00:00Z");
    private static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

    private static final User ALICE = User.builder().id(11L).username("alice").tenantId(2L).build();
    private static final User MALLORY = User.builder().id(12L).username("mallory").tenantId(3L).build();

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private DynamoDbClient dynamo;
    private DynamoDbTable<Server> servers;
    private DynamoDbTable<ChangeLogEntry> changeLog;
    private DynamoDbTable<DeletionMarker> lastDeleted;
    private RevalidationFlagPropagator propagator;
    private InvalidationJobController controller;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        DynamoDbEnhancedClient enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
        createTables();

        enhancedClient.table("tenants", TableSchema.fromBean(Tenant.class))
                .putItem(Tenant.builder().id(2L).name("child").build());
        enhancedClient.table("tenants", TableSchema.fromBean(Tenant.class))
                .putItem(Tenant.builder().id(3L).name("other").build());
        enhancedClient.table("users", TableSchema.fromBean(User.class)).putItem(ALICE);
        enhancedClient.table("users", TableSchema.fromBean(User.class)).putItem(MALLORY);
        enhancedClient.table("delivery_services", TableSchema.fromBean(DeliveryService.class))
                .putItem(DeliveryService.builder().id(5L).xmlId("demo-ds").tenantId(2L).cdnId(100L)
                        .cdnName("cdn-a").originProtocol("http").originFqdn("origin.example.com").build());
        enhancedClient.table("parameters", TableSchema.fromBean(Parameter.class))
                .putItem(Parameter.builder().name(Parameter.LOCATION)
                        .configFile(Parameter.REGEX_REVALIDATE_CONFIG_FILE)
                        .value("/opt/trafficserver/etc/trafficserver")
                        .profiles(Set.of("EDGE"))
                        .build());

        servers = enhancedClient.table("servers", TableSchema.fromBean(Server.class));
        changeLog = enhancedClient.table("change_log", TableSchema.fromBean(ChangeLogEntry.class));
        lastDeleted = enhancedClient.table("last_deleted", TableSchema.fromBean(DeletionMarker.class));

        DynamoInvalidationJobAccess jobAccess = new DynamoInvalidationJobAccess(enhancedClient);
        DynamoDeliveryServiceAccess deliveryServiceAccess = new DynamoDeliveryServiceAccess(enhancedClient);
        JobsProperties properties = new JobsProperties();
        GlobalParameters globalParameters = new GlobalParameters(new DynamoParameterAccess(enhancedClient), properties);
        TenantAuthorizationGate gate = new TenantAuthorizationGate(
                new DynamoTenantAccess(enhancedClient), deliveryServiceAccess, new DynamoUserAccess(enhancedClient));

        propagator = new RevalidationFlagPropagator(deliveryServiceAccess, new DynamoServerAccess(enhancedClient),
                new DynamoCdnRevalidationAccess(enhancedClient), globalParameters, clock);
        InvalidationJobService jobService = new InvalidationJobService(
                jobAccess,
                deliveryServiceAccess,
                new DynamoJobSequenceAccess(dynamo),
                new DynamoTransactionAccess(enhancedClient),
                gate,
                new CdnLockGuard(new DynamoCdnLockAccess(enhancedClient)),
                new ConflictValidator(jobAccess),
                propagator,
                new ChangeLogService(clock),
                globalParameters,
                properties,
                clock);
        JobQueryService queryService = new JobQueryService(
                jobAccess, deliveryServiceAccess, new DynamoDeletionLogAccess(enhancedClient), gate,
                globalParameters, clock);
        controller = new InvalidationJobController(jobService, queryService);
    }

    @BeforeEach
    void resetMutableTables() {
        LocalStackTables.truncate(dynamo, InvalidationJobAccess.TABLE_NAME);
        LocalStackTables.truncate(dynamo, "change_log");
        LocalStackTables.truncate(dynamo, "last_deleted");
        LocalStackTables.truncate(dynamo, "servers");
        LocalStackTables.truncate(dynamo, CdnRevalidation.TABLE_NAME);
        servers.putItem(server(1L, "REPORTED", "EDGE"));
        servers.putItem(server(2L, "OFFLINE", "EDGE"));
        servers.putItem(server(3L, "ONLINE", "MID"));
    }

    @Test
    @DisplayName("create stores the job, flags edge servers and logs the change")
    void createPersistsEverything() {
        ResponseEntity<ApiResponse<JobResponse>> response = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byXmlId("demo-ds"), "/images/.*\\.png", START, 24));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ApiResponse<JobResponse> body = response.getBody();
        assertNotNull(body);
        assertEquals(1, body.alerts().size());
        assertTrue(body.alerts().get(0).text().startsWith("Invalidation request created for"));
        JobResponse job = body.response();
        assertEquals("http://origin.example.com/images/.*\\.png", job.assetUrl());
        assertEquals("alice", job.createdBy());
        assertEquals("demo-ds", job.deliveryService());
        assertEquals("TTL:24h", job.parameters());
        assertEquals(START, job.startTime());
        assertEquals("/api/jobs?id=" + job.id(), response.getHeaders().getLocation().toString());

        assertEquals(Set.of(RevalidationFlag.UPDATE_PENDING), pending(1L));
        assertTrue(pending(2L).isEmpty());
        assertTrue(pending(3L).isEmpty());

        List<ChangeLogEntry> entries = changeLog.scan().items().stream().toList();
        assertEquals(1, entries.size());
        assertEquals("alice", entries.get(0).getUserName());
        assertTrue(entries.get(0).getMessage().startsWith("Created content invalidation job - ID: " + job.id()));
    }

    @Test
    @DisplayName("overlapping create succeeds with a warning and a duplicate change-log entry")
    void overlappingCreateWarns() {
        controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byId(5L), "/images/", START, 24));

        ApiResponse<JobResponse> body = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byId(5L), "/images/logo.png", START.plusSeconds(3600), 24)).getBody();

        assertNotNull(body);
        assertEquals(2, body.alerts().size());
        assertEquals(Alert.Level.WARNING, body.alerts().get(1).level());
        assertTrue(changeLog.scan().items().stream()
                .anyMatch(entry -> entry.getMessage().startsWith("Created content invalidation job (duplicate)")));
    }

    @Test
    @DisplayName("list honours tenancy and If-Modified-Since")
    void listRespectsTenancyAndCaching() {
        controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byXmlId("demo-ds"), "/a", START, 1));

        ResponseEntity<ApiResponse<List<JobResponse>>> visible = controller.listJobs(ALICE, Map.of(), null);
        assertEquals(HttpStatus.OK, visible.getStatusCode());
        assertEquals(1, visible.getBody().response().size());
        assertEquals(NOW.toEpochMilli(), visible.getHeaders().getLastModified());

        ResponseEntity<ApiResponse<List<JobResponse>>> hidden = controller.listJobs(MALLORY, Map.of(), null);
        assertTrue(hidden.getBody().response().isEmpty());

        ResponseEntity<ApiResponse<List<JobResponse>>> cached = controller.listJobs(
                ALICE, Map.of(), "Tue, 31 Dec 2024 22:00:00 GMT");
        assertEquals(HttpStatus.NOT_MODIFIED, cached.getStatusCode());
        assertNull(cached.getBody());

        ResponseEntity<ApiResponse<List<JobResponse>>> stale = controller.listJobs(
                ALICE, Map.of(), "Tue, 31 Dec 2024 21:00:00 GMT");
        assertEquals(HttpStatus.OK, stale.getStatusCode());
    }

    @Test
    @DisplayName("replace rewrites a job that has not started yet")
    void replaceBeforeStart() {
        JobResponse created = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byXmlId("demo-ds"), "/a", START, 1)).getBody().response();

        ApiResponse<JobResponse> body = controller.replaceJob(ALICE, created.id(), new ReplaceJobHttpRequest(
                created.id(), DeliveryServiceRef.byXmlId("demo-ds"), "alice",
                "http://origin.example.com/b", START.plusSeconds(1800), 6)).getBody();

        assertNotNull(body);
        assertEquals("http://origin.example.com/b", body.response().assetUrl());
        assertEquals("TTL:6h", body.response().parameters());
        assertTrue(changeLog.scan().items().stream()
                .anyMatch(entry -> entry.getMessage().startsWith("Updated content invalidation job")));
    }

    @Test
    @DisplayName("delete removes the job and records a tombstone")
    void deleteRecordsTombstone() {
        JobResponse created = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byXmlId("demo-ds"), "/a", START, 1)).getBody().response();

        ApiResponse<JobResponse> body = controller.deleteJob(ALICE, created.id()).getBody();

        assertNotNull(body);
        assertEquals("Content invalidation job was deleted", body.alerts().get(0).text());
        assertTrue(controller.listJobs(ALICE, Map.of(), null).getBody().response().isEmpty());
        DeletionMarker marker = lastDeleted.getItem(
                Key.builder().partitionValue(InvalidationJobAccess.TABLE_NAME).build());
        assertNotNull(marker);
        assertEquals(NOW.toEpochMilli(), marker.getLastUpdated());
    }

    @Test
    @DisplayName("another tenant cannot see or delete the job")
    void foreignTenantGetsNotFound() {
        JobResponse created = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byXmlId("demo-ds"), "/a", START, 1)).getBody().response();

        PurgeJobsException ex = assertThrows(PurgeJobsException.class,
                () -> controller.deleteJob(MALLORY, created.id()));

        assertEquals(PurgeJobsException.Code.NOT_FOUND, ex.getCode());
        assertFalse(controller.listJobs(ALICE, Map.of(), null).getBody().response().isEmpty());
    }

    private void createTables() {
        LocalStackTables.ensureTable(dynamo, InvalidationJobAccess.TABLE_NAME, "id", ScalarAttributeType.N, null,
                "jobs_by_delivery_service", "delivery_service_id", ScalarAttributeType.N);
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
        LocalStackTables.ensureTable(dynamo, "last_deleted", "table_name", ScalarAttributeType.S);
        LocalStackTables.ensureTable(dynamo, "change_log", "user_name", ScalarAttributeType.S, "ts_ulid",
                null, null, null);
        LocalStackTables.ensureTable(dynamo, "sequences", "name", ScalarAttributeType.S);
        LocalStackTables.ensureTable(dynamo, CdnRevalidation.TABLE_NAME, "cdn_id", ScalarAttributeType.N);
    }

    @Test
    @DisplayName("create succeeds on a CDN with more edge servers than one store transaction can hold")
    void createOnLargeFleet() {
        for (long id = 1000; id < 1120; id++) {
            servers.putItem(server(id, "REPORTED", "EDGE"));
        }

        ResponseEntity<ApiResponse<JobResponse>> response = controller.createJob(ALICE, new CreateJobHttpRequest(
                DeliveryServiceRef.byId(5L), "/fleet/", START, 24));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(Set.of(RevalidationFlag.UPDATE_PENDING), pending(1000L));
        assertEquals(Set.of(RevalidationFlag.UPDATE_PENDING), pending(1119L));
        assertEquals(1, changeLog.scan().items().stream().count());
    }

    private Set<RevalidationFlag> pending(long serverId) {
        return propagator.pendingFlags(servers.getItem(Key.builder().partitionValue(serverId).build()));
    }

    private static Server server(long id, String status, String profile) {
        return Server.builder()
                .id(id)
                .hostName("edge-" + id)
                .cdnId(100L)
                .status(status)
                .profile(profile)
                .build();
    }
}
