package com.flagship.tool_ledger.custody;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.tool_ledger.batch.dto.OpenBatchRequest;
import com.flagship.tool_ledger.batch.dto.ScanRequest;
import com.flagship.tool_ledger.batch.dto.SubmitBatchRequest;
import com.flagship.tool_ledger.custody.dto.CheckinRequest;
import com.flagship.tool_ledger.custody.dto.CheckoutRequest;
import com.flagship.tool_ledger.custody.dto.QuantityRequest;
import com.flagship.tool_ledger.inventory.StaffRole;
import com.flagship.tool_ledger.inventory.dto.RegisterConsumableRequest;
import com.flagship.tool_ledger.inventory.dto.RegisterStaffRequest;
import com.flagship.tool_ledger.inventory.dto.RegisterToolRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end REST tests against PostgreSQL and Redis:
 * - Checkout, re-checkout and checkin through the API with the documented status codes
 * - Idempotency-Key replays the first outcome
 * - Consumable usage and restock
 * - Batch sessions with partial failure
 * - History queries over what the API wrote
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class CustodyControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("tool_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
    }

    private static final AtomicInteger CODES = new AtomicInteger(1000);

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private String adminUid;
    private String workerUid;

    @BeforeEach
    void setUp() throws Exception {
        adminUid = registerStaff("Ada Admin", StaffRole.ADMIN);
        workerUid = registerStaff("Wes Worker", StaffRole.WORKER);
    }

    @Test
    @DisplayName("Checkout, re-checkout and checkin of one tool")
    void checkoutLifecycle() throws Exception {
        String code = registerTool();

        postJson("/api/tools/" + code + "/checkout", checkout(workerUid))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.action").value("checkout"))
            .andExpect(jsonPath("$.unique_id").value(code))
            .andExpect(jsonPath("$.staff_uid").value(workerUid))
            .andExpect(jsonPath("$.committed_at").exists());

        mockMvc.perform(get("/api/tools/" + code))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("checked_out"))
            .andExpect(jsonPath("$.current_holder_uid").value(workerUid))
            .andExpect(jsonPath("$.last_assigned_to_name").value("Wes Worker"));

        postJson("/api/tools/" + code + "/checkout", checkout(workerUid))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("PRECONDITION_FAILED"))
            .andExpect(jsonPath("$.details.kind").value("ALREADY_CHECKED_OUT"));

        postJson("/api/tools/" + code + "/checkin", CheckinRequest.builder().actingStaffUid(adminUid).build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.action").value("checkin"));

        mockMvc.perform(get("/api/tools/" + code))
            .andExpect(jsonPath("$.status").value("available"))
            .andExpect(jsonPath("$.last_checkin_by_name").value("Wes Worker"));

        JsonNode history = readJson(mockMvc.perform(get("/api/history/items/" + code)
                .param("end", Instant.now().plus(1, ChronoUnit.MINUTES).toString()))
            .andExpect(status().isOk()));
        assertEquals(2, history.size());
        assertEquals("checkin", history.get(0).get("action").asText());
        assertEquals("checkout", history.get(1).get("action").asText());
    }

    @Test
    @DisplayName("A repeated request with the same Idempotency-Key replays the first outcome")
    void idempotentCheckout() throws Exception {
        String code = registerTool();
        String key = UUID.randomUUID().toString();
        String body = objectMapper.writeValueAsString(checkout(workerUid));

        JsonNode first = readJson(mockMvc.perform(post("/api/tools/" + code + "/checkout")
                .header(CustodyController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk()));
        JsonNode second = readJson(mockMvc.perform(post("/api/tools/" + code + "/checkout")
                .header(CustodyController.IDEMPOTENCY_KEY_HEADER, key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk()));

        assertEquals(first.get("entry_id").asText(), second.get("entry_id").asText());
        assertEquals(first.get("committed_at").asText(), second.get("committed_at").asText());
        assertNotNull(redisTemplate.opsForValue().get("tool-ledger:idempotency:" + key));
    }

    @Test
    @DisplayName("Unknown items give 404, invalid bodies 400")
    void errorMapping() throws Exception {
        postJson("/api/tools/T404404/checkout", checkout(workerUid))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.kind").value("ITEM_NOT_FOUND"));

        postJson("/api/tools/" + registerTool() + "/checkout", CheckoutRequest.builder().actingStaffUid(adminUid).build())
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.details.staffUid").exists());

        postJson("/api/tools/" + registerTool() + "/checkout", checkout("no-such-staff"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.details.kind").value("STAFF_NOT_FOUND"));

        mockMvc.perform(get("/api/history/items/T404404"))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Usage and restock move consumable stock")
    void consumableStock() throws Exception {
        String code = "C" + CODES.incrementAndGet();
        postJson("/api/consumables", RegisterConsumableRequest.builder()
                .uniqueId(code).name("Screws").unit("box")
                .initialQuantity(new BigDecimal("10")).minQuantity(new BigDecimal("2")).build())
            .andExpect(status().isCreated());

        postJson("/api/consumables/" + code + "/usage", QuantityRequest.builder()
                .quantity(new BigDecimal("9")).actingStaffUid(adminUid).usedByUid(workerUid).build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.quantity_after").value(1));

        postJson("/api/consumables/" + code + "/usage", QuantityRequest.builder()
                .quantity(new BigDecimal("5")).actingStaffUid(adminUid).build())
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.details.kind").value("INSUFFICIENT_QUANTITY"));

        mockMvc.perform(get("/api/consumables").param("low_stock", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.unique_id == '" + code + "')]").exists());

        postJson("/api/consumables/" + code + "/restock", QuantityRequest.builder()
                .quantity(new BigDecimal("20")).actingStaffUid(adminUid).build())
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.quantity_after").value(21));
    }

    @Test
    @DisplayName("A batch with one tool taken elsewhere reports a partial failure")
    void batchPartialFailure() throws Exception {
        String first = registerTool();
        String second = registerTool();
        String third = registerTool();
        String otherUid = registerStaff("Olga Other", StaffRole.WORKER);

        JsonNode session = readJson(postJson("/api/batches", OpenBatchRequest.builder().actingStaffUid(adminUid).build())
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.state").value("EMPTY")));
        String sessionId = session.get("session_id").asText();

        for (String code : new String[] {first, "TOOL#" + second, third}) {
            postJson("/api/batches/" + sessionId + "/items", ScanRequest.builder().code(code).build())
                .andExpect(status().isOk());
        }
        postJson("/api/batches/" + sessionId + "/items", ScanRequest.builder().code(first).build())
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.details.reason").value("ALREADY_IN_BATCH"));

        postJson("/api/tools/" + second + "/checkout", checkout(otherUid)).andExpect(status().isOk());

        JsonNode report = readJson(postJson("/api/batches/" + sessionId + "/submit",
                SubmitBatchRequest.builder().targetStaffUid(workerUid).build())
            .andExpect(status().isOk()));

        assertEquals(2, report.get("successCount").asInt());
        assertEquals(1, report.get("failureCount").asInt());
        assertEquals(second, report.get("outcomes").get(1).get("uniqueId").asText());
        assertEquals("ALREADY_CHECKED_OUT", report.get("outcomes").get(1).get("errorKind").asText());
        String batchId = report.get("batchId").asText();
        assertTrue(batchId.startsWith("BATCH_"));

        mockMvc.perform(get("/api/batches/" + sessionId))
            .andExpect(jsonPath("$.items.length()").value(1))
            .andExpect(jsonPath("$.items[0].unique_id").value(second));

        JsonNode entries = readJson(mockMvc.perform(get("/api/history/batches/" + batchId)
                .param("end", Instant.now().plus(1, ChronoUnit.MINUTES).toString()))
            .andExpect(status().isOk()));
        assertEquals(2, entries.size());

        mockMvc.perform(delete("/api/batches/" + sessionId)).andExpect(status().isNoContent());
        mockMvc.perform(get("/api/batches/" + sessionId)).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Tools held by a staff member follow checkouts")
    void toolsHeldByStaff() throws Exception {
        String code = registerTool();
        postJson("/api/tools/" + code + "/checkout", checkout(workerUid)).andExpect(status().isOk());

        mockMvc.perform(get("/api/staff/" + workerUid + "/tools"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].unique_id").value(code));
    }

    private CheckoutRequest checkout(String staffUid) {
        return CheckoutRequest.builder().staffUid(staffUid).actingStaffUid(adminUid).build();
    }

    private String registerTool() throws Exception {
        String code = "T" + CODES.incrementAndGet() + UUID.randomUUID().toString().substring(0, 4).toUpperCase();
        postJson("/api/tools", RegisterToolRequest.builder().uniqueId(code).name("Drill").brand("Makita").build())
            .andExpect(status().isCreated());
        return code;
    }

    private String registerStaff(String name, StaffRole role) throws Exception {
        JsonNode staff = readJson(postJson("/api/staff", RegisterStaffRequest.builder()
                .fullName(name).jobCode("J" + CODES.incrementAndGet()).role(role).build())
            .andExpect(status().isCreated()));
        return staff.get("uid").asText();
    }

    private ResultActions postJson(String path, Object body) throws Exception {
        return mockMvc.perform(post(path)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }

    private JsonNode readJson(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }
}
