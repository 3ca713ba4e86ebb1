package com.nosota.landregistry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.landregistry.api.ActorHeaders;
import com.nosota.landregistry.api.model.ActorRole;
import com.nosota.landregistry.api.model.DocumentType;
import com.nosota.landregistry.api.model.PaymentMethod;
import com.nosota.landregistry.api.model.PaymentStatus;
import com.nosota.landregistry.api.model.PaymentType;
import com.nosota.landregistry.api.model.PropertyType;
import com.nosota.landregistry.api.request.DocumentDecisionRequest;
import com.nosota.landregistry.api.request.InitiatePaymentRequest;
import com.nosota.landregistry.api.request.NotesRequest;
import com.nosota.landregistry.api.request.PaymentStatusUpdateRequest;
import com.nosota.landregistry.api.request.SubmitPropertyRequest;
import com.nosota.landregistry.api.request.UploadDocumentRequest;
import com.nosota.landregistry.api.response.DocumentResponse;
import com.nosota.landregistry.api.response.PaymentResponse;
import com.nosota.landregistry.api.response.PropertyResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Base class of the integration tests: the full application against a PostgreSQL container.
 *
 * <p>Tests are not transactional. Every request commits, so audit entries and notifications
 * are produced exactly as in production. Isolation comes from fresh actor ids and plot numbers.
 */
@SpringBootTest(
        classes = LandRegistryApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@AutoConfigureMockMvc
@Testcontainers
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    // Actor ids are unique per JVM so that tests never see each other's "mine" lists
    private static final AtomicLong actorIdCounter = new AtomicLong(1000);

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    protected static long newActorId() {
        return actorIdCounter.getAndIncrement();
    }

    protected static String newPlotNumber() {
        return "AA-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Adds the actor headers the gateway would forward.
     */
    protected static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, long actorId, ActorRole role) {
        return request
                .header(ActorHeaders.ACTOR_ID, actorId)
                .header(ActorHeaders.ACTOR_ROLE, role.name())
                .contentType(MediaType.APPLICATION_JSON);
    }

    protected String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    protected <T> T read(ResultActions actions, Class<T> type) throws Exception {
        MvcResult result = actions.andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), type);
    }

    protected <T> T read(ResultActions actions, TypeReference<T> type) throws Exception {
        MvcResult result = actions.andReturn();
        return objectMapper.readValue(result.getResponse().getContentAsString(), type);
    }

    protected PropertyResponse submitProperty(long ownerId, String plotNumber, PropertyType type, String area) throws Exception {
        SubmitPropertyRequest request = new SubmitPropertyRequest(plotNumber, "Kebele 07", "Bole",
                9.0054, 38.7636, new BigDecimal(area), type);
        return read(mockMvc.perform(as(post("/api/v1/properties"), ownerId, ActorRole.CITIZEN)
                        .content(json(request)))
                .andExpect(status().isCreated()), PropertyResponse.class);
    }

    protected DocumentResponse uploadDocument(long ownerId, UUID propertyId, DocumentType type) throws Exception {
        UploadDocumentRequest request = new UploadDocumentRequest(type,
                type.name().toLowerCase() + ".pdf", 120_000L, "application/pdf");
        return read(mockMvc.perform(as(post("/api/v1/documents/properties/{propertyId}", propertyId), ownerId, ActorRole.CITIZEN)
                        .content(json(request)))
                .andExpect(status().isCreated()), DocumentResponse.class);
    }

    protected DocumentResponse verifyDocument(long officerId, UUID documentId) throws Exception {
        return read(mockMvc.perform(as(post("/api/v1/documents/{documentId}/verify", documentId), officerId, ActorRole.LAND_OFFICER)
                        .content(json(new DocumentDecisionRequest("checked against the original", false))))
                .andExpect(status().isOk()), DocumentResponse.class);
    }

    /**
     * Initiates a payment and reports it COMPLETED on behalf of the payer.
     */
    protected PaymentResponse payCompleted(long payerId, UUID propertyId, UUID transferId, PaymentType type,
                                           String amount) throws Exception {
        InitiatePaymentRequest request = new InitiatePaymentRequest(propertyId, transferId, new BigDecimal(amount),
                "ETB", type, PaymentMethod.TELEBIRR, null);
        PaymentResponse payment = read(mockMvc.perform(as(post("/api/v1/payments"), payerId, ActorRole.CITIZEN)
                        .content(json(request)))
                .andExpect(status().isCreated()), PaymentResponse.class);

        return read(mockMvc.perform(as(post("/api/v1/payments/{paymentId}/status", payment.id()), payerId, ActorRole.CITIZEN)
                        .content(json(new PaymentStatusUpdateRequest(PaymentStatus.COMPLETED, "TX-" + UUID.randomUUID()))))
                .andExpect(status().isOk()), PaymentResponse.class);
    }

    protected PaymentResponse verifyPayment(long officerId, UUID paymentId) throws Exception {
        return read(mockMvc.perform(as(post("/api/v1/payments/{paymentId}/verify", paymentId), officerId, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("amount matches"))))
                .andExpect(status().isOk()), PaymentResponse.class);
    }

    /**
     * Runs a residential application of 250 m² through documents, fee and approval.
     */
    protected PropertyResponse registerApprovedProperty(long ownerId, long officerId) throws Exception {
        PropertyResponse property = submitProperty(ownerId, newPlotNumber(), PropertyType.RESIDENTIAL, "250");
        for (DocumentType type : new DocumentType[]{DocumentType.TITLE_DEED, DocumentType.ID_CARD, DocumentType.APPLICATION_FORM}) {
            verifyDocument(officerId, uploadDocument(ownerId, property.id(), type).id());
        }
        PaymentResponse payment = payCompleted(ownerId, property.id(), null, PaymentType.REGISTRATION_FEE, "7500");
        verifyPayment(officerId, payment.id());

        return read(mockMvc.perform(as(post("/api/v1/properties/{propertyId}/approve", property.id()), officerId, ActorRole.LAND_OFFICER)
                        .content(json(new NotesRequest("all clear"))))
                .andExpect(status().isOk()), PropertyResponse.class);
    }
}
