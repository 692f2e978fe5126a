package com.flagship.donation_pipeline.donation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exactly-once recording against a real PostgreSQL unique constraint.
 *
 * Skipped when Docker is not available.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class DonationRecorderPostgresTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("donations_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private DonationRecorder recorder;

    @Autowired
    private DonationPersistenceService persistenceService;

    @Autowired
    private DonationRepository donationRepository;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        donationRepository.deleteAll();
    }

    private static Donation candidate(String transactionId) {
        return Donation.builder()
                .donorName("Devotee")
                .donorEmail("devotee@example.com")
                .amount(new BigDecimal("108.00"))
                .currency("USD")
                .donationType(DonationType.GENERAL)
                .status(DonationStatus.COMPLETED)
                .paymentMethod(Donation.PAYMENT_METHOD_ONLINE)
                .paymentProvider(Donation.PROVIDER_PAYPAL)
                .purpose("General Donation")
                .transactionId(transactionId)
                .metadata(new HashMap<>())
                .donationDate(LocalDate.now())
                .build();
    }

    @Test
    @DisplayName("Second insert with the same transaction id violates the unique constraint")
    void testUniqueConstraint_RejectsDuplicateInsert() {
        persistenceService.insert(candidate("TXN-UNIQ-1").toBuilder().id(UUID.randomUUID()).build());

        assertThrows(DataIntegrityViolationException.class,
                () -> persistenceService.insert(candidate("TXN-UNIQ-1").toBuilder().id(UUID.randomUUID()).build()));
    }

    @Test
    @DisplayName("Concurrent recordings of one transaction resolve to a single donation")
    void testRecordOnce_ConcurrentSameTransaction() throws Exception {
        printTestHeader("Concurrent Recording Race");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger created = new AtomicInteger();
        AtomicInteger errors = new AtomicInteger();
        Set<UUID> donationIds = ConcurrentHashMap.newKeySet();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    RecordedDonation recorded = recorder.recordOnce(candidate("TXN-RACE-1"));
                    donationIds.add(recorded.getDonation().getId());
                    if (recorded.isCreated()) {
                        created.incrementAndGet();
                    }
                } catch (Exception e) {
                    errors.incrementAndGet();
                    e.printStackTrace();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Created", created.get());
        printOutput("Distinct donation ids", donationIds);
        assertEquals(0, errors.get());
        assertEquals(1, created.get());
        assertEquals(1, donationIds.size());
        assertEquals(1, donationRepository.count());
        printSuccess("Exactly one donation recorded");
    }
}
