package com.flagship.escrow_engine;

import com.flagship.escrow_engine.ledger.CurrencyCode;
import com.flagship.escrow_engine.ledger.Wallet;
import com.flagship.escrow_engine.ledger.WalletService;
import com.flagship.escrow_engine.persistence.Deadline;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Base for tests that need the real schema. One PostgreSQL container is shared by
 * every test class so the cached Spring context keeps a live database.
 * Requires a running Docker daemon.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
public abstract class AbstractIntegrationTest {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("escrow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    protected WalletService walletService;

    @Autowired
    protected Clock clock;

    protected Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(10), clock);
    }

    /**
     * New USD wallet for a fresh owner, topped up with {@code amount} minor units.
     */
    protected Wallet fundedWallet(UUID ownerId, long amount) {
        Wallet wallet = walletService.createWallet(ownerId, CurrencyCode.USD, deadline());
        if (amount > 0) {
            wallet = walletService.deposit(wallet.getId(), amount, "dep-" + UUID.randomUUID(), deadline());
        }
        return wallet;
    }

    protected Wallet reload(Wallet wallet) {
        return walletService.getWallet(wallet.getId(), deadline());
    }
}
