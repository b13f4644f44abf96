package com.flagship.wallet_ledger.config;

import com.flagship.wallet_ledger.ledger.JpaLedgerStore;
import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.ledger.TransactionRepository;
import com.flagship.wallet_ledger.ledger.WalletRepository;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.orchestration.WalletTransactionOrchestrationService;
import com.flagship.wallet_ledger.transaction.TransactionDomainService;
import com.flagship.wallet_ledger.wallet.WalletDomainService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Wires the ledger core: store first, then the domain services, then the
 * orchestration service. Each is constructed with its collaborators passed
 * explicitly.
 */
@Configuration
public class LedgerConfig {

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry registry) {
        return new LedgerMetrics(registry);
    }

    @Bean
    public LedgerStore ledgerStore(WalletRepository walletRepository,
                                   TransactionRepository transactionRepository,
                                   JdbcTemplate jdbcTemplate,
                                   @Value("${ledger.store.lock-timeout:5s}") Duration lockTimeout) {
        return new JpaLedgerStore(walletRepository, transactionRepository, jdbcTemplate, lockTimeout);
    }

    @Bean
    public WalletDomainService walletDomainService(LedgerStore ledgerStore,
                                                   LedgerMetrics ledgerMetrics,
                                                   @Value("${ledger.pagination.max-page-size:100}") int maxPageSize) {
        return new WalletDomainService(ledgerStore, ledgerMetrics, maxPageSize);
    }

    @Bean
    public TransactionDomainService transactionDomainService(LedgerStore ledgerStore,
                                                             @Value("${ledger.txid.max-attempts:10}") int maxTxIdAttempts,
                                                             @Value("${ledger.pagination.max-page-size:100}") int maxPageSize) {
        return new TransactionDomainService(ledgerStore, maxTxIdAttempts, maxPageSize);
    }

    @Bean
    public WalletTransactionOrchestrationService walletTransactionOrchestrationService(
            WalletDomainService walletDomainService,
            TransactionDomainService transactionDomainService,
            LedgerStore ledgerStore,
            LedgerMetrics ledgerMetrics) {
        return new WalletTransactionOrchestrationService(
            walletDomainService, transactionDomainService, ledgerStore, ledgerMetrics);
    }
}
