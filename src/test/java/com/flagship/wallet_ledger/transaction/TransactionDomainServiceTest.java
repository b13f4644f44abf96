package com.flagship.wallet_ledger.transaction;

import com.flagship.wallet_ledger.ledger.LedgerStore;
import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.TransactionId;
import com.flagship.wallet_ledger.shared.TxId;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.shared.exception.TransactionNotFoundException;
import com.flagship.wallet_ledger.shared.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests txid allocation against a store that reports collisions.
 */
@ExtendWith(MockitoExtension.class)
class TransactionDomainServiceTest {

    private static final long NOW_MILLIS = 1_700_000_000_000L;

    @Mock
    private LedgerStore store;

    private TransactionDomainService service;

    private final WalletId walletId = WalletId.newId();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW_MILLIS), ZoneOffset.UTC);
        service = new TransactionDomainService(store, 10, 100, clock, new Random(42));
    }

    @Test
    @DisplayName("txid has the form tx_<epochMillis>_<4 digits>")
    void testTxIdFormat() {
        when(store.transactionExistsByTxId(any())).thenReturn(false);

        Transaction transaction = service.createTransaction(walletId, Money.of(500));

        assertTrue(transaction.getTxid().getValue().matches("tx_" + NOW_MILLIS + "_[1-9][0-9]{3}"),
            "Unexpected txid " + transaction.getTxid());
        assertEquals(walletId, transaction.getWalletId());
        assertTrue(transaction.isActive());
        assertEquals(Money.of(500), transaction.getAmount());
    }

    @Test
    @DisplayName("Collisions regenerate the suffix until the store reports a free id")
    void testRetriesOnCollision() {
        when(store.transactionExistsByTxId(any())).thenReturn(true, true, true, false);

        Transaction transaction = service.createTransaction(walletId, Money.of(-200));

        ArgumentCaptor<TxId> checked = ArgumentCaptor.forClass(TxId.class);
        verify(store, times(4)).transactionExistsByTxId(checked.capture());
        assertEquals(checked.getAllValues().get(3), transaction.getTxid());
        assertTrue(transaction.getTxid().getValue().startsWith("tx_" + NOW_MILLIS + "_"));
    }

    @Test
    @DisplayName("After 10 collisions a random 16-hex-character id is used")
    void testFallbackAfterMaxAttempts() {
        when(store.transactionExistsByTxId(any())).thenReturn(true);

        Transaction transaction = service.createTransaction(walletId, Money.of(1));

        verify(store, times(10)).transactionExistsByTxId(any());
        assertTrue(transaction.getTxid().getValue().matches("tx_[0-9a-f]{16}"),
            "Unexpected fallback txid " + transaction.getTxid());
    }

    @Test
    @DisplayName("Ids handed out are never repeated when the store knows every issued id")
    void testNoDuplicatesUnderCollisions() {
        Set<TxId> issued = new HashSet<>();
        when(store.transactionExistsByTxId(any())).thenAnswer(inv -> issued.contains(inv.getArgument(0)));

        for (int i = 0; i < 200; i++) {
            TxId txid = service.createTransaction(walletId, Money.of(i + 1)).getTxid();
            assertTrue(issued.add(txid), "Duplicate txid " + txid);
        }
    }

    @Test
    @DisplayName("Zero amount is rejected before any id is allocated")
    void testZeroAmount() {
        assertThrows(ValidationException.class, () -> service.createTransaction(walletId, Money.ZERO));
        verify(store, times(0)).transactionExistsByTxId(any());
    }

    @Test
    @DisplayName("Lookup by txid only returns active transactions")
    void testGetByTxIdNotFound() {
        when(store.findActiveTransactionByTxId(TxId.of("tx_missing"))).thenReturn(Optional.empty());

        TransactionNotFoundException e = assertThrows(TransactionNotFoundException.class,
            () -> service.getTransactionByTxId("tx_missing"));
        assertEquals("tx_missing", e.getReference());
    }

    @Test
    @DisplayName("Listing clamps the page size to the configured maximum")
    void testListClampsPageSize() {
        TransactionFilter filter = TransactionFilter.all();

        service.listTransactions(filter, PageQuery.of(1, 1000));

        verify(store).findTransactions(eq(filter), eq(PageQuery.of(1, 100)));
    }

    @Test
    @DisplayName("getTransactionsByWalletIds returns the active transactions of all wallets")
    void testGetTransactionsByWalletIds() {
        WalletId other = WalletId.newId();
        Transaction mine = Transaction.create(TransactionId.newId(), walletId, TxId.of("tx_1_1111"), Money.of(10));
        Transaction theirs = Transaction.create(TransactionId.newId(), other, TxId.of("tx_1_2222"), Money.of(-5));
        when(store.findActiveTransactionsByWalletIds(List.of(walletId, other))).thenReturn(List.of(mine, theirs));

        List<Transaction> transactions = service.getTransactionsByWalletIds(List.of(walletId, other));

        assertEquals(List.of(mine, theirs), transactions);
    }

    @Test
    @DisplayName("existsByTxId asks the store about the exact txid")
    void testExistsByTxId() {
        when(store.transactionExistsByTxId(TxId.of("tx_1_1234"))).thenReturn(true);
        when(store.transactionExistsByTxId(TxId.of("tx_1_9999"))).thenReturn(false);

        assertTrue(service.existsByTxId("tx_1_1234"));
        assertFalse(service.existsByTxId("tx_1_9999"));
    }
}
