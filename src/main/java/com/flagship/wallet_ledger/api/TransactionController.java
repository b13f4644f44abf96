package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.CreateTransactionRequest;
import com.flagship.wallet_ledger.api.dto.PageResponse;
import com.flagship.wallet_ledger.api.dto.TransactionPostingResponse;
import com.flagship.wallet_ledger.api.dto.TransactionResponse;
import com.flagship.wallet_ledger.ledger.TransactionPosting;
import com.flagship.wallet_ledger.orchestration.WalletTransactionOrchestrationService;
import com.flagship.wallet_ledger.shared.Money;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.transaction.Transaction;
import com.flagship.wallet_ledger.transaction.TransactionDomainService;
import com.flagship.wallet_ledger.transaction.TransactionFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for transaction operations.
 */
@RestController
@RequestMapping("/api/v1/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionDomainService transactionService;
    private final WalletTransactionOrchestrationService orchestrationService;

    @Value("${ledger.pagination.default-page-size:20}")
    private int defaultPageSize;

    /**
     * Posts a transaction and updates the wallet balance atomically.
     */
    @PostMapping
    public ResponseEntity<TransactionPostingResponse> createTransaction(
            @Valid @RequestBody CreateTransactionRequest request) {
        TransactionPosting posting = orchestrationService.createTransactionWithBalanceUpdate(
            WalletId.of(request.getWalletId()), Money.of(request.getAmount()));
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionPostingResponse.from(posting));
    }

    /**
     * Lists transactions.
     *
     * @param ordering sort key, one of created_at, updated_at, amount, txid; prefix "-" for descending
     */
    @GetMapping
    public ResponseEntity<PageResponse<TransactionResponse>> listTransactions(
            @RequestParam(value = "is_active", required = false) String isActive,
            @RequestParam(value = "wallet_ids", required = false) List<String> walletIds,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "page_size", required = false) Integer pageSize,
            @RequestParam(value = "ordering", required = false) String ordering) {

        TransactionFilter filter = TransactionFilter.parse(isActive, walletIds);
        PageQuery pageQuery = PageQuery.of(page, pageSize != null ? pageSize : defaultPageSize, ordering);
        PageResult<Transaction> result = transactionService.listTransactions(filter, pageQuery);
        return ResponseEntity.ok(PageResponse.from(result, TransactionResponse::from));
    }

    @GetMapping("/{txid}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("txid") String txid) {
        return ResponseEntity.ok(TransactionResponse.from(transactionService.getTransactionByTxId(txid)));
    }
}
