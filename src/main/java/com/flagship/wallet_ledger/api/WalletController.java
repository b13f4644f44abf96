package com.flagship.wallet_ledger.api;

import com.flagship.wallet_ledger.api.dto.CreateWalletRequest;
import com.flagship.wallet_ledger.api.dto.PageResponse;
import com.flagship.wallet_ledger.api.dto.UpdateWalletLabelRequest;
import com.flagship.wallet_ledger.api.dto.WalletDeactivationResponse;
import com.flagship.wallet_ledger.api.dto.WalletDetailResponse;
import com.flagship.wallet_ledger.api.dto.WalletResponse;
import com.flagship.wallet_ledger.ledger.WalletDeactivation;
import com.flagship.wallet_ledger.orchestration.WalletTransactionOrchestrationService;
import com.flagship.wallet_ledger.shared.PageQuery;
import com.flagship.wallet_ledger.shared.PageResult;
import com.flagship.wallet_ledger.shared.WalletId;
import com.flagship.wallet_ledger.wallet.Wallet;
import com.flagship.wallet_ledger.wallet.WalletDomainService;
import com.flagship.wallet_ledger.wallet.WalletFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for wallet operations.
 *
 * Deleting a wallet deactivates it together with all of its transactions;
 * nothing is physically removed.
 */
@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
@Slf4j
public class WalletController {

    private final WalletDomainService walletService;
    private final WalletTransactionOrchestrationService orchestrationService;

    @Value("${ledger.pagination.default-page-size:20}")
    private int defaultPageSize;

    @PostMapping
    public ResponseEntity<WalletResponse> createWallet(@Valid @RequestBody CreateWalletRequest request) {
        Wallet wallet = walletService.createWallet(request.getLabel());
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletResponse.from(wallet));
    }

    /**
     * Lists wallets.
     *
     * @param isActive  optional active filter (true/false/1/0/yes/no)
     * @param walletIds optional wallet IDs, repeated or comma-separated
     * @param ordering  sort key, one of balance, created_at, updated_at, label; prefix "-" for descending
     */
    @GetMapping
    public ResponseEntity<PageResponse<WalletResponse>> listWallets(
            @RequestParam(value = "is_active", required = false) String isActive,
            @RequestParam(value = "wallet_ids", required = false) List<String> walletIds,
            @RequestParam(value = "page", defaultValue = "1") int page,
            @RequestParam(value = "page_size", required = false) Integer pageSize,
            @RequestParam(value = "ordering", required = false) String ordering) {

        WalletFilter filter = WalletFilter.parse(isActive, walletIds);
        PageQuery pageQuery = PageQuery.of(page, pageSize != null ? pageSize : defaultPageSize, ordering);
        PageResult<Wallet> result = walletService.listWallets(filter, pageQuery);
        return ResponseEntity.ok(PageResponse.from(result, WalletResponse::from));
    }

    @GetMapping("/{id}")
    public ResponseEntity<WalletResponse> getWallet(@PathVariable("id") String id) {
        return ResponseEntity.ok(WalletResponse.from(walletService.getWallet(WalletId.parse(id))));
    }

    @GetMapping("/{id}/transactions")
    public ResponseEntity<WalletDetailResponse> getWalletWithTransactions(@PathVariable("id") String id) {
        return ResponseEntity.ok(WalletDetailResponse.from(
            orchestrationService.getWalletWithTransactions(WalletId.parse(id))));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<WalletResponse> updateWalletLabel(
            @PathVariable("id") String id,
            @Valid @RequestBody UpdateWalletLabelRequest request) {
        Wallet wallet = walletService.updateLabel(WalletId.parse(id), request.getLabel());
        return ResponseEntity.ok(WalletResponse.from(wallet));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<WalletDeactivationResponse> deactivateWallet(@PathVariable("id") String id) {
        WalletDeactivation deactivation = orchestrationService.deactivateWalletWithTransactions(WalletId.parse(id));
        return ResponseEntity.ok(WalletDeactivationResponse.from(deactivation));
    }
}
