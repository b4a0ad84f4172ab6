package com.tradestore.api.controller;

import com.tradestore.api.dto.request.AccountBalanceUpdateRequest;
import com.tradestore.api.dto.request.AccountCreateRequest;
import com.tradestore.api.dto.response.AccountResponse;
import com.tradestore.domain.model.Account;
import com.tradestore.mapper.AccountMapper;
import com.tradestore.service.AccountService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for trading accounts.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST  /api/accounts} -- create an account with a caller-assigned id</li>
 *   <li>{@code GET   /api/accounts} -- list all accounts</li>
 *   <li>{@code GET   /api/accounts/{accountId}} -- get one account</li>
 *   <li>{@code PATCH /api/accounts/{accountId}/balances} -- overwrite cash/margin fields</li>
 * </ul>
 * There is no delete endpoint; accounts are permanent.
 */
@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private final AccountService accountService;
    private final AccountMapper accountMapper;

    public AccountController(AccountService accountService, AccountMapper accountMapper) {
        this.accountService = accountService;
        this.accountMapper = accountMapper;
    }

    @PostMapping
    public ResponseEntity<AccountResponse> create(@RequestBody @Valid AccountCreateRequest request) {
        Account created = accountService.createAccount(accountMapper.toDomain(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(accountMapper.toResponse(created));
    }

    @GetMapping
    public ResponseEntity<List<AccountResponse>> list() {
        return ResponseEntity.ok(accountMapper.toResponseList(accountService.listAccounts()));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> get(@PathVariable Long accountId) {
        return ResponseEntity.ok(accountMapper.toResponse(accountService.getAccount(accountId)));
    }

    @PatchMapping("/{accountId}/balances")
    public ResponseEntity<AccountResponse> updateBalances(
            @PathVariable Long accountId, @RequestBody AccountBalanceUpdateRequest request) {
        Account updated = accountService.updateBalances(
                accountId, request.getCashBalance(), request.getMarginRequirement(), request.getMarginUsed());
        return ResponseEntity.ok(accountMapper.toResponse(updated));
    }
}
