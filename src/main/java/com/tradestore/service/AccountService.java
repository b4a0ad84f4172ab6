package com.tradestore.service;

import com.tradestore.domain.model.Account;
import com.tradestore.entity.AccountEntity;
import com.tradestore.exception.ConflictException;
import com.tradestore.exception.ResourceNotFoundException;
import com.tradestore.mapper.AccountMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.AccountJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Account lifecycle: create with a caller-assigned id, read, and overwrite cash/margin state.
 *
 * <p>Accounts are never deleted. Every balance change stamps {@code lastUpdate}. The store does
 * not enforce margin sufficiency; an update that leaves margin used above requirement plus cash
 * is persisted and logged at WARN.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String TABLE = "accounts";

    private final AccountJpaRepository accountJpaRepository;
    private final AccountMapper accountMapper;
    private final RecordMetrics recordMetrics;

    public AccountService(
            AccountJpaRepository accountJpaRepository, AccountMapper accountMapper, RecordMetrics recordMetrics) {
        this.accountJpaRepository = accountJpaRepository;
        this.accountMapper = accountMapper;
        this.recordMetrics = recordMetrics;
    }

    /**
     * Creates an account. Omitted balances default to 0 and createdAt to now.
     *
     * @throws ConflictException if the id is already taken
     */
    @Transactional
    public Account createAccount(Account account) {
        if (accountJpaRepository.existsById(account.getAccountId())) {
            throw new ConflictException(
                    "Account already exists: " + account.getAccountId(), Map.of("accountId", account.getAccountId()));
        }

        AccountEntity entity = accountMapper.toEntity(account);
        entity.setCreatedAt(null);
        entity.setLastUpdate(null);

        AccountEntity saved = accountJpaRepository.save(entity);
        recordMetrics.recordInserted(TABLE, 1);
        log.info("Account created: accountId={}, owner={}", saved.getAccountId(), saved.getOwner());
        return accountMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Account getAccount(Long accountId) {
        return accountMapper.toDomain(findEntity(accountId));
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts() {
        return accountMapper.toDomainList(accountJpaRepository.findAllByOrderByAccountIdAsc());
    }

    /**
     * Overwrites the supplied balance fields. Null arguments leave the column unchanged.
     */
    @Transactional
    public Account updateBalances(Long accountId, Double cashBalance, Double marginRequirement, Double marginUsed) {
        AccountEntity entity = findEntity(accountId);

        if (cashBalance != null) {
            entity.setCashBalance(cashBalance);
        }
        if (marginRequirement != null) {
            entity.setMarginRequirement(marginRequirement);
        }
        if (marginUsed != null) {
            entity.setMarginUsed(marginUsed);
        }
        entity.setLastUpdate(LocalDateTime.now());

        Account updated = accountMapper.toDomain(accountJpaRepository.save(entity));
        warnIfOverextended(updated);
        log.info(
                "Account balances updated: accountId={}, cash={}, marginRequirement={}, marginUsed={}",
                accountId,
                updated.getCashBalance(),
                updated.getMarginRequirement(),
                updated.getMarginUsed());
        return updated;
    }

    /**
     * Adds a signed amount to the cash balance. Joins the caller's transaction so a trade insert
     * and its settlement commit together.
     */
    @Transactional
    public Account adjustCash(Long accountId, double delta, LocalDateTime asOf) {
        AccountEntity entity = findEntity(accountId);
        entity.setCashBalance(entity.getCashBalance() + delta);
        entity.setLastUpdate(asOf != null ? asOf : LocalDateTime.now());

        Account updated = accountMapper.toDomain(accountJpaRepository.save(entity));
        warnIfOverextended(updated);
        log.debug("Account cash adjusted: accountId={}, delta={}, cash={}", accountId, delta, updated.getCashBalance());
        return updated;
    }

    /** Fails with not-found unless the account exists. Used before inserting dependent rows. */
    @Transactional(readOnly = true)
    public void requireExists(Long accountId) {
        if (accountId == null || !accountJpaRepository.existsById(accountId)) {
            throw new ResourceNotFoundException("Account", accountId);
        }
    }

    private AccountEntity findEntity(Long accountId) {
        return accountJpaRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    private void warnIfOverextended(Account account) {
        if (account.isMarginOverextended()) {
            log.warn(
                    "Account margin overextended: accountId={}, marginUsed={}, marginRequirement={}, cash={}",
                    account.getAccountId(),
                    account.getMarginUsed(),
                    account.getMarginRequirement(),
                    account.getCashBalance());
        }
    }
}
