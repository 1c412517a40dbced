package com.tazrim.ledger.service;

import com.tazrim.ledger.entity.AccountEntity;
import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.repository.JpaAccountRepository;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final JpaAccountRepository accountRepository;
    private final TransactionTemplate requiresNew;

    public AccountService(JpaAccountRepository accountRepository, PlatformTransactionManager transactionManager) {
        this.accountRepository = accountRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Accounts are keyed by name. The feed kind and currency of the first import win.
     */
    public AccountEntity findOrCreate(String name, FeedKind feedKind, String currency) {
        return accountRepository.findByName(name).orElseGet(() -> create(name, feedKind, currency));
    }

    private AccountEntity create(String name, FeedKind feedKind, String currency) {
        try {
            AccountEntity created = requiresNew.execute(status -> accountRepository.saveAndFlush(
                    new AccountEntity(UUID.randomUUID(), name, feedKind, currency, Instant.now())
            ));
            log.info("Created account '{}' ({})", name, feedKind);
            return created;
        } catch (DataIntegrityViolationException ex) {
            return accountRepository.findByName(name).orElseThrow(() -> ex);
        }
    }
}
