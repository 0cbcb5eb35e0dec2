package com.fintech.credits.service;

import com.fintech.credits.dto.LedgerConsistencyReport;
import com.fintech.credits.dto.LedgerResult;
import com.fintech.credits.dto.TransactionHistoryPage;
import com.fintech.credits.dto.TransactionResponse;
import com.fintech.credits.entity.CreditTransaction;
import com.fintech.credits.entity.CreditTransactionType;
import com.fintech.credits.entity.UserCreditBalance;
import com.fintech.credits.exception.InsufficientBalanceException;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.CreditTransactionRepository;
import com.fintech.credits.repository.OffsetPageRequest;
import com.fintech.credits.repository.UserCreditBalanceRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Owns the per-(subject, provider) balance and the append-only transaction log.
 * Every balance mutation goes through this service.
 * <p>
 * Key Design Decisions:
 * 1. Locking: mutations take a {@code SELECT ... FOR UPDATE} on the single balance row
 * for (subject, provider); nothing is locked in-process, so replicas serialize correctly
 * 2. Idempotency: allocations are keyed by reference id, usage by idempotency key; both are
 * unique columns, and a constraint violation from a concurrent duplicate becomes a replay
 * 3. Atomicity: the ledger insert and the balance update commit together or not at all,
 * inside a transaction bounded by {@code ledger.transaction-timeout-seconds}
 */
@Service
@Slf4j
public class CreditLedgerService {

    static final int DEFAULT_HISTORY_LIMIT = 20;
    static final int MAX_HISTORY_LIMIT = 100;
    private static final int MONEY_SCALE = 2;

    private final UserCreditBalanceRepository balanceRepository;
    private final CreditTransactionRepository transactionRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate balanceInitTemplate;

    // Metrics
    private Counter allocationCounter;
    private Counter usageCounter;
    private Counter replayCounter;
    private Counter insufficientBalanceCounter;
    private Timer mutationTimer;

    public CreditLedgerService(UserCreditBalanceRepository balanceRepository,
                               CreditTransactionRepository transactionRepository,
                               PlatformTransactionManager transactionManager,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               @Value("${ledger.transaction-timeout-seconds:10}") int transactionTimeoutSeconds) {
        this.balanceRepository = balanceRepository;
        this.transactionRepository = transactionRepository;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(transactionTimeoutSeconds);

        this.balanceInitTemplate = new TransactionTemplate(transactionManager);
        this.balanceInitTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.balanceInitTemplate.setTimeout(transactionTimeoutSeconds);
    }

    @PostConstruct
    public void initMetrics() {
        allocationCounter = Counter.builder("ledger.credits.allocations")
                .description("Credit allocations written to the ledger")
                .register(meterRegistry);

        usageCounter = Counter.builder("ledger.credits.usages")
                .description("Credit usages written to the ledger")
                .register(meterRegistry);

        replayCounter = Counter.builder("ledger.credits.replays")
                .description("Ledger requests answered from an already recorded transaction")
                .register(meterRegistry);

        insufficientBalanceCounter = Counter.builder("ledger.credits.insufficient_balance")
                .description("Usage requests rejected for insufficient balance")
                .register(meterRegistry);

        mutationTimer = Timer.builder("ledger.credits.mutation.duration")
                .description("Time spent in ledger mutation transactions")
                .register(meterRegistry);
    }

    /**
     * Current balance for (subject, provider). Never fails on absence: a pair without a
     * row has a zero balance.
     */
    public UserCreditBalance getBalance(UUID subjectId, String provider) {
        validateOwner(subjectId, provider);
        return balanceRepository.findBySubjectIdAndProvider(subjectId, provider)
                .orElseGet(() -> UserCreditBalance.empty(subjectId, provider));
    }

    /**
     * Add credits.
     * <p>
     * With a non-empty {@code referenceId} the call is idempotent: a reference already present
     * in the ledger returns the recorded transaction and the current balance with
     * {@code replayed = true}, and writes nothing.
     *
     * @throws ValidationException the reference was recorded for a different subject or provider
     *
     * @param subjectId   subject to credit
     * @param provider    ledger provider tag
     * @param amount      strictly positive, at most two decimal places
     * @param description stored on the ledger entry
     * @param referenceId optional idempotency key, e.g. {@code stripe:in_123}
     */
    public LedgerResult allocateCredits(UUID subjectId, String provider, BigDecimal amount,
                                        String description, String referenceId) {
        validateOwner(subjectId, provider);
        BigDecimal credits = validateAmount(amount);
        String reference = StringUtils.hasText(referenceId) ? referenceId.trim() : null;

        if (reference != null) {
            Optional<CreditTransaction> existing = transactionRepository.findByReferenceId(reference);
            if (existing.isPresent()) {
                checkReferenceOwner(existing.get(), subjectId, provider);
                log.info("Allocation with reference {} already recorded, replaying", reference);
                return replay(existing.get());
            }
        }

        ensureBalanceRow(subjectId, provider);

        try {
            return mutationTimer.record(() -> transactionTemplate.execute(status ->
                    doAllocate(subjectId, provider, credits, description, reference)));
        } catch (DataIntegrityViolationException e) {
            if (reference == null) {
                throw e;
            }
            // lost the race against a concurrent allocation with the same reference
            log.info("Concurrent allocation with reference {} detected, replaying", reference);
            CreditTransaction existing = transactionRepository.findByReferenceId(reference)
                    .orElseThrow(() -> e);
            checkReferenceOwner(existing, subjectId, provider);
            return replay(existing);
        }
    }

    private LedgerResult doAllocate(UUID subjectId, String provider, BigDecimal amount,
                                    String description, String reference) {
        UserCreditBalance balance = lockBalance(subjectId, provider);

        if (reference != null) {
            Optional<CreditTransaction> existing = transactionRepository.findByReferenceId(reference);
            if (existing.isPresent()) {
                checkReferenceOwner(existing.get(), subjectId, provider);
                replayCounter.increment();
                return LedgerResult.builder()
                        .balance(balance)
                        .transaction(existing.get())
                        .replayed(true)
                        .build();
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal newBalance = balance.getCurrentBalance().add(amount);

        CreditTransaction transaction = transactionRepository.saveAndFlush(CreditTransaction.builder()
                .subjectId(subjectId)
                .provider(provider)
                .type(CreditTransactionType.ALLOCATION)
                .amount(amount)
                .balanceAfter(newBalance)
                .description(description(description, "Credit allocation"))
                .referenceId(reference)
                .createdAt(now)
                .build());

        balance.setCurrentBalance(newBalance);
        balance.setLastTransactionAt(now);
        UserCreditBalance saved = balanceRepository.save(balance);

        allocationCounter.increment();
        log.info("Allocated {} credits to subject {} provider {} (reference {}), balance now {}",
                amount, subjectId, provider, reference, newBalance);

        return LedgerResult.builder()
                .balance(saved)
                .transaction(transaction)
                .replayed(false)
                .build();
    }

    /**
     * Debit credits.
     *
     * @throws NotFoundException            the subject has no balance row for this provider
     * @throws InsufficientBalanceException the balance is below {@code amount}; nothing is written
     */
    public LedgerResult useCredits(UUID subjectId, String provider, BigDecimal amount,
                                   String description, String featureName, UUID idempotencyKey) {
        validateOwner(subjectId, provider);
        BigDecimal credits = validateAmount(amount);

        if (idempotencyKey != null) {
            Optional<CreditTransaction> existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                checkKeyOwner(existing.get(), subjectId, provider);
                log.info("Usage with idempotency key {} already recorded, replaying", idempotencyKey);
                return replay(existing.get());
            }
        }

        try {
            return mutationTimer.record(() -> transactionTemplate.execute(status ->
                    doUse(subjectId, provider, credits, description, featureName, idempotencyKey)));
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey == null) {
                throw e;
            }
            log.info("Concurrent usage with idempotency key {} detected, replaying", idempotencyKey);
            CreditTransaction existing = transactionRepository.findByIdempotencyKey(idempotencyKey)
                    .orElseThrow(() -> e);
            checkKeyOwner(existing, subjectId, provider);
            return replay(existing);
        }
    }

    public LedgerResult useCredits(UUID subjectId, String provider, BigDecimal amount,
                                   String description, String featureName) {
        return useCredits(subjectId, provider, amount, description, featureName, null);
    }

    private LedgerResult doUse(UUID subjectId, String provider, BigDecimal amount, String description,
                               String featureName, UUID idempotencyKey) {
        UserCreditBalance balance = lockBalance(subjectId, provider);

        if (idempotencyKey != null) {
            Optional<CreditTransaction> existing = transactionRepository.findByIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                checkKeyOwner(existing.get(), subjectId, provider);
                replayCounter.increment();
                return LedgerResult.builder()
                        .balance(balance)
                        .transaction(existing.get())
                        .replayed(true)
                        .build();
            }
        }

        BigDecimal current = balance.getCurrentBalance();
        if (current.compareTo(amount) < 0) {
            insufficientBalanceCounter.increment();
            log.warn("Rejected usage of {} credits by subject {} provider {}: only {} available",
                    amount, subjectId, provider, current);
            throw new InsufficientBalanceException(amount, current);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        BigDecimal newBalance = current.subtract(amount);

        CreditTransaction transaction = transactionRepository.saveAndFlush(CreditTransaction.builder()
                .subjectId(subjectId)
                .provider(provider)
                .type(CreditTransactionType.USAGE)
                .amount(amount.negate())
                .balanceAfter(newBalance)
                .description(description(description, "Credit usage"))
                .featureName(featureName)
                .idempotencyKey(idempotencyKey)
                .createdAt(now)
                .build());

        balance.setCurrentBalance(newBalance);
        balance.setLastTransactionAt(now);
        UserCreditBalance saved = balanceRepository.save(balance);

        usageCounter.increment();
        log.info("Subject {} used {} credits on provider {} for feature {}, balance now {}",
                subjectId, amount, provider, featureName, newBalance);

        return LedgerResult.builder()
                .balance(saved)
                .transaction(transaction)
                .replayed(false)
                .build();
    }

    /**
     * Drive a balance to exactly zero with a SUBSCRIPTION_CANCELLATION entry of {@code -balance}.
     * Must run inside the caller's transaction so that it commits together with the
     * subscription status change.
     *
     * @return the written entry, or empty when the balance is absent or not positive
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CreditTransaction> drainBalance(UUID subjectId, String provider,
                                                    String description, Long subscriptionId) {
        validateOwner(subjectId, provider);

        Optional<UserCreditBalance> locked = balanceRepository.findForUpdate(subjectId, provider);
        if (locked.isEmpty()) {
            log.info("No balance row for subject {} provider {}, nothing to reset", subjectId, provider);
            return Optional.empty();
        }

        UserCreditBalance balance = locked.get();
        BigDecimal current = balance.getCurrentBalance();
        if (current.signum() <= 0) {
            log.info("Balance for subject {} provider {} is already {}, nothing to reset",
                    subjectId, provider, current);
            return Optional.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        CreditTransaction transaction = transactionRepository.saveAndFlush(CreditTransaction.builder()
                .subjectId(subjectId)
                .provider(provider)
                .type(CreditTransactionType.SUBSCRIPTION_CANCELLATION)
                .amount(current.negate())
                .balanceAfter(BigDecimal.ZERO.setScale(MONEY_SCALE))
                .description(description(description, "Subscription canceled"))
                .subscriptionId(subscriptionId)
                .createdAt(now)
                .build());

        balance.setCurrentBalance(BigDecimal.ZERO.setScale(MONEY_SCALE));
        balance.setLastTransactionAt(now);
        balanceRepository.save(balance);

        log.info("Reset balance of subject {} provider {} from {} to 0", subjectId, provider, current);
        return Optional.of(transaction);
    }

    /**
     * Ledger entries for the subject across all providers, most recent first.
     */
    public List<CreditTransaction> getTransactionHistory(UUID subjectId, int limit, int offset) {
        return findHistory(subjectId, null, null, limit, offset);
    }

    /**
     * Filtered history window with paging metadata. {@code provider} and {@code type}
     * are optional. Limit defaults to 20 and is capped at 100; a negative offset reads as 0.
     */
    @Transactional(readOnly = true)
    public TransactionHistoryPage getTransactionHistoryPage(UUID subjectId, String provider,
                                                            CreditTransactionType type,
                                                            int limit, int offset) {
        String providerFilter = StringUtils.hasText(provider) ? provider : null;
        int effectiveLimit = normalizeLimit(limit);
        int effectiveOffset = Math.max(0, offset);

        List<CreditTransaction> transactions =
                findHistory(subjectId, providerFilter, type, effectiveLimit, effectiveOffset);
        long total = transactionRepository.countHistory(subjectId, providerFilter, type);

        return TransactionHistoryPage.builder()
                .transactions(transactions.stream()
                        .map(TransactionResponse::from)
                        .collect(Collectors.toList()))
                .total(total)
                .limit(effectiveLimit)
                .offset(effectiveOffset)
                .hasMore(effectiveOffset + transactions.size() < total)
                .build();
    }

    private List<CreditTransaction> findHistory(UUID subjectId, String provider, CreditTransactionType type,
                                                int limit, int offset) {
        if (subjectId == null) {
            throw new ValidationException("Subject id is required");
        }
        return transactionRepository.findHistory(subjectId, provider, type,
                new OffsetPageRequest(Math.max(0, offset), normalizeLimit(limit)));
    }

    /**
     * Compare the cached balance with the sum of its ledger entries and the last
     * {@code balanceAfter} snapshot.
     */
    @Transactional(readOnly = true)
    public LedgerConsistencyReport verifyConsistency(UUID subjectId, String provider) {
        UserCreditBalance balance = getBalance(subjectId, provider);
        BigDecimal ledgerSum = transactionRepository.sumAmount(subjectId, provider);
        BigDecimal lastBalanceAfter = transactionRepository
                .findFirstBySubjectIdAndProviderOrderByCreatedAtDescIdDesc(subjectId, provider)
                .map(CreditTransaction::getBalanceAfter)
                .orElse(BigDecimal.ZERO);

        boolean consistent = ledgerSum.compareTo(balance.getCurrentBalance()) == 0
                && lastBalanceAfter.compareTo(balance.getCurrentBalance()) == 0;

        if (!consistent) {
            log.error("Ledger inconsistency for subject {} provider {}: cached {}, ledger sum {}, last snapshot {}",
                    subjectId, provider, balance.getCurrentBalance(), ledgerSum, lastBalanceAfter);
        }

        return LedgerConsistencyReport.builder()
                .subjectId(subjectId)
                .provider(provider)
                .cachedBalance(balance.getCurrentBalance())
                .ledgerSum(ledgerSum)
                .lastBalanceAfter(lastBalanceAfter)
                .transactionCount(transactionRepository.countBySubjectIdAndProvider(subjectId, provider))
                .consistent(consistent)
                .build();
    }

    /**
     * Create the zero row in its own short transaction so that the mutation transaction
     * always has a row to lock. A concurrent insert of the same row is tolerated.
     */
    private void ensureBalanceRow(UUID subjectId, String provider) {
        if (balanceRepository.findBySubjectIdAndProvider(subjectId, provider).isPresent()) {
            return;
        }
        try {
            balanceInitTemplate.executeWithoutResult(status ->
                    balanceRepository.saveAndFlush(UserCreditBalance.builder()
                            .subjectId(subjectId)
                            .provider(provider)
                            .currentBalance(BigDecimal.ZERO.setScale(MONEY_SCALE))
                            .build()));
            log.debug("Created balance row for subject {} provider {}", subjectId, provider);
        } catch (DataIntegrityViolationException e) {
            log.debug("Balance row for subject {} provider {} was created concurrently", subjectId, provider);
        }
    }

    private UserCreditBalance lockBalance(UUID subjectId, String provider) {
        return balanceRepository.findForUpdate(subjectId, provider)
                .orElseThrow(() -> new NotFoundException("Credit balance", subjectId + "/" + provider));
    }

    private LedgerResult replay(CreditTransaction existing) {
        replayCounter.increment();
        return LedgerResult.builder()
                .balance(getBalance(existing.getSubjectId(), existing.getProvider()))
                .transaction(existing)
                .replayed(true)
                .build();
    }

    private void checkKeyOwner(CreditTransaction existing, UUID subjectId, String provider) {
        if (!ownedBy(existing, subjectId, provider)) {
            throw new ValidationException("Idempotency key " + existing.getIdempotencyKey()
                    + " was already used by a different subject or provider");
        }
    }

    private void checkReferenceOwner(CreditTransaction existing, UUID subjectId, String provider) {
        if (!ownedBy(existing, subjectId, provider)) {
            log.warn("Reference {} belongs to subject {} provider {}, rejected for subject {} provider {}",
                    existing.getReferenceId(), existing.getSubjectId(), existing.getProvider(), subjectId, provider);
            throw new ValidationException("Reference " + existing.getReferenceId()
                    + " was already used by a different subject or provider");
        }
    }

    private static boolean ownedBy(CreditTransaction existing, UUID subjectId, String provider) {
        return existing.getSubjectId().equals(subjectId) && existing.getProvider().equals(provider);
    }

    private void validateOwner(UUID subjectId, String provider) {
        if (subjectId == null) {
            throw new ValidationException("Subject id is required");
        }
        if (!StringUtils.hasText(provider)) {
            throw new ValidationException("Provider is required");
        }
    }

    private BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("Amount must be greater than zero");
        }
        if (amount.stripTrailingZeros().scale() > MONEY_SCALE) {
            throw new ValidationException("Amount must have at most " + MONEY_SCALE + " decimal places");
        }
        return amount.setScale(MONEY_SCALE);
    }

    private static int normalizeLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_HISTORY_LIMIT;
        }
        return Math.min(limit, MAX_HISTORY_LIMIT);
    }

    private static String description(String description, String fallback) {
        return StringUtils.hasText(description) ? description : fallback;
    }
}
