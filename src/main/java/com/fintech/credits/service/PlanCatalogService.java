package com.fintech.credits.service;

import com.fintech.credits.dto.NormalizedEvent;
import com.fintech.credits.dto.PlanQuote;
import com.fintech.credits.entity.PaymentPlan;
import com.fintech.credits.exception.NotFoundException;
import com.fintech.credits.exception.ValidationException;
import com.fintech.credits.repository.PaymentPlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read-only plan catalog: provider price/product to credits per billing cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlanCatalogService {

    private final PaymentPlanRepository repository;

    /**
     * Look a plan up by price id first, then by product id.
     */
    public Optional<PlanQuote> getPlanByPriceOrProductId(String id) {
        if (!StringUtils.hasText(id)) {
            return Optional.empty();
        }
        return repository.findByProviderPriceId(id)
                .or(() -> repository.findFirstByProviderProductIdOrderByActiveDescCreatedAtDesc(id))
                .map(PlanCatalogService::toQuote);
    }

    /**
     * Credits granted for a completed payment. Precedence, first hit wins:
     * <ol>
     *   <li>catalog entry for the event's price id</li>
     *   <li>catalog entry for the event's product id</li>
     *   <li>{@code credits_per_cycle} embedded in product metadata</li>
     * </ol>
     *
     * @throws NotFoundException   if none of the sources knows the plan
     * @throws ValidationException if the matched source grants no credits
     */
    public BigDecimal resolveCredits(NormalizedEvent event) {
        Optional<PlanQuote> plan = getPlanByPriceOrProductId(event.getPriceId())
                .or(() -> getPlanByPriceOrProductId(event.getProductId()));

        int credits;
        if (plan.isPresent()) {
            PlanQuote quote = plan.get();
            if (!quote.isActive()) {
                log.warn("Allocating credits from inactive plan {} ({}) for event {}",
                        quote.getPriceId(), quote.getDisplayName(), event.getEventId());
            }
            credits = quote.getCreditsPerCycle();
        } else if (event.getMetadataCredits() != null) {
            log.info("No catalog plan for price {} / product {}, using metadata credits {}",
                    event.getPriceId(), event.getProductId(), event.getMetadataCredits());
            credits = event.getMetadataCredits();
        } else {
            throw new NotFoundException("Payment plan",
                    "price=" + event.getPriceId() + ", product=" + event.getProductId());
        }

        if (credits <= 0) {
            throw new ValidationException("Plan for event " + event.getEventId() + " grants no credits");
        }
        return BigDecimal.valueOf(credits);
    }

    private static PlanQuote toQuote(PaymentPlan plan) {
        return PlanQuote.builder()
                .priceId(plan.getProviderPriceId())
                .productId(plan.getProviderProductId())
                .displayName(plan.getDisplayName())
                .creditsPerCycle(plan.getCreditsPerCycle())
                .active(Boolean.TRUE.equals(plan.getActive()))
                .build();
    }
}
