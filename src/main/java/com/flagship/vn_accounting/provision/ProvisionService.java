package com.flagship.vn_accounting.provision;

import com.flagship.vn_accounting.money.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Doubtful-receivable provisions (Article 32).
 */
@Service
@Slf4j
public class ProvisionService {

    static final BigDecimal GENERAL_PROVISION_RATE = new BigDecimal("0.01");

    /**
     * Provision per receivable from its own overdue days, summed.
     */
    public ProvisionResult calculateSpecificProvision(List<ReceivableItem> receivables) {
        Money total = Money.zero(Money.VND);
        List<ProvisionResult.ItemProvision> items = new ArrayList<>();
        for (ReceivableItem item : receivables) {
            ProvisionBand band = ProvisionBand.forOverdueDays(item.getOverdueDays()).orElse(null);
            BigDecimal rate = band != null ? band.getRate() : BigDecimal.ZERO;
            Money provision = Money.vnd(item.getAmount().multiply(rate));
            items.add(new ProvisionResult.ItemProvision(item, band, rate, provision));
            total = total.add(provision);
        }
        log.debug("Specific provision over {} receivables: {}", receivables.size(), total);
        return new ProvisionResult(total, List.copyOf(items));
    }

    /**
     * @deprecated the overdue-days argument was never consulted; each item's
     * own overdue days are used. Call {@link #calculateSpecificProvision(List)}.
     */
    @Deprecated
    public ProvisionResult calculateSpecificProvision(List<ReceivableItem> receivables, int overdueDays) {
        return calculateSpecificProvision(receivables);
    }

    /**
     * Flat 1% of total receivables, regardless of aging.
     */
    public Money calculateGeneralProvision(Money totalReceivables) {
        return Money.vnd(totalReceivables.getAmount().multiply(GENERAL_PROVISION_RATE));
    }
}
