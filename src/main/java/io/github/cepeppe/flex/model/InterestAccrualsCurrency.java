package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Ratei di interesse per valuta.
 */
@FlexElement("InterestAccrualsCurrency")
public record InterestAccrualsCurrency(
        String accountId,
        String acctAlias,
        String model,
        String currency,
        LocalDate fromDate,
        LocalDate toDate,
        BigDecimal startingAccrualBalance,
        BigDecimal interestAccrued,
        BigDecimal accrualReversal,
        BigDecimal fxTranslation,
        BigDecimal endingAccrualBalance
) {
}
