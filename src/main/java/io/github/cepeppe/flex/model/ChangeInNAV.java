package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Variazione del Net Asset Value nel periodo (elemento singolo dentro {@code FlexStatement}).
 */
@FlexElement("ChangeInNAV")
public record ChangeInNAV(
        String accountId,
        String acctAlias,
        String model,
        LocalDate fromDate,
        LocalDate toDate,
        BigDecimal startingValue,
        BigDecimal mtm,
        BigDecimal realized,
        BigDecimal changeInUnrealized,
        BigDecimal costAdjustments,
        BigDecimal transferredPnlAdjustments,
        BigDecimal depositsWithdrawals,
        BigDecimal internalCashTransfers,
        BigDecimal assetTransfers,
        BigDecimal debitCardActivity,
        BigDecimal billPay,
        BigDecimal dividends,
        BigDecimal withholdingTax,
        BigDecimal withholding871m,
        BigDecimal withholdingTaxCollected,
        BigDecimal changeInDividendAccruals,
        BigDecimal interest,
        BigDecimal changeInInterestAccruals,
        BigDecimal advisorFees,
        BigDecimal clientFees,
        BigDecimal otherFees,
        BigDecimal feesReceivables,
        BigDecimal commissions,
        BigDecimal commissionReceivables,
        BigDecimal forexCommissions,
        BigDecimal transactionTax,
        BigDecimal taxReceivables,
        BigDecimal salesTax,
        BigDecimal softDollars,
        BigDecimal netFxTrading,
        BigDecimal fxTranslation,
        BigDecimal linkingAdjustments,
        BigDecimal other,
        BigDecimal endingValue,
        BigDecimal twr,
        BigDecimal corporateActionProceeds
) {
}
