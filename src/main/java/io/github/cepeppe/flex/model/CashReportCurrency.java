package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Riepilogo dei movimenti di cassa per valuta.
 * <p>
 * Il fornitore esporta anche le varianti {@code Sec}/{@code Com}/{@code MTD}/{@code YTD} di ogni voce:
 * non sono dichiarate e vengono riportate come schema drift.
 */
@FlexElement("CashReportCurrency")
public record CashReportCurrency(
        String accountId,
        String acctAlias,
        String model,
        String currency,
        String levelOfDetail,
        LocalDate fromDate,
        LocalDate toDate,
        BigDecimal startingCash,
        BigDecimal clientFees,
        BigDecimal commissions,
        BigDecimal billableCommissions,
        BigDecimal depositWithdrawals,
        BigDecimal deposits,
        BigDecimal withdrawals,
        BigDecimal accountTransfers,
        BigDecimal linkingAdjustments,
        BigDecimal internalTransfers,
        BigDecimal dividends,
        BigDecimal insuredDepositInterest,
        BigDecimal brokerInterest,
        BigDecimal bondInterest,
        BigDecimal cashSettlingMtm,
        BigDecimal realizedVm,
        BigDecimal cfdCharges,
        BigDecimal netTradesSales,
        BigDecimal netTradesPurchases,
        BigDecimal advisorFees,
        BigDecimal feesReceivables,
        BigDecimal paymentInLieu,
        BigDecimal transactionTax,
        BigDecimal taxReceivables,
        BigDecimal withholdingTax,
        BigDecimal withholding871m,
        BigDecimal withholdingCollectedTax,
        BigDecimal salesTax,
        BigDecimal fxTranslationGainLoss,
        BigDecimal otherFees,
        BigDecimal other,
        BigDecimal endingCash,
        BigDecimal endingSettledCash
) {
}
