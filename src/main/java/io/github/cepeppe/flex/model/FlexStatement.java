package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexAttribute;
import io.github.cepeppe.flex.schema.FlexElement;
import io.github.cepeppe.flex.schema.FlexSection;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Un periodo di reporting per un conto.
 *
 * <h2>Sezioni</h2>
 * <ul>
 *   <li>Ogni sezione ripetuta è una lista nell'ordine del documento; una sezione assente è una lista vuota,
 *       mai {@code null}.</li>
 *   <li>{@code accountInformation} e {@code changeInNAV} sono elementi singoli: {@code null} se assenti.</li>
 *   <li>{@code fxLots} proviene dal doppio wrapper {@code FxPositions/FxLots}.</li>
 * </ul>
 *
 * <h2>Campi obbligatori</h2>
 * {@code accountId}, {@code fromDate}, {@code toDate}.
 */
@FlexElement("FlexStatement")
public record FlexStatement(
        @FlexAttribute(required = true) String accountId,
        @FlexAttribute(required = true) LocalDate fromDate,
        @FlexAttribute(required = true) LocalDate toDate,
        String period,
        LocalDateTime whenGenerated,

        AccountInformation accountInformation,
        ChangeInNAV changeInNAV,

        @FlexSection("EquitySummaryInBase") List<EquitySummaryByReportDateInBase> equitySummaryInBase,
        @FlexSection("CashReport") List<CashReportCurrency> cashReport,
        @FlexSection("StmtFunds") List<StatementOfFundsLine> stmtFunds,
        @FlexSection("ChangeInPositionValues") List<ChangeInPositionValue> changeInPositionValues,
        @FlexSection("OpenPositions") List<OpenPosition> openPositions,
        @FlexSection(value = "FxPositions", nested = "FxLots") List<FxLot> fxLots,
        @FlexSection("Trades") List<Trade> trades,
        @FlexSection("TradeConfirms") List<TradeConfirmation> tradeConfirms,
        @FlexSection("OptionEAE") List<OptionEAE> optionEAE,
        @FlexSection("TradeTransfers") List<TradeTransfer> tradeTransfers,
        @FlexSection("CashTransactions") List<CashTransaction> cashTransactions,
        @FlexSection("InterestAccruals") List<InterestAccrualsCurrency> interestAccruals,
        @FlexSection("SLBActivities") List<SLBActivity> slbActivities,
        @FlexSection("Transfers") List<Transfer> transfers,
        @FlexSection("CorporateActions") List<CorporateAction> corporateActions,
        @FlexSection("ChangeInDividendAccruals") List<ChangeInDividendAccrual> changeInDividendAccruals,
        @FlexSection("OpenDividendAccruals") List<OpenDividendAccrual> openDividendAccruals,
        @FlexSection("SecuritiesInfo") List<SecurityInfo> securitiesInfo,
        @FlexSection("ConversionRates") List<ConversionRate> conversionRates,
        @FlexSection("PriorPeriodPositions") List<PriorPeriodPosition> priorPeriodPositions,
        @FlexSection("MTMPerformanceSummaryInBase") List<MTMPerformanceSummaryUnderlying> mtmPerformanceSummaryInBase
) {

    public FlexStatement {
        equitySummaryInBase = immutable(equitySummaryInBase);
        cashReport = immutable(cashReport);
        stmtFunds = immutable(stmtFunds);
        changeInPositionValues = immutable(changeInPositionValues);
        openPositions = immutable(openPositions);
        fxLots = immutable(fxLots);
        trades = immutable(trades);
        tradeConfirms = immutable(tradeConfirms);
        optionEAE = immutable(optionEAE);
        tradeTransfers = immutable(tradeTransfers);
        cashTransactions = immutable(cashTransactions);
        interestAccruals = immutable(interestAccruals);
        slbActivities = immutable(slbActivities);
        transfers = immutable(transfers);
        corporateActions = immutable(corporateActions);
        changeInDividendAccruals = immutable(changeInDividendAccruals);
        openDividendAccruals = immutable(openDividendAccruals);
        securitiesInfo = immutable(securitiesInfo);
        conversionRates = immutable(conversionRates);
        priorPeriodPositions = immutable(priorPeriodPositions);
        mtmPerformanceSummaryInBase = immutable(mtmPerformanceSummaryInBase);
    }

    /**
     * Tasso di cambio pubblicato nello statement, con la chiave usata dal fornitore
     * (valuta di origine, valuta di destinazione, data).
     */
    public Optional<BigDecimal> conversionRate(String fromCurrency, String toCurrency, LocalDate reportDate) {
        for (ConversionRate r : conversionRates) {
            if (Objects.equals(r.fromCurrency(), fromCurrency)
                    && Objects.equals(r.toCurrency(), toCurrency)
                    && Objects.equals(r.reportDate(), reportDate)) {
                return Optional.of(r.rate());
            }
        }
        return Optional.empty();
    }

    private static <T> List<T> immutable(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }
}
