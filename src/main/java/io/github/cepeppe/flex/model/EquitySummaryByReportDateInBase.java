package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Patrimonio per classe di attivo a una data di report, in valuta base.
 * Ogni voce ha il totale e le componenti {@code Long}/{@code Short}.
 */
@FlexElement("EquitySummaryByReportDateInBase")
public record EquitySummaryByReportDateInBase(
        String accountId,
        String acctAlias,
        String model,
        LocalDate reportDate,
        BigDecimal cash,
        BigDecimal cashLong,
        BigDecimal cashShort,
        BigDecimal slbCashCollateral,
        BigDecimal slbCashCollateralLong,
        BigDecimal slbCashCollateralShort,
        BigDecimal stock,
        BigDecimal stockLong,
        BigDecimal stockShort,
        BigDecimal slbDirectSecuritiesBorrowed,
        BigDecimal slbDirectSecuritiesBorrowedLong,
        BigDecimal slbDirectSecuritiesBorrowedShort,
        BigDecimal slbDirectSecuritiesLent,
        BigDecimal slbDirectSecuritiesLentLong,
        BigDecimal slbDirectSecuritiesLentShort,
        BigDecimal options,
        BigDecimal optionsLong,
        BigDecimal optionsShort,
        BigDecimal commodities,
        BigDecimal commoditiesLong,
        BigDecimal commoditiesShort,
        BigDecimal bonds,
        BigDecimal bondsLong,
        BigDecimal bondsShort,
        BigDecimal notes,
        BigDecimal notesLong,
        BigDecimal notesShort,
        BigDecimal funds,
        BigDecimal fundsLong,
        BigDecimal fundsShort,
        BigDecimal interestAccruals,
        BigDecimal interestAccrualsLong,
        BigDecimal interestAccrualsShort,
        BigDecimal softDollars,
        BigDecimal softDollarsLong,
        BigDecimal softDollarsShort,
        BigDecimal forexCfdUnrealizedPl,
        BigDecimal forexCfdUnrealizedPlLong,
        BigDecimal forexCfdUnrealizedPlShort,
        BigDecimal dividendAccruals,
        BigDecimal dividendAccrualsLong,
        BigDecimal dividendAccrualsShort,
        BigDecimal fdicInsuredBankSweepAccount,
        BigDecimal fdicInsuredBankSweepAccountLong,
        BigDecimal fdicInsuredBankSweepAccountShort,
        BigDecimal fdicInsuredBankSweepAccountCashComponent,
        BigDecimal fdicInsuredBankSweepAccountCashComponentLong,
        BigDecimal fdicInsuredBankSweepAccountCashComponentShort,
        BigDecimal fdicInsuredAccountInterestAccruals,
        BigDecimal fdicInsuredAccountInterestAccrualsLong,
        BigDecimal fdicInsuredAccountInterestAccrualsShort,
        BigDecimal fdicInsuredAccountInterestAccrualsComponent,
        BigDecimal fdicInsuredAccountInterestAccrualsComponentLong,
        BigDecimal fdicInsuredAccountInterestAccrualsComponentShort,
        BigDecimal total,
        BigDecimal totalLong,
        BigDecimal totalShort,
        BigDecimal brokerInterestAccrualsComponent,
        BigDecimal brokerCashComponent,
        BigDecimal cfdUnrealizedPl
) {
}
