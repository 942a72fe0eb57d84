package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;

/**
 * Riconciliazione del valore delle posizioni per classe di attivo.
 */
@FlexElement("ChangeInPositionValue")
public record ChangeInPositionValue(
        String accountId,
        String acctAlias,
        String model,
        String currency,
        FlexCode<AssetClass> assetCategory,
        BigDecimal priorPeriodValue,
        BigDecimal transactions,
        BigDecimal mtmPriorPeriodPositions,
        BigDecimal mtmTransactions,
        BigDecimal corporateActions,
        BigDecimal other,
        BigDecimal accountTransfers,
        BigDecimal linkingAdjustments,
        BigDecimal fxTranslationPnl,
        BigDecimal futurePriceAdjustments,
        BigDecimal settledCash,
        BigDecimal endOfPeriodValue
) {
}
