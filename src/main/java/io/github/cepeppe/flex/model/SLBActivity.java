package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Attività di prestito titoli (securities lending/borrowing).
 */
@FlexElement("SLBActivity")
public record SLBActivity(
        String accountId,
        String acctAlias,
        String model,
        String currency,
        BigDecimal fxRateToBase,
        FlexCode<AssetClass> assetCategory,
        String symbol,
        String description,
        String conid,
        String securityID,
        String securityIDType,
        String cusip,
        String isin,
        String underlyingConid,
        String underlyingSymbol,
        String issuer,
        BigDecimal multiplier,
        BigDecimal strike,
        LocalDate expiry,
        FlexCode<PutCall> putCall,
        BigDecimal principalAdjustFactor,
        LocalDate date,
        String slbTransactionId,
        String activityDescription,
        String type,
        String exchange,
        BigDecimal quantity,
        BigDecimal feeRate,
        BigDecimal collateralAmount,
        BigDecimal markQuantity,
        BigDecimal markPriorPrice,
        BigDecimal markCurrentPrice
) {
}
