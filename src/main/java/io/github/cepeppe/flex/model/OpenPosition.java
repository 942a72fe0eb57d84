package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.LevelOfDetail;
import io.github.cepeppe.flex.codes.LongShort;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Posizione aperta a fine periodo (per simbolo o per lotto, vedi {@code levelOfDetail}).
 */
@FlexElement("OpenPosition")
public record OpenPosition(
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
        LocalDate reportDate,
        BigDecimal position,
        BigDecimal markPrice,
        BigDecimal positionValue,
        BigDecimal openPrice,
        BigDecimal costBasisPrice,
        BigDecimal costBasisMoney,
        BigDecimal percentOfNAV,
        BigDecimal fifoPnlUnrealized,
        FlexCode<LongShort> side,
        FlexCode<LevelOfDetail> levelOfDetail,
        LocalDateTime openDateTime,
        LocalDateTime holdingPeriodDateTime,
        List<FlexCode<Code>> code,
        String originatingOrderID,
        String originatingTransactionID,
        String accruedInt
) {
}
