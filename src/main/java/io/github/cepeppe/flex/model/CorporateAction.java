package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.codes.Reorg;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Evento societario (dividendo in titoli, split, fusione, ...).
 */
@FlexElement("CorporateAction")
public record CorporateAction(
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
        LocalDateTime dateTime,
        String actionDescription,
        BigDecimal amount,
        BigDecimal proceeds,
        BigDecimal value,
        BigDecimal quantity,
        BigDecimal fifoPnlRealized,
        BigDecimal mtmPnl,
        List<FlexCode<Code>> code,
        FlexCode<Reorg> type
) {
}
