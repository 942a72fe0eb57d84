package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Variazione di un dividendo maturato.
 */
@FlexElement("ChangeInDividendAccrual")
public record ChangeInDividendAccrual(
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
        LocalDate date,
        LocalDate exDate,
        LocalDate payDate,
        BigDecimal quantity,
        BigDecimal tax,
        BigDecimal fee,
        BigDecimal grossRate,
        BigDecimal grossAmount,
        BigDecimal netAmount,
        List<FlexCode<Code>> code,
        String fromAcct,
        String toAcct
) {
}
