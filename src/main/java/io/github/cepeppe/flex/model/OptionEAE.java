package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.OptionAction;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Esercizio, assegnazione o scadenza di un'opzione.
 * <p>
 * Wrapper e item hanno lo stesso nome ({@code <OptionEAE><OptionEAE/></OptionEAE>}).
 * {@code commisionsAndTax} riproduce il nome dell'attributo così come esportato.
 */
@FlexElement("OptionEAE")
public record OptionEAE(
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
        FlexCode<OptionAction> transactionType,
        BigDecimal quantity,
        BigDecimal tradePrice,
        BigDecimal markPrice,
        BigDecimal proceeds,
        BigDecimal commisionsAndTax,
        BigDecimal costBasis,
        BigDecimal realizedPnl,
        BigDecimal fxPnl,
        BigDecimal mtmPnl,
        String tradeID
) {
}
