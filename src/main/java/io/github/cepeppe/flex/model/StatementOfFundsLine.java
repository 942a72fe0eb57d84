package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.BuySell;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Riga dello statement of funds: un movimento di cassa con il saldo progressivo.
 */
@FlexElement("StatementOfFundsLine")
public record StatementOfFundsLine(
        String accountId,
        String acctAlias,
        String model,
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
        String currency,
        BigDecimal fxRateToBase,
        LocalDate reportDate,
        LocalDate date,
        String activityCode,
        String activityDescription,
        String tradeID,
        BigDecimal debit,
        BigDecimal credit,
        BigDecimal amount,
        BigDecimal balance,
        FlexCode<BuySell> buySell,
        String levelOfDetail
) {
}
