package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.InOut;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.codes.TransferType;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Trasferimento di titoli in entrata o in uscita.
 */
@FlexElement("Transfer")
public record Transfer(
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
        FlexCode<TransferType> type,
        FlexCode<InOut> direction,
        String company,
        String account,
        String accountName,
        BigDecimal quantity,
        BigDecimal transferPrice,
        BigDecimal positionAmount,
        BigDecimal positionAmountInBase,
        BigDecimal pnlAmount,
        BigDecimal pnlAmountInBase,
        BigDecimal fxPnl,
        BigDecimal cashTransfer,
        List<FlexCode<Code>> code,
        String clientReference
) {
}
