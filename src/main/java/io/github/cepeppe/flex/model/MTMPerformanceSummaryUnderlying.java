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
 * Performance mark-to-market per sottostante, in valuta base.
 */
@FlexElement("MTMPerformanceSummaryUnderlying")
public record MTMPerformanceSummaryUnderlying(
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
        String listingExchange,
        String underlyingSecurityID,
        String underlyingListingExchange,
        LocalDate reportDate,
        BigDecimal prevCloseQuantity,
        BigDecimal prevClosePrice,
        BigDecimal closeQuantity,
        BigDecimal closePrice,
        BigDecimal transactionMtm,
        BigDecimal priorOpenMtm,
        BigDecimal commissions,
        BigDecimal other,
        BigDecimal total,
        List<FlexCode<Code>> code
) {
}
