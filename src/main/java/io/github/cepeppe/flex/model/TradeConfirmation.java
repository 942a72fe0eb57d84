package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.BuySell;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.LevelOfDetail;
import io.github.cepeppe.flex.codes.OpenClose;
import io.github.cepeppe.flex.codes.OrderType;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.codes.TradeType;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Conferma d'esecuzione giornaliera (sezione {@code TradeConfirms}).
 */
@FlexElement("TradeConfirm")
public record TradeConfirmation(
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
        String tradeID,
        LocalDate reportDate,
        LocalDate tradeDate,
        LocalTime tradeTime,
        LocalDate settleDateTarget,
        FlexCode<TradeType> transactionType,
        String exchange,
        BigDecimal quantity,
        BigDecimal tradePrice,
        BigDecimal tradeMoney,
        BigDecimal proceeds,
        BigDecimal taxes,
        BigDecimal ibCommission,
        String ibCommissionCurrency,
        BigDecimal netCash,
        BigDecimal closePrice,
        FlexCode<OpenClose> openCloseIndicator,
        List<FlexCode<Code>> notes,
        BigDecimal cost,
        BigDecimal fifoPnlRealized,
        BigDecimal fxPnl,
        BigDecimal mtmPnl,
        BigDecimal origTradePrice,
        LocalDate origTradeDate,
        String origTradeID,
        String origOrderID,
        String clearingFirmID,
        String transactionID,
        LocalDateTime openDateTime,
        LocalDateTime holdingPeriodDateTime,
        LocalDateTime whenRealized,
        LocalDateTime whenReopened,
        FlexCode<LevelOfDetail> levelOfDetail,
        FlexCode<BuySell> buySell,
        String commissionCurrency,
        BigDecimal price,
        BigDecimal thirdPartyClearingCommission,
        String orderID,
        String allocatedTo,
        BigDecimal thirdPartyRegulatoryCommission,
        LocalDateTime dateTime,
        BigDecimal brokerExecutionCommission,
        BigDecimal thirdPartyExecutionCommission,
        BigDecimal amount,
        BigDecimal otherCommission,
        BigDecimal commission,
        BigDecimal brokerClearingCommission,
        String ibOrderID,
        String ibExecID,
        String execID,
        String brokerageOrderID,
        String orderReference,
        String volatilityOrderLink,
        String exchOrderId,
        String extExecID,
        LocalDateTime orderTime,
        BigDecimal changeInPrice,
        BigDecimal changeInQuantity,
        FlexCode<OrderType> orderType,
        String traderID,
        Boolean isAPIOrder,
        List<FlexCode<Code>> code,
        BigDecimal tax,
        String listingExchange,
        String underlyingListingExchange,
        LocalDate settleDate,
        String underlyingSecurityID
) {
}
