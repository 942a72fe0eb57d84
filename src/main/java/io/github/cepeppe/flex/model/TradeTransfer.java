package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.DeliveredReceived;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.LevelOfDetail;
import io.github.cepeppe.flex.codes.OpenClose;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.codes.ToFrom;
import io.github.cepeppe.flex.codes.TradeType;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Trade eseguito presso un altro broker e trasferito sul conto.
 */
@FlexElement("TradeTransfer")
public record TradeTransfer(
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
        String brokerName,
        String brokerAccount,
        BigDecimal awayBrokerCommission,
        BigDecimal regulatoryFee,
        FlexCode<ToFrom> direction,
        FlexCode<DeliveredReceived> deliveredReceived,
        BigDecimal netTradeMoney,
        BigDecimal netTradeMoneyInBase,
        BigDecimal netTradePrice
) {
}
