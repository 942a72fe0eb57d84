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
 * Esecuzione (o ordine, o lotto chiuso) della sezione {@code Trades}.
 * <p>
 * Le quantità sono con segno: negative per le vendite. {@code tradeMoney = quantity * tradePrice},
 * {@code netCash = proceeds + ibCommission + taxes}. Tutti i campi sono facoltativi: un attributo assente
 * è {@code null}, una lista di note assente è vuota.
 *
 * <h2>Date e ore</h2>
 * <ul>
 *   <li>{@code tradeTime} contiene solo l'ora ({@code HHmmss} o {@code HH:mm:ss}).</li>
 *   <li>{@code orderTime}, nonostante il nome, contiene data e ora.</li>
 * </ul>
 */
@FlexElement("Trade")
public record Trade(
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
        String ibOrderID,
        String ibExecID,
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
        Boolean isAPIOrder
) {
}
