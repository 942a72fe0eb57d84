package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.CashAction;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.LevelOfDetail;
import io.github.cepeppe.flex.codes.PutCall;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Movimento di cassa: deposito, prelievo, dividendo, interesse, ritenuta, commissione.
 *
 * @param dateTime        la data (a volte con ora) del movimento; una data sola vale mezzanotte
 * @param amount          l'importo con segno, nella valuta del movimento
 * @param type            la categoria del movimento
 * @param tradeID         il trade collegato, se presente
 * @param code            i flag del movimento (es. storno {@code Re})
 * @param transactionID   l'identificativo univoco del movimento
 * @param reportDate      la data di contabilizzazione
 * @param settleDate      la data di regolamento
 * @param exDate          la data di stacco (dividendi)
 * @param levelOfDetail   il livello di dettaglio della riga
 * @param clientReference il riferimento del cliente
 */
@FlexElement("CashTransaction")
public record CashTransaction(
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
        LocalDateTime dateTime,
        BigDecimal amount,
        FlexCode<CashAction> type,
        String tradeID,
        List<FlexCode<Code>> code,
        String transactionID,
        LocalDate reportDate,
        LocalDate settleDate,
        LocalDate exDate,
        FlexCode<LevelOfDetail> levelOfDetail,
        String clientReference
) {
}
